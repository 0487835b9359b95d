package com.mimecast.catcher.smtp.error;

import com.mimecast.catcher.smtp.SmtpResponse;

/**
 * Recoverable protocol failure.
 *
 * <p>Carries one {@link SmtpError} kind and the value needed to render its message.
 * <p>It is converted to a reply by {@link #toResponse()} as soon as it reaches the connection.
 */
public class SmtpException extends Exception {

    /**
     * Error kind.
     */
    private final SmtpError error;

    /**
     * Message argument.
     */
    private final transient Object argument;

    /**
     * Constructs a new SmtpException instance for a fixed message kind.
     *
     * @param error SmtpError kind.
     */
    public SmtpException(SmtpError error) {
        this(error, null);
    }

    /**
     * Constructs a new SmtpException instance.
     *
     * @param error    SmtpError kind.
     * @param argument Detail string or limit value.
     */
    public SmtpException(SmtpError error, Object argument) {
        super(error.format(argument));
        this.error = error;
        this.argument = argument;
    }

    /**
     * Bad sequence of commands.
     *
     * @param detail Detail string.
     * @return SmtpException instance.
     */
    public static SmtpException invalidState(String detail) {
        return new SmtpException(SmtpError.INVALID_STATE, detail);
    }

    /**
     * Malformed argument.
     *
     * @param detail Detail string.
     * @return SmtpException instance.
     */
    public static SmtpException invalidSyntax(String detail) {
        return new SmtpException(SmtpError.INVALID_SYNTAX, detail);
    }

    /**
     * Gets error kind.
     *
     * @return SmtpError.
     */
    public SmtpError getError() {
        return error;
    }

    /**
     * Gets message argument.
     *
     * @return Object or null.
     */
    public Object getArgument() {
        return argument;
    }

    /**
     * Maps to a reply.
     *
     * @return SmtpResponse instance.
     */
    public SmtpResponse toResponse() {
        return error.toResponse(argument);
    }
}
