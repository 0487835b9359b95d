package com.mimecast.catcher.smtp.error;

import com.mimecast.catcher.smtp.SmtpResponse;

/**
 * SMTP error kinds.
 *
 * <p>This enum is the single mapping table from a failure to its reply code and canonical message.
 * <p>Templated messages take one argument, either a detail string or a limit value.
 * <p>The texts are relied upon by existing clients and must not change.
 */
public enum SmtpError {
    IO("421", "Service not available"),
    INVALID_COMMAND("500", "Syntax error, command unrecognized"),
    INVALID_STATE("503", "Bad sequence of commands: %s"),
    INVALID_SYNTAX("501", "Syntax error: %s"),
    LINE_TOO_LONG("500", "Line too long (max %s characters)"),
    PATH_TOO_LONG("501", "Path too long (max %s characters)"),
    TOO_MANY_RECIPIENTS("552", "Too many recipients (max %s)"),
    TOO_MUCH_DATA("552", "Too much mail data (max %s bytes)"),
    DOMAIN_TOO_LONG("501", "Domain name too long (max %s characters)"),
    USER_TOO_LONG("501", "User name too long (max %s characters)"),
    NON_UTF8_DATA("500", "Invalid character encoding"),
    CONNECTION_CLOSED("421", "Connection closed"),
    PROTOCOL_VIOLATION("500", "Protocol violation");

    private final String code;
    private final String template;

    SmtpError(String code, String template) {
        this.code = code;
        this.template = template;
    }

    /**
     * Gets reply code.
     *
     * @return Three digit code string.
     */
    public String getCode() {
        return code;
    }

    /**
     * Is message templated.
     *
     * @return Boolean.
     */
    public boolean isTemplated() {
        return template.contains("%s");
    }

    /**
     * Renders the canonical message.
     *
     * @param argument Detail or limit, ignored for fixed messages.
     * @return Message string.
     */
    public String format(Object argument) {
        return isTemplated() ? String.format(template, argument) : template;
    }

    /**
     * Maps to a reply.
     *
     * @param argument Detail or limit, ignored for fixed messages.
     * @return SmtpResponse instance.
     */
    public SmtpResponse toResponse(Object argument) {
        return new SmtpResponse(code, format(argument));
    }
}
