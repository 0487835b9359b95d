package com.mimecast.catcher.smtp;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SMTP reply.
 *
 * <p>Immutable reply made of a three digit code, a message and an optional multi-line body.
 * <p>The multi-line body is used for the EHLO capability block.
 *
 * @see SmtpResponses
 */
public final class SmtpResponse {

    /**
     * Line terminator.
     */
    public static final String CRLF = "\r\n";

    private final String code;
    private final String message;
    private final List<String> multiline;

    /**
     * Constructs a new single line SmtpResponse instance.
     *
     * @param code    Reply code.
     * @param message Reply message.
     */
    public SmtpResponse(String code, String message) {
        this(code, message, null);
    }

    /**
     * Constructs a new SmtpResponse instance with multi-line body.
     *
     * @param code      Reply code.
     * @param message   Reply message rendered as the first line.
     * @param multiline Body lines or null.
     */
    public SmtpResponse(String code, String message, List<String> multiline) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.multiline = multiline != null ? List.copyOf(multiline) : null;
    }

    /**
     * Parses a single reply line.
     * <p>The line may or may not end with CRLF.
     *
     * @param line Reply line.
     * @return Optional of SmtpResponse, empty if the line is not a reply.
     */
    public static Optional<SmtpResponse> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }

        String stripped = line.endsWith(CRLF) ? line.substring(0, line.length() - CRLF.length()) : line;
        if (stripped.length() < 4 || stripped.charAt(3) != ' ') {
            return Optional.empty();
        }

        String replyCode = stripped.substring(0, 3);
        for (int i = 0; i < replyCode.length(); i++) {
            if (!Character.isDigit(replyCode.charAt(i))) {
                return Optional.empty();
            }
        }

        return Optional.of(new SmtpResponse(replyCode, stripped.substring(4)));
    }

    /**
     * Gets code.
     *
     * @return Code string.
     */
    public String getCode() {
        return code;
    }

    /**
     * Gets message.
     *
     * @return Message string.
     */
    public String getMessage() {
        return message;
    }

    /**
     * Gets multi-line body.
     *
     * @return Unmodifiable list, empty for single line replies.
     */
    public List<String> getMultiline() {
        return multiline != null ? multiline : Collections.emptyList();
    }

    /**
     * Is multi-line.
     *
     * @return Boolean.
     */
    public boolean isMultiline() {
        return multiline != null;
    }

    /**
     * Is success (2xx).
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return code.startsWith("2");
    }

    /**
     * Is error (4xx or 5xx).
     *
     * @return Boolean.
     */
    public boolean isError() {
        return code.startsWith("4") || code.startsWith("5");
    }

    /**
     * Formats the reply for the wire.
     *
     * @return String with CRLF line endings.
     */
    public String format() {
        if (multiline == null || multiline.isEmpty()) {
            return code + " " + message + CRLF;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(code).append('-').append(message).append(CRLF);
        for (int i = 0; i < multiline.size(); i++) {
            char separator = i == multiline.size() - 1 ? ' ' : '-';
            sb.append(code).append(separator).append(multiline.get(i)).append(CRLF);
        }

        return sb.toString();
    }

    /**
     * Formats the reply for the wire within a size limit.
     * <p>Oversized replies are replaced by a fixed message under the same code.
     *
     * @param maxLength Maximum bytes.
     * @return String with CRLF line endings.
     */
    public String toWire(int maxLength) {
        String formatted = format();
        if (formatted.getBytes(StandardCharsets.UTF_8).length > maxLength) {
            return new SmtpResponse(code, SmtpResponses.TRUNCATED).format();
        }

        return formatted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SmtpResponse)) return false;
        SmtpResponse that = (SmtpResponse) o;
        return code.equals(that.code) && message.equals(that.message) && Objects.equals(multiline, that.multiline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, multiline);
    }

    @Override
    public String toString() {
        return code + " " + message;
    }
}
