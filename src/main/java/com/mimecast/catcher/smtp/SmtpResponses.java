package com.mimecast.catcher.smtp;

import java.util.List;

/**
 * SMTP response constants.
 *
 * <p>This class contains the canned replies used by the server.
 * <br>Error replies are not listed here, they come from {@link com.mimecast.catcher.smtp.error.SmtpError}.
 */
public final class SmtpResponses {

    private SmtpResponses() {
        // Utility class.
    }

    // ========== 2xx Success Codes ==========

    /**
     * 220 Service ready.
     */
    public static final String GREETING_220 = "220";

    /**
     * Default greeting text.
     */
    public static final String GREETING_DEFAULT = "Welcome to Catcher";

    /**
     * 221 Closing connection.
     */
    public static final SmtpResponse CLOSING_221 = new SmtpResponse("221", "Bye");

    /**
     * 250 Requested action okay.
     */
    public static final SmtpResponse OK_250 = new SmtpResponse("250", "OK");

    /**
     * 250 HELO and EHLO welcome, format with hostname and client domain.
     */
    public static final String WELCOME_250 = "%s Hello %s";

    // ========== 3xx Intermediate Codes ==========

    /**
     * 354 Start mail input.
     */
    public static final SmtpResponse DATA_START_354 = new SmtpResponse("354", "End data with <CR><LF>.<CR><LF>");

    // ========== Other ==========

    /**
     * Replacement text for replies over the size limit.
     */
    public static final String TRUNCATED = "Response too long (truncated)";

    /**
     * Greeting reply.
     *
     * @param text Greeting text.
     * @return SmtpResponse instance.
     */
    public static SmtpResponse greeting(String text) {
        return new SmtpResponse(GREETING_220, text);
    }

    /**
     * HELO reply.
     *
     * @param hostname     Server hostname.
     * @param clientDomain Client domain.
     * @return SmtpResponse instance.
     */
    public static SmtpResponse helo(String hostname, String clientDomain) {
        return new SmtpResponse("250", String.format(WELCOME_250, hostname, clientDomain));
    }

    /**
     * EHLO reply with capability block.
     *
     * @param hostname     Server hostname.
     * @param clientDomain Client domain.
     * @param capabilities Capability lines, a single line reply is returned when empty.
     * @return SmtpResponse instance.
     */
    public static SmtpResponse ehlo(String hostname, String clientDomain, List<String> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return helo(hostname, clientDomain);
        }

        return new SmtpResponse("250", String.format(WELCOME_250, hostname, clientDomain), capabilities);
    }
}
