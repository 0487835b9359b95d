package com.mimecast.catcher.smtp.session;

/**
 * SMTP session states.
 */
public enum SessionState {
    /**
     * Waiting for HELO.
     */
    INITIAL,

    /**
     * HELO received, ready for MAIL.
     */
    GREETING_RECEIVED,

    /**
     * MAIL received, ready for RCPT.
     */
    MAIL_RECEIVED,

    /**
     * At least one RCPT received, ready for DATA or more RCPT.
     */
    RECIPIENTS_RECEIVED,

    /**
     * DATA accepted, collecting message lines.
     */
    DATA_MODE
}
