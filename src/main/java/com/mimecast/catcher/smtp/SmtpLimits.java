package com.mimecast.catcher.smtp;

/**
 * SMTP size limits.
 *
 * <p>Values follow RFC 5321 section 4.5.3.1 except for the data limit which bounds in-memory storage.
 * <p>All lengths are measured in UTF-8 bytes.
 */
public final class SmtpLimits {

    private SmtpLimits() {
        // Utility class.
    }

    /**
     * Maximum length of the local part of an address.
     */
    public static final int USER_MAX_LENGTH = 64;

    /**
     * Maximum length of a domain name.
     */
    public static final int DOMAIN_MAX_LENGTH = 64;

    /**
     * Maximum length of a reverse-path or forward-path.
     */
    public static final int PATH_MAX_LENGTH = 256;

    /**
     * Maximum length of a command line.
     */
    public static final int COMMAND_LINE_MAX_LENGTH = 512;

    /**
     * Maximum length of a reply including CRLF.
     */
    public static final int REPLY_LINE_MAX_LENGTH = 512;

    /**
     * Maximum length of a data text line including CRLF.
     */
    public static final int TEXT_LINE_MAX_LENGTH = 1000;

    /**
     * Bytes accounted for the line terminator of every data line.
     */
    public static final int LINE_TERMINATOR_LENGTH = 2;

    /**
     * Maximum recipients per transaction.
     */
    public static final int MAX_RECIPIENTS = 100;

    /**
     * Maximum total size of the data of one transaction.
     */
    public static final int MAX_DATA_SIZE = 10 * 1024 * 1024;
}
