package com.mimecast.catcher.smtp.verb;

import com.mimecast.catcher.smtp.error.SmtpException;

import java.util.Locale;

/**
 * MAIL and RCPT verb parser.
 *
 * <p>Extracts the address from {@code MAIL FROM:<address>} and {@code RCPT TO:<address>}.
 * <br>Parameters after the closing bracket are not supported.
 */
public class PathVerb {

    /**
     * Extracted address.
     */
    private final String address;

    /**
     * Constructs a new PathVerb instance.
     *
     * @param verb    Verb instance.
     * @param keyword Path keyword, FROM or TO.
     * @throws SmtpException Malformed path.
     */
    public PathVerb(Verb verb, String keyword) throws SmtpException {
        String command = verb.getVerb().toUpperCase(Locale.ROOT);
        String prefix = keyword + ":";

        if (verb.getCount() < 2) {
            throw SmtpException.invalidSyntax(command + " requires " + keyword + " argument");
        }

        String arguments = verb.getArguments();
        if (!arguments.regionMatches(true, 0, prefix, 0, prefix.length())) {
            throw SmtpException.invalidSyntax(command + " command must be '" + command + " " + prefix + "<address>'");
        }

        String path = arguments.substring(prefix.length()).trim();
        if (path.length() < 2 || !path.startsWith("<") || !path.endsWith(">")) {
            throw SmtpException.invalidSyntax(keyword + " address must be enclosed in angle brackets");
        }

        String inner = path.substring(1, path.length() - 1);
        if (inner.indexOf('<') >= 0 || inner.indexOf('>') >= 0) {
            throw SmtpException.invalidSyntax(keyword + " address must be enclosed in angle brackets");
        }

        if (inner.isEmpty()) {
            throw SmtpException.invalidSyntax(keyword + " address cannot be empty");
        }

        this.address = inner;
    }

    /**
     * Gets address.
     *
     * @return Address string without brackets.
     */
    public String getAddress() {
        return address;
    }
}
