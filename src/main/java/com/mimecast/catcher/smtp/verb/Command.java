package com.mimecast.catcher.smtp.verb;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported SMTP commands.
 */
public enum Command {
    HELO,
    EHLO,
    MAIL,
    RCPT,
    DATA,
    RSET,
    NOOP,
    QUIT;

    /**
     * Looks up a command by name, case insensitive.
     *
     * @param name Command name.
     * @return Optional of Command.
     */
    public static Optional<Command> of(String name) {
        if (name == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
