package com.mimecast.catcher.smtp.verb;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Verb parser.
 *
 * <p>Splits a command line on whitespace.
 * <br>The first part is the command, the rest are its arguments.
 */
public class Verb {

    /**
     * Whitespace separated parts.
     */
    private final List<String> parts;

    /**
     * Constructs a new Verb instance.
     *
     * @param line Command line without terminator.
     */
    public Verb(String line) {
        String[] split = StringUtils.split(line);
        this.parts = split != null ? Arrays.asList(split) : Collections.emptyList();
    }

    /**
     * Is empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /**
     * Gets command part as sent.
     *
     * @return Command string, empty if the line is blank.
     */
    public String getVerb() {
        return parts.isEmpty() ? "" : parts.get(0);
    }

    /**
     * Gets lower case command key.
     *
     * @return Key string.
     */
    public String getKey() {
        return getVerb().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets command.
     *
     * @return Optional of Command.
     */
    public Optional<Command> getCommand() {
        return Command.of(getVerb());
    }

    /**
     * Gets parts count including the command.
     *
     * @return Count.
     */
    public int getCount() {
        return parts.size();
    }

    /**
     * Gets part at index.
     *
     * @param index Index.
     * @return Part string.
     */
    public String getPart(int index) {
        return parts.get(index);
    }

    /**
     * Gets arguments joined by a single space.
     *
     * @return Arguments string, empty if none.
     */
    public String getArguments() {
        return parts.size() > 1 ? String.join(" ", parts.subList(1, parts.size())) : "";
    }
}
