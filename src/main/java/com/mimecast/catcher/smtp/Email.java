package com.mimecast.catcher.smtp;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Received email.
 *
 * <p>Immutable value produced once per completed transaction and handed over to the email sink.
 * <p>The data is the raw body text with lines joined by a single LF.
 */
public final class Email {

    /**
     * Envelope sender.
     */
    private final String from;

    /**
     * Envelope recipients in the order they were accepted.
     */
    private final List<String> to;

    /**
     * Raw message text.
     */
    private final String data;

    /**
     * Receipt time.
     */
    private final Instant receivedAt;

    /**
     * Constructs a new Email instance received now.
     *
     * @param from Envelope sender.
     * @param to   Envelope recipients.
     * @param data Message text.
     */
    public Email(String from, List<String> to, String data) {
        this(from, to, data, Instant.now());
    }

    /**
     * Constructs a new Email instance.
     *
     * @param from       Envelope sender.
     * @param to         Envelope recipients, must not be empty.
     * @param data       Message text.
     * @param receivedAt Receipt time.
     */
    public Email(String from, List<String> to, String data, Instant receivedAt) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = List.copyOf(to);
        if (this.to.isEmpty()) {
            throw new IllegalArgumentException("Email requires at least one recipient");
        }
        this.data = Objects.requireNonNull(data, "data");
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public String getFrom() {
        return from;
    }

    public List<String> getTo() {
        return to;
    }

    public String getData() {
        return data;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    /**
     * Was sent to given recipient.
     *
     * @param recipient Address.
     * @return Boolean.
     */
    public boolean hasRecipient(String recipient) {
        return to.contains(recipient);
    }

    /**
     * Was sent by given sender.
     *
     * @param sender Address.
     * @return Boolean.
     */
    public boolean isFromSender(String sender) {
        return from.equals(sender);
    }

    /**
     * Gets data size in bytes.
     *
     * @return Size.
     */
    public int getDataSize() {
        return data.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Gets the subject header value.
     * <p>Only the header block, up to the first empty line, is searched.
     *
     * @return Optional of String.
     */
    public Optional<String> getSubject() {
        for (String line : data.split("\n", -1)) {
            if (line.isEmpty()) {
                break;
            }
            if (line.startsWith("Subject: ") || line.startsWith("subject: ")) {
                return Optional.of(line.substring("Subject: ".length()));
            }
        }

        return Optional.empty();
    }

    /**
     * Gets the body following the first empty line.
     *
     * @return Optional of String, empty if there is no body.
     */
    public Optional<String> getBody() {
        int index;
        if (data.startsWith("\n")) {
            index = 1;
        } else {
            int separator = data.indexOf("\n\n");
            if (separator < 0) {
                return Optional.empty();
            }
            index = separator + 2;
        }

        return index < data.length() ? Optional.of(data.substring(index)) : Optional.empty();
    }

    /**
     * Contains text in headers or body.
     *
     * @param text Text to look for.
     * @return Boolean.
     */
    public boolean containsText(String text) {
        return data.contains(text);
    }

    @Override
    public String toString() {
        return "Email{from=" + from + ", to=" + to + ", size=" + data.length() + ", receivedAt=" + receivedAt + "}";
    }
}
