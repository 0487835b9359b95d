package com.mimecast.catcher.smtp.sink;

import com.mimecast.catcher.smtp.Email;

/**
 * Receiver of completed emails.
 *
 * <p>Implementations must not block the calling connection thread.
 * <br>When nobody is listening the email is dropped.
 */
@FunctionalInterface
public interface EmailSink {

    /**
     * Hands over an email.
     *
     * @param email Email instance.
     * @return True if accepted, false if dropped.
     */
    boolean accept(Email email);
}
