package com.mimecast.catcher.smtp.sink;

import com.mimecast.catcher.smtp.Email;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue backed email sink.
 *
 * <p>Emails are offered to a {@link BlockingQueue} which any number of consumers may poll.
 * <p>Offering never blocks, emails are dropped when the queue is full or the sink is closed.
 */
public class QueueEmailSink implements EmailSink {
    private static final Logger log = LogManager.getLogger(QueueEmailSink.class);

    private final BlockingQueue<Email> queue;
    private volatile boolean closed = false;

    /**
     * Constructs a new unbounded QueueEmailSink instance.
     */
    public QueueEmailSink() {
        this(new LinkedBlockingQueue<>());
    }

    /**
     * Constructs a new bounded QueueEmailSink instance.
     *
     * @param capacity Maximum queued emails.
     */
    public QueueEmailSink(int capacity) {
        this(new LinkedBlockingQueue<>(capacity));
    }

    /**
     * Constructs a new QueueEmailSink instance with given queue.
     *
     * @param queue BlockingQueue instance.
     */
    public QueueEmailSink(BlockingQueue<Email> queue) {
        this.queue = queue;
    }

    @Override
    public boolean accept(Email email) {
        if (closed) {
            log.debug("Sink closed, dropping email from {}", email.getFrom());
            return false;
        }

        boolean offered = queue.offer(email);
        if (!offered) {
            log.warn("Sink full, dropping email from {}", email.getFrom());
        }

        return offered;
    }

    /**
     * Waits for the next email.
     *
     * @param timeout Timeout value.
     * @param unit    Timeout unit.
     * @return Email or null on timeout.
     * @throws InterruptedException Interrupted while waiting.
     */
    public Email poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Waits for the next email without limit.
     *
     * @return Email instance.
     * @throws InterruptedException Interrupted while waiting.
     */
    public Email take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Removes all queued emails.
     *
     * @return List of Email.
     */
    public List<Email> drain() {
        List<Email> emails = new ArrayList<>();
        queue.drainTo(emails);
        return emails;
    }

    /**
     * Gets number of queued emails.
     *
     * @return Count.
     */
    public int size() {
        return queue.size();
    }

    /**
     * Stops accepting emails.
     * <p>Queued emails remain available.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
