package com.mimecast.catcher.smtp.command;

import com.mimecast.catcher.smtp.Email;
import com.mimecast.catcher.smtp.SmtpResponse;
import com.mimecast.catcher.smtp.SmtpResponses;
import com.mimecast.catcher.smtp.error.SmtpException;
import com.mimecast.catcher.smtp.metrics.SmtpMetrics;
import com.mimecast.catcher.smtp.session.Session;
import com.mimecast.catcher.smtp.sink.EmailSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * DATA line collector.
 *
 * <p>Buffers message lines in the session until a line made of a single dot arrives.
 * <br>Lines are stored verbatim, no dot-unstuffing is done.
 * <p>Any failure aborts the transaction, the client domain is kept and the connection stays usable.
 */
public class DataCollector {
    private static final Logger log = LogManager.getLogger(DataCollector.class);

    /**
     * End of data marker.
     */
    public static final String TERMINATOR = ".";

    private final EmailSink sink;

    /**
     * Constructs a new DataCollector instance.
     *
     * @param sink EmailSink instance.
     */
    public DataCollector(EmailSink sink) {
        this.sink = sink;
    }

    /**
     * Collects a line.
     *
     * @param line    Line without terminator.
     * @param session Session instance.
     * @return Optional of SmtpResponse, empty while collecting.
     * @throws SmtpException Not collecting, line too long or too much data.
     */
    public Optional<SmtpResponse> collect(String line, Session session) throws SmtpException {
        if (!session.isInDataMode()) {
            throw SmtpException.invalidState("Not in data collection mode");
        }

        try {
            if (TERMINATOR.equals(line)) {
                deliver(session.finishDataCollection());
                return Optional.of(SmtpResponses.OK_250);
            }

            session.addDataLine(line);
            return Optional.empty();

        } catch (SmtpException e) {
            log.info("Session {} data aborted: {}", session.getUID(), e.getMessage());
            session.reset();
            throw e;
        }
    }

    /**
     * Hands the email to the sink.
     * <p>Sink failures are logged and do not fail the transaction.
     *
     * @param email Email instance.
     */
    private void deliver(Email email) {
        SmtpMetrics.incrementEmailReceiptSuccess();
        try {
            if (!sink.accept(email)) {
                log.debug("Email from {} dropped by sink", email.getFrom());
            }
        } catch (RuntimeException e) {
            log.warn("Email sink error: {}", e.getMessage());
        }
    }
}
