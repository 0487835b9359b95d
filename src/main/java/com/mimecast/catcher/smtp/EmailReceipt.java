package com.mimecast.catcher.smtp;

import com.mimecast.catcher.smtp.command.CommandHandler;
import com.mimecast.catcher.smtp.command.DataCollector;
import com.mimecast.catcher.smtp.connection.Connection;
import com.mimecast.catcher.smtp.error.SmtpError;
import com.mimecast.catcher.smtp.error.SmtpException;
import com.mimecast.catcher.smtp.metrics.SmtpMetrics;
import com.mimecast.catcher.smtp.session.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Optional;

/**
 * Email receipt runnable.
 *
 * <p>This is used to create threads for incoming connections.
 * <p>A new instance will be constructed for every socket connection the server receives.
 * <p>It owns the connection {@link Session} exclusively.
 */
public class EmailReceipt implements Runnable {
    private static final Logger log = LogManager.getLogger(EmailReceipt.class);

    /**
     * Connection instance.
     */
    private final Connection connection;

    /**
     * Session instance.
     */
    private final Session session = new Session();

    private final CommandHandler commandHandler;
    private final DataCollector dataCollector;

    /**
     * Greeting text.
     */
    private final String greeting;

    /**
     * Constructs a new EmailReceipt instance.
     *
     * @param connection     Connection instance.
     * @param commandHandler CommandHandler instance.
     * @param dataCollector  DataCollector instance.
     * @param greeting       Greeting text.
     */
    public EmailReceipt(Connection connection, CommandHandler commandHandler, DataCollector dataCollector, String greeting) {
        this.connection = connection;
        this.commandHandler = commandHandler;
        this.dataCollector = dataCollector;
        this.greeting = greeting;
    }

    /**
     * Server receipt runner.
     * <p>The loop begins after the welcome message is sent.
     * <p>It stops after QUIT, when the client closes the stream or on I/O failure.
     * <p>Once the loop breaks the connection is closed.
     */
    @Override
    public void run() {
        try {
            connection.write(SmtpResponses.greeting(greeting));
            SmtpMetrics.incrementEmailReceiptStart();

            String line;
            while ((line = connection.read()) != null) {
                if (!process(line)) {
                    break;
                }
            }

            if (line == null) {
                log.debug("Session {} closed by client {}", session.getUID(), connection.getRemote());
            }
        } catch (SocketTimeoutException e) {
            log.info("Session {} read timeout, closing", session.getUID());
            timeout();
        } catch (IOException e) {
            SmtpMetrics.incrementEmailReceiptException(e.getClass().getSimpleName());
            log.info("Error reading/writing: {}", e.getMessage());
        } finally {
            connection.close();
        }
    }

    /**
     * Processes one line.
     *
     * @param line Line without terminator.
     * @return False if the connection must close.
     * @throws IOException Unable to communicate.
     */
    private boolean process(String line) throws IOException {
        if (session.isInDataMode()) {
            try {
                Optional<SmtpResponse> response = dataCollector.collect(line, session);
                if (response.isPresent()) {
                    connection.write(response.get());
                }
            } catch (SmtpException e) {
                error(e);
            }

            return true;
        }

        try {
            SmtpResponse response = commandHandler.process(line, session);
            connection.write(response);

            return !response.equals(SmtpResponses.CLOSING_221);
        } catch (SmtpException e) {
            error(e);
            return true;
        }
    }

    /**
     * Writes the mapped error reply.
     *
     * @param e SmtpException instance.
     * @throws IOException Unable to communicate.
     */
    private void error(SmtpException e) throws IOException {
        log.debug("Session {} error: {}", session.getUID(), e.getMessage());
        SmtpMetrics.incrementProtocolError(e.getError());
        connection.write(e.toResponse());
    }

    /**
     * Best effort notice before closing an idle connection.
     */
    private void timeout() {
        try {
            connection.write(new SmtpException(SmtpError.IO).toResponse());
        } catch (IOException e) {
            log.debug("Unable to send timeout notice: {}", e.getMessage());
        }
    }

    /**
     * Gets session.
     *
     * @return Session instance.
     */
    public Session getSession() {
        return session;
    }
}
