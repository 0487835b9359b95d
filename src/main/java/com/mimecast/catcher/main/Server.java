package com.mimecast.catcher.main;

import com.mimecast.catcher.config.server.ServerConfig;
import com.mimecast.catcher.smtp.Email;
import com.mimecast.catcher.smtp.SmtpServer;
import com.mimecast.catcher.smtp.sink.QueueEmailSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

/**
 * Main server class for the Catcher SMTP server.
 *
 * <p>Binds the configured listener, drains received emails on a consumer thread and prints a summary of each.
 * <p>This class also handles graceful shutdown of the server and its consumer.
 *
 * @see SmtpServer
 */
@SuppressWarnings("squid:S106")
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private final ServerConfig config;
    private final SmtpServer smtpServer;
    private final QueueEmailSink sink = new QueueEmailSink();
    private final PrintStream out;
    private Thread consumer;

    /**
     * Constructs a new Server instance printing to standard output.
     *
     * @param config ServerConfig instance.
     */
    public Server(ServerConfig config) {
        this(config, System.out);
    }

    /**
     * Constructs a new Server instance.
     *
     * @param config ServerConfig instance.
     * @param out    Where email summaries are printed.
     */
    Server(ServerConfig config, PrintStream out) {
        this.config = config;
        this.smtpServer = new SmtpServer(config);
        this.out = out;
    }

    /**
     * Starts the server in the background.
     *
     * @return Self.
     * @throws IOException Unable to bind.
     */
    public Server start() throws IOException {
        startConsumer();
        smtpServer.start(config.getBind(), config.getSmtpPort(), sink);
        out.println("Listening on " + config.getBind() + ":" + smtpServer.getPort() + " as " + config.getHostname());
        return this;
    }

    /**
     * Runs the server until the JVM shuts down.
     *
     * @throws IOException Unable to bind.
     */
    public void run() throws IOException {
        registerShutdownHook();
        startConsumer();
        out.println("Listening on " + config.getBind() + ":" + config.getSmtpPort() + " as " + config.getHostname());
        smtpServer.run(config.getBind(), config.getSmtpPort(), sink);
    }

    /**
     * Stops the listener and the consumer.
     */
    public void stop() {
        smtpServer.stop();
        sink.close();
        if (consumer != null) {
            consumer.interrupt();
            try {
                consumer.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Gets bound port.
     *
     * @return Port number.
     */
    public int getPort() {
        return smtpServer.getPort();
    }

    /**
     * Starts the email consumer thread.
     */
    private void startConsumer() {
        consumer = new Thread(this::consume, "catcher-consumer");
        consumer.setDaemon(true);
        consumer.start();
    }

    /**
     * Drains the sink until interrupted.
     */
    private void consume() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Email email = sink.poll(1, TimeUnit.SECONDS);
                if (email != null) {
                    print(email);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // Whatever arrived during shutdown.
        sink.drain().forEach(this::print);
    }

    /**
     * Prints email summary.
     *
     * @param email Email instance.
     */
    private void print(Email email) {
        log.info("Received email from <{}> to {} ({} bytes)", email.getFrom(), email.getTo(), email.getDataSize());
        out.println("From: " + email.getFrom());
        out.println("To: " + String.join(", ", email.getTo()));
        out.println("Subject: " + email.getSubject().orElse("(none)"));
        out.println();
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     */
    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            stop();
            log.info("Shutdown complete.");
        }));
    }
}
