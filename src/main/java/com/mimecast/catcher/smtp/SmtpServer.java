package com.mimecast.catcher.smtp;

import com.mimecast.catcher.config.server.ServerConfig;
import com.mimecast.catcher.smtp.sink.EmailSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.concurrent.TimeUnit;

/**
 * Embeddable SMTP server.
 *
 * <p>Binds a listener and hands every completed email to the given {@link EmailSink}.
 * <p>The start methods run the accept loop on a background thread and return once bound.
 * <p>The run methods block the calling thread until {@link #stop()}.
 *
 * <pre>
 * QueueEmailSink sink = new QueueEmailSink();
 * SmtpServer server = new SmtpServer("catcher.local");
 * server.start("127.0.0.1", 0, sink);
 * Email email = sink.poll(5, TimeUnit.SECONDS);
 * server.stop();
 * </pre>
 */
public class SmtpServer {
    private static final Logger log = LogManager.getLogger(SmtpServer.class);

    private final ServerConfig config;
    private SmtpListener listener;
    private Thread thread;

    /**
     * Constructs a new SmtpServer instance with default settings.
     *
     * @param hostname Server hostname announced in HELO/EHLO replies.
     */
    public SmtpServer(String hostname) {
        this(ServerConfig.forHostname(hostname));
    }

    /**
     * Constructs a new SmtpServer instance.
     *
     * @param config ServerConfig instance.
     */
    public SmtpServer(ServerConfig config) {
        this.config = config;
    }

    /**
     * Binds and starts accepting in the background.
     *
     * @param bind Interface address.
     * @param port Port, 0 picks a free one.
     * @param sink EmailSink instance.
     * @return Self.
     * @throws IOException Unable to bind.
     */
    public SmtpServer start(String bind, int port, EmailSink sink) throws IOException {
        ServerSocket socket = new ServerSocket(port, config.getSmtpConfig().getBacklog(), InetAddress.getByName(bind));
        return start(socket, sink);
    }

    /**
     * Starts accepting on a bound socket in the background.
     *
     * @param socket Bound ServerSocket.
     * @param sink   EmailSink instance.
     * @return Self.
     */
    public synchronized SmtpServer start(ServerSocket socket, EmailSink sink) {
        if (listener != null) {
            throw new IllegalStateException("Server already started");
        }

        listener = new SmtpListener(socket, config, sink);
        thread = new Thread(listener::listen, "catcher-smtp-" + socket.getLocalPort());
        thread.setDaemon(true);
        thread.start();

        log.info("SMTP server started on port {}", socket.getLocalPort());
        return this;
    }

    /**
     * Binds and accepts on the calling thread until stopped.
     *
     * @param bind Interface address.
     * @param port Port.
     * @param sink EmailSink instance.
     * @throws IOException Unable to bind.
     */
    public void run(String bind, int port, EmailSink sink) throws IOException {
        ServerSocket socket = new ServerSocket(port, config.getSmtpConfig().getBacklog(), InetAddress.getByName(bind));
        run(socket, sink);
    }

    /**
     * Accepts on a bound socket on the calling thread until stopped.
     *
     * @param socket Bound ServerSocket.
     * @param sink   EmailSink instance.
     */
    public void run(ServerSocket socket, EmailSink sink) {
        SmtpListener smtpListener;
        synchronized (this) {
            if (listener != null) {
                throw new IllegalStateException("Server already started");
            }
            listener = new SmtpListener(socket, config, sink);
            smtpListener = listener;
        }

        smtpListener.listen();
    }

    /**
     * Gets the bound port.
     *
     * @return Port number or -1 if not started.
     */
    public synchronized int getPort() {
        return listener != null ? listener.getPort() : -1;
    }

    /**
     * Is running.
     *
     * @return Boolean.
     */
    public synchronized boolean isRunning() {
        return listener != null && listener.getListener() != null && !listener.getListener().isClosed();
    }

    /**
     * Stops accepting new connections.
     * <p>Connections in progress are given a few seconds to finish.
     */
    public synchronized void stop() {
        if (listener == null) {
            return;
        }

        try {
            listener.serverShutdown();
            if (!listener.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Connections still open after shutdown on port {}", listener.getPort());
            }
            if (thread != null) {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            }
        } catch (IOException e) {
            log.error("Error shutting down listener on port {}: {}", listener.getPort(), e.getMessage());
        } catch (InterruptedException e) {
            log.warn("Interrupted while stopping server");
            Thread.currentThread().interrupt();
        }

        log.info("SMTP server stopped");
    }

    /**
     * Gets config.
     *
     * @return ServerConfig instance.
     */
    public ServerConfig getConfig() {
        return config;
    }
}
