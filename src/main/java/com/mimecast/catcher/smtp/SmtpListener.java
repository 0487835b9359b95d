package com.mimecast.catcher.smtp;

import com.mimecast.catcher.config.server.ListenerConfig;
import com.mimecast.catcher.config.server.ServerConfig;
import com.mimecast.catcher.smtp.command.CommandHandler;
import com.mimecast.catcher.smtp.command.DataCollector;
import com.mimecast.catcher.smtp.connection.Connection;
import com.mimecast.catcher.smtp.error.SmtpError;
import com.mimecast.catcher.smtp.error.SmtpException;
import com.mimecast.catcher.smtp.metrics.SmtpMetrics;
import com.mimecast.catcher.smtp.sink.EmailSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * SMTP socket listener for handling client connections.
 * <p>This class runs a {@link ServerSocket} bound to a configured network interface and port.
 * <p>For each accepted connection, it creates an {@link EmailReceipt} instance to handle the SMTP session.
 * <p>It uses a {@link ThreadPoolExecutor} to manage concurrent connections.
 * <p>Connections over the configured pool cap are answered with 421 and closed.
 *
 * @see EmailReceipt
 */
public class SmtpListener {
    private static final Logger log = LogManager.getLogger(SmtpListener.class);

    /**
     * The underlying server socket that listens for incoming connections.
     */
    private ServerSocket listener;

    /**
     * Thread pool for handling client connections.
     */
    private final ThreadPoolExecutor executor;

    /**
     * Flag to indicate a server shutdown is in progress.
     */
    private volatile boolean serverShutdown = false;

    private final int port;
    private final String bind;
    private final ListenerConfig config;
    private final String greeting;
    private final CommandHandler commandHandler;
    private final DataCollector dataCollector;

    /**
     * Constructs a new SmtpListener instance that binds on {@link #listen()}.
     *
     * @param port         The port number to listen on.
     * @param bind         The network interface address to bind to.
     * @param serverConfig The {@link ServerConfig} for greeting, hostname and EHLO.
     * @param sink         The {@link EmailSink} receiving completed emails.
     */
    public SmtpListener(int port, String bind, ServerConfig serverConfig, EmailSink sink) {
        this.port = port;
        this.bind = bind;
        this.config = serverConfig.getSmtpConfig();
        this.greeting = serverConfig.getGreeting();
        this.commandHandler = new CommandHandler(serverConfig);
        this.dataCollector = new DataCollector(sink);

        // One thread per connection, never on the accept thread.
        int maximumPoolSize = config.getMaximumPoolSize();
        this.executor = new ThreadPoolExecutor(
                Math.min(config.getMinimumPoolSize(), maximumPoolSize),
                maximumPoolSize,
                config.getThreadKeepAliveTime(), TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Constructs a new SmtpListener instance over an already bound socket.
     *
     * @param listener     Bound ServerSocket.
     * @param serverConfig The {@link ServerConfig} for greeting, hostname and EHLO.
     * @param sink         The {@link EmailSink} receiving completed emails.
     */
    public SmtpListener(ServerSocket listener, ServerConfig serverConfig, EmailSink sink) {
        this(listener.getLocalPort(), listener.getInetAddress().getHostAddress(), serverConfig, sink);
        this.listener = listener;
    }

    /**
     * Starts the listener.
     * <p>This method opens the server socket if needed and enters a loop to accept incoming connections.
     * <p>It blocks until {@link #serverShutdown()} is called or the socket fails.
     */
    public void listen() {
        try {
            if (listener == null) {
                listener = new ServerSocket(port, config.getBacklog(), InetAddress.getByName(bind));
            }
            log.info("Listening to [{}]:{}", bind, listener.getLocalPort());

            acceptConnection();

        } catch (IOException e) {
            log.fatal("Error listening: {}", e.getMessage());

        } finally {
            try {
                if (listener != null && !listener.isClosed()) {
                    listener.close();
                    log.info("Closed listener for port {}.", port);
                }
                executor.shutdown();
            } catch (IOException e) {
                log.info("Listener for port {} already closed.", port);
            }
        }
    }

    /**
     * Accepts incoming connections in a loop until a shutdown is initiated.
     * For each connection, it submits a new {@link EmailReceipt} task to the thread pool.
     */
    private void acceptConnection() {
        try {
            do {
                Socket sock = listener.accept();
                log.info("Accepted connection from {}:{} on port {}.", sock.getInetAddress().getHostAddress(), sock.getPort(), listener.getLocalPort());

                try {
                    executor.execute(() -> receipt(sock));
                } catch (RejectedExecutionException e) {
                    reject(sock);
                }
            } while (!serverShutdown);

        } catch (SocketException e) {
            if (!serverShutdown) {
                log.info("Error in socket exchange: {}", e.getMessage());
            }
        } catch (IOException e) {
            log.info("Error reading/writing: {}", e.getMessage());
        }
    }

    /**
     * Runs the receipt for one accepted socket.
     *
     * @param sock Socket instance.
     */
    private void receipt(Socket sock) {
        try {
            Connection connection = new Connection(sock);
            connection.setTimeout(config.getReadTimeoutMillis());
            new EmailReceipt(connection, commandHandler, dataCollector, greeting).run();

        } catch (Exception e) {
            SmtpMetrics.incrementEmailReceiptException(e.getClass().getSimpleName());
            log.error("Email receipt unexpected exception: {}", e.getMessage());
            closeQuietly(sock);
        }
    }

    /**
     * Turns away a connection over the pool cap or arriving during shutdown.
     *
     * @param sock Socket instance.
     */
    private void reject(Socket sock) {
        log.warn("Rejecting connection from {}, {} connections active", sock.getInetAddress().getHostAddress(), executor.getActiveCount());
        SmtpMetrics.incrementEmailReceiptException(RejectedExecutionException.class.getSimpleName());

        Connection connection = null;
        try {
            connection = new Connection(sock);
            connection.write(new SmtpException(SmtpError.IO).toResponse());
        } catch (IOException e) {
            log.debug("Unable to send rejection: {}", e.getMessage());
        } finally {
            if (connection != null) {
                connection.close();
            } else {
                closeQuietly(sock);
            }
        }
    }

    /**
     * Closes a socket after a failed receipt.
     *
     * @param sock Socket instance.
     */
    private static void closeQuietly(Socket sock) {
        try {
            sock.close();
        } catch (IOException e) {
            log.debug("Socket already closed: {}", e.getMessage());
        }
    }

    /**
     * Initiates a graceful shutdown of the listener.
     * <p>Closes the server socket and stops the thread pool, connections in progress may finish.
     *
     * @throws IOException If an I/O error occurs when closing the socket.
     */
    public void serverShutdown() throws IOException {
        serverShutdown = true;
        if (listener != null) {
            listener.close();
        }
        executor.shutdown();
    }

    /**
     * Waits for connections in progress to finish after shutdown.
     *
     * @param timeout Timeout value.
     * @param unit    Timeout unit.
     * @return True if all connections finished.
     * @throws InterruptedException Interrupted while waiting.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    /**
     * Gets the underlying {@link ServerSocket} instance.
     *
     * @return The {@link ServerSocket} instance.
     */
    public ServerSocket getListener() {
        return listener;
    }

    /**
     * Gets the port number this listener is bound or configured to use.
     *
     * @return The port number.
     */
    public int getPort() {
        return listener != null ? listener.getLocalPort() : port;
    }
}
