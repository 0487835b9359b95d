package com.mimecast.catcher.smtp.connection;

import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.SmtpResponse;
import com.mimecast.catcher.smtp.io.LineInputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * Connection.
 *
 * <p>Line oriented read and write over a socket or a pair of streams.
 * <p>Lines are decoded as UTF-8 with malformed input replaced, never rejected.
 */
public class Connection implements Closeable {
    private static final Logger log = LogManager.getLogger(Connection.class);

    /**
     * Socket, null when built from streams.
     */
    private final Socket socket;

    private final LineInputStream inc;
    private final OutputStream out;

    /**
     * Remote address for logging.
     */
    private final String remote;

    private volatile boolean closed = false;

    /**
     * Constructs a new Connection instance with given socket.
     *
     * @param socket Socket instance.
     * @throws IOException Unable to get streams.
     */
    public Connection(Socket socket) throws IOException {
        this.socket = socket;
        this.inc = new LineInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
        this.remote = socket.getInetAddress() != null
                ? socket.getInetAddress().getHostAddress() + ":" + socket.getPort()
                : "unknown";
    }

    /**
     * Constructs a new Connection instance with given streams.
     *
     * @param in  InputStream instance.
     * @param out OutputStream instance.
     */
    public Connection(InputStream in, OutputStream out) {
        this.socket = null;
        this.inc = new LineInputStream(in);
        this.out = out;
        this.remote = "stream";
    }

    /**
     * Reads a line.
     * <p>The CRLF or LF terminator is removed, nothing else is trimmed.
     *
     * @return Line string or null if the peer closed the stream.
     * @throws IOException Unable to read.
     */
    public String read() throws IOException {
        byte[] bytes = inc.readLine();
        if (bytes == null) {
            return null;
        }

        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\n') {
            length--;
            if (length > 0 && bytes[length - 1] == '\r') {
                length--;
            }
        }

        String line = new String(bytes, 0, length, StandardCharsets.UTF_8);
        log.trace("{} >> {}", remote, line);
        return line;
    }

    /**
     * Writes a reply.
     * <p>Replies over the reply line limit are replaced with a truncation notice.
     *
     * @param response SmtpResponse instance.
     * @throws IOException Unable to write.
     */
    public void write(SmtpResponse response) throws IOException {
        String wire = response.toWire(SmtpLimits.REPLY_LINE_MAX_LENGTH);
        out.write(wire.getBytes(StandardCharsets.UTF_8));
        out.flush();
        log.trace("{} << {}", remote, wire.trim());
    }

    /**
     * Sets read timeout.
     *
     * @param timeout Timeout in milliseconds, 0 waits forever.
     * @throws SocketException Unable to set.
     */
    public void setTimeout(int timeout) throws SocketException {
        if (socket != null) {
            socket.setSoTimeout(timeout);
        }
    }

    /**
     * Gets remote address.
     *
     * @return Address string.
     */
    public String getRemote() {
        return remote;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the connection.
     * <p>Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            if (socket != null) {
                socket.close();
            } else {
                inc.close();
                out.close();
            }
        } catch (IOException e) {
            log.info("Error closing connection to {}: {}", remote, e.getMessage());
        }
    }
}
