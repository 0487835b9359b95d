package com.mimecast.catcher.smtp.io;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>Returns lines with EOL as byte array and counts lines.
 * <p>A line ends at LF or CRLF, a CR not followed by LF is line content.
 * <p>Bytes beyond the line limit are read and discarded so an endless line cannot exhaust memory.
 */
public class LineInputStream extends FilterInputStream {

    /**
     * Carriage return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Default line limit in bytes.
     */
    public static final int DEFAULT_LINE_LIMIT = 64 * 1024;

    /**
     * Internal read buffer size.
     */
    private static final int BUFFER_SIZE = 4096;

    /**
     * Maximum bytes kept per line.
     */
    private final int lineLimit;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Internal read buffer for bulk reads.
     */
    private final byte[] readBuffer = new byte[BUFFER_SIZE];

    /**
     * Current position in read buffer.
     */
    private int bufferPos = 0;

    /**
     * Number of valid bytes in read buffer.
     */
    private int bufferLimit = 0;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(1024);

    /**
     * Constructs a new LineInputStream instance with default line limit.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        this(stream, DEFAULT_LINE_LIMIT);
    }

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream    InputStream instance.
     * @param lineLimit Maximum bytes kept per line.
     */
    public LineInputStream(InputStream stream, int lineLimit) {
        super(stream);
        this.lineLimit = lineLimit;
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array including EOL or null at end of stream.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        boolean read = false;
        boolean truncated = false;
        boolean lastCR = false;
        int intByte;

        while (true) {
            // Refill internal buffer if needed.
            if (bufferPos >= bufferLimit) {
                bufferLimit = in.read(readBuffer, 0, readBuffer.length);
                bufferPos = 0;

                // End of stream.
                if (bufferLimit == -1) {
                    bufferLimit = 0;
                    break;
                }
            }

            while (bufferPos < bufferLimit) {
                intByte = readBuffer[bufferPos++] & 0xFF;
                read = true;

                if (intByte == LF) {
                    // Keep the CR of a CRLF even when it fell past the limit.
                    if (truncated && lastCR) {
                        lineBuffer.write(CR);
                    }
                    lineBuffer.write(intByte);
                    lineNumber++;
                    return lineBuffer.toByteArray();
                }

                if (lineBuffer.size() < lineLimit) {
                    lineBuffer.write(intByte);
                } else {
                    truncated = true;
                }
                lastCR = intByte == CR;
            }
        }

        if (!read) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }

    @Override
    public int read() throws IOException {
        if (bufferPos < bufferLimit) {
            return readBuffer[bufferPos++] & 0xFF;
        }

        return in.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (bufferPos < bufferLimit) {
            int count = Math.min(len, bufferLimit - bufferPos);
            System.arraycopy(readBuffer, bufferPos, b, off, count);
            bufferPos += count;
            return count;
        }

        return in.read(b, off, len);
    }

    @Override
    public int available() throws IOException {
        return (bufferLimit - bufferPos) + in.available();
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
