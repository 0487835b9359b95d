package com.mimecast.catcher.smtp.io;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LineInputStreamTest {

    @Test
    void readLines() throws IOException {
        LineInputStream stream = stream("HELO a\r\nNOOP\nQUIT");

        assertEquals("HELO a\r\n", line(stream));
        assertEquals("NOOP\n", line(stream));
        assertEquals("QUIT", line(stream));
        assertNull(stream.readLine());
        assertEquals(3, stream.getLineNumber());
    }

    @Test
    void bareCarriageReturnIsContent() throws IOException {
        LineInputStream stream = stream("A\rB\r\nC\r\r\n");

        assertEquals("A\rB\r\n", line(stream));
        assertEquals("C\r\r\n", line(stream));
        assertNull(stream.readLine());
        assertEquals(2, stream.getLineNumber());
    }

    @Test
    void bareCarriageReturnAcrossBuffers() throws IOException {
        String head = "x".repeat(4095);
        LineInputStream stream = stream(head + "\rtail\r\n");

        assertEquals(head + "\rtail\r\n", line(stream));
        assertNull(stream.readLine());
    }

    @Test
    void emptyLines() throws IOException {
        LineInputStream stream = stream("\r\n\r\n");

        assertEquals("\r\n", line(stream));
        assertEquals("\r\n", line(stream));
        assertNull(stream.readLine());
    }

    @Test
    void emptyStream() throws IOException {
        assertNull(stream("").readLine());
    }

    @Test
    void lineLimitDiscardsExcess() throws IOException {
        LineInputStream stream = new LineInputStream(
                new ByteArrayInputStream(("abcdefghij\r\nnext\r\n").getBytes(StandardCharsets.US_ASCII)), 4);

        assertEquals("abcd\r\n", line(stream));
        assertEquals("next\r\n", line(stream));
    }

    @Test
    void lineLimitDropsBareCarriageReturns() throws IOException {
        LineInputStream stream = new LineInputStream(
                new ByteArrayInputStream(("ab\r\r\r\r\ncd\n").getBytes(StandardCharsets.US_ASCII)), 3);

        assertEquals("ab\r\r\n", line(stream));
        assertEquals("cd\n", line(stream));
    }

    @Test
    void spansBuffers() throws IOException {
        String longLine = "x".repeat(10000);
        LineInputStream stream = stream(longLine + "\r\nend\r\n");

        assertEquals(longLine + "\r\n", line(stream));
        assertEquals("end\r\n", line(stream));
    }

    @Test
    void readAfterLine() throws IOException {
        LineInputStream stream = stream("line\r\nrest");
        line(stream);

        byte[] buffer = new byte[16];
        int read = stream.read(buffer, 0, buffer.length);
        assertEquals("rest", new String(buffer, 0, read, StandardCharsets.US_ASCII));
        assertEquals(-1, stream.read());
        assertFalse(stream.markSupported());
    }

    private static LineInputStream stream(String content) {
        return new LineInputStream(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    private static String line(LineInputStream stream) throws IOException {
        byte[] bytes = stream.readLine();
        assertNotNull(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
