package com.mimecast.catcher.smtp;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SmtpResponseTest {

    @Test
    void formatSingleLine() {
        assertEquals("250 OK\r\n", new SmtpResponse("250", "OK").format());
    }

    @Test
    void formatMultiline() {
        SmtpResponse response = new SmtpResponse("250", "catcher.local Hello client.example",
                Arrays.asList("PIPELINING", "SIZE 10485760"));

        assertEquals("250-catcher.local Hello client.example\r\n" +
                "250-PIPELINING\r\n" +
                "250 SIZE 10485760\r\n", response.format());
        assertTrue(response.isMultiline());
        assertEquals(2, response.getMultiline().size());
    }

    @Test
    void formatMultilineSingleEntry() {
        SmtpResponse response = new SmtpResponse("250", "first", Arrays.asList("last"));
        assertEquals("250-first\r\n250 last\r\n", response.format());
    }

    @Test
    void everyLineEndsWithCrlf() {
        String wire = new SmtpResponse("250", "a", Arrays.asList("b", "c", "d")).format();
        String[] lines = wire.split("\r\n", -1);

        assertEquals(5, lines.length);
        assertEquals("", lines[4]);
        for (int i = 0; i < 4; i++) {
            assertTrue(lines[i].startsWith("250"));
            assertEquals(i < 3 ? '-' : ' ', lines[i].charAt(3));
        }
    }

    @Test
    void toWireTruncatesLongReplies() {
        String longText = "x".repeat(600);
        SmtpResponse response = new SmtpResponse("501", longText);

        assertEquals("501 Response too long (truncated)\r\n", response.toWire(512));
    }

    @Test
    void toWireKeepsShortReplies() {
        SmtpResponse response = new SmtpResponse("250", "OK");
        assertEquals("250 OK\r\n", response.toWire(512));
    }

    @Test
    void toWireMeasuresBytes() {
        // 2 byte characters double the wire length.
        SmtpResponse response = new SmtpResponse("250", "é".repeat(300));
        assertEquals("250 Response too long (truncated)\r\n", response.toWire(512));
    }

    @Test
    void parse() {
        Optional<SmtpResponse> response = SmtpResponse.parse("250 OK\r\n");

        assertTrue(response.isPresent());
        assertEquals("250", response.get().getCode());
        assertEquals("OK", response.get().getMessage());
        assertFalse(response.get().isMultiline());
    }

    @Test
    void parseWithoutTerminator() {
        Optional<SmtpResponse> response = SmtpResponse.parse("354 End data with <CR><LF>.<CR><LF>");

        assertTrue(response.isPresent());
        assertEquals(SmtpResponses.DATA_START_354, response.get());
    }

    @Test
    void parseRejectsMalformed() {
        assertFalse(SmtpResponse.parse(null).isPresent());
        assertFalse(SmtpResponse.parse("").isPresent());
        assertFalse(SmtpResponse.parse("25 OK").isPresent());
        assertFalse(SmtpResponse.parse("2x0 OK").isPresent());
        assertFalse(SmtpResponse.parse("250-OK").isPresent());
        assertFalse(SmtpResponse.parse("250").isPresent());
    }

    @Test
    void classification() {
        assertTrue(new SmtpResponse("250", "OK").isSuccess());
        assertFalse(new SmtpResponse("250", "OK").isError());
        assertTrue(new SmtpResponse("421", "Service not available").isError());
        assertTrue(new SmtpResponse("552", "Too many").isError());
        assertFalse(new SmtpResponse("354", "Go").isSuccess());
        assertFalse(new SmtpResponse("354", "Go").isError());
    }

    @Test
    void equality() {
        assertEquals(new SmtpResponse("250", "OK"), SmtpResponses.OK_250);
        assertEquals(new SmtpResponse("250", "OK").hashCode(), SmtpResponses.OK_250.hashCode());
        assertNotEquals(new SmtpResponse("250", "OK", Arrays.asList("X")), SmtpResponses.OK_250);
        assertEquals("250 OK", SmtpResponses.OK_250.toString());
    }
}
