package com.mimecast.catcher.smtp;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class SmtpResponsesTest {

    @Test
    void greeting() {
        assertEquals("220 Welcome to Catcher\r\n", SmtpResponses.greeting(SmtpResponses.GREETING_DEFAULT).format());
    }

    @Test
    void helo() {
        assertEquals("250 catcher.local Hello client.example\r\n",
                SmtpResponses.helo("catcher.local", "client.example").format());
    }

    @Test
    void ehlo() {
        SmtpResponse response = SmtpResponses.ehlo("catcher.local", "client.example", Arrays.asList("PIPELINING", "SIZE 10485760"));

        assertEquals("250-catcher.local Hello client.example\r\n250-PIPELINING\r\n250 SIZE 10485760\r\n", response.format());
    }

    @Test
    void ehloWithoutCapabilities() {
        assertEquals(SmtpResponses.helo("catcher.local", "client.example"),
                SmtpResponses.ehlo("catcher.local", "client.example", Collections.emptyList()));
        assertEquals(SmtpResponses.helo("catcher.local", "client.example"),
                SmtpResponses.ehlo("catcher.local", "client.example", null));
    }

    @Test
    void cannedReplies() {
        assertEquals("221 Bye\r\n", SmtpResponses.CLOSING_221.format());
        assertEquals("250 OK\r\n", SmtpResponses.OK_250.format());
        assertEquals("354 End data with <CR><LF>.<CR><LF>\r\n", SmtpResponses.DATA_START_354.format());
    }
}
