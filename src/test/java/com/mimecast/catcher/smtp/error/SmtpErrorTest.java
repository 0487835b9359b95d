package com.mimecast.catcher.smtp.error;

import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.SmtpResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmtpErrorTest {

    @Test
    void mapping() {
        assertResponse("421", "Service not available", new SmtpException(SmtpError.IO));
        assertResponse("500", "Syntax error, command unrecognized", new SmtpException(SmtpError.INVALID_COMMAND));
        assertResponse("503", "Bad sequence of commands: MAIL command requires HELO first",
                SmtpException.invalidState("MAIL command requires HELO first"));
        assertResponse("501", "Syntax error: HELO requires domain argument",
                SmtpException.invalidSyntax("HELO requires domain argument"));
        assertResponse("500", "Line too long (max 512 characters)",
                new SmtpException(SmtpError.LINE_TOO_LONG, SmtpLimits.COMMAND_LINE_MAX_LENGTH));
        assertResponse("501", "Path too long (max 256 characters)",
                new SmtpException(SmtpError.PATH_TOO_LONG, SmtpLimits.PATH_MAX_LENGTH));
        assertResponse("552", "Too many recipients (max 100)",
                new SmtpException(SmtpError.TOO_MANY_RECIPIENTS, SmtpLimits.MAX_RECIPIENTS));
        assertResponse("552", "Too much mail data (max 10485760 bytes)",
                new SmtpException(SmtpError.TOO_MUCH_DATA, SmtpLimits.MAX_DATA_SIZE));
        assertResponse("501", "Domain name too long (max 64 characters)",
                new SmtpException(SmtpError.DOMAIN_TOO_LONG, SmtpLimits.DOMAIN_MAX_LENGTH));
        assertResponse("501", "User name too long (max 64 characters)",
                new SmtpException(SmtpError.USER_TOO_LONG, SmtpLimits.USER_MAX_LENGTH));
        assertResponse("500", "Invalid character encoding", new SmtpException(SmtpError.NON_UTF8_DATA));
        assertResponse("421", "Connection closed", new SmtpException(SmtpError.CONNECTION_CLOSED));
        assertResponse("500", "Protocol violation", new SmtpException(SmtpError.PROTOCOL_VIOLATION));
    }

    @Test
    void everyKindMapsToErrorCode() {
        for (SmtpError error : SmtpError.values()) {
            SmtpResponse response = error.toResponse("x");
            assertTrue(response.isError(), error.name());
            assertEquals(3, response.getCode().length(), error.name());
            assertFalse(response.isMultiline(), error.name());
        }
    }

    @Test
    void exceptionCarriesKind() {
        SmtpException e = new SmtpException(SmtpError.TOO_MANY_RECIPIENTS, 100);

        assertEquals(SmtpError.TOO_MANY_RECIPIENTS, e.getError());
        assertEquals(100, e.getArgument());
        assertEquals("Too many recipients (max 100)", e.getMessage());
    }

    @Test
    void templated() {
        assertTrue(SmtpError.INVALID_STATE.isTemplated());
        assertFalse(SmtpError.IO.isTemplated());
        assertEquals("Service not available", SmtpError.IO.format("ignored"));
    }

    private static void assertResponse(String code, String message, SmtpException e) {
        SmtpResponse response = e.toResponse();
        assertEquals(code, response.getCode());
        assertEquals(message, response.getMessage());
        assertEquals(code + " " + message + "\r\n", response.format());
    }
}
