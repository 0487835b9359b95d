package com.mimecast.catcher.smtp;

import com.mimecast.catcher.smtp.command.CommandHandler;
import com.mimecast.catcher.smtp.command.DataCollector;
import com.mimecast.catcher.smtp.connection.Connection;
import com.mimecast.catcher.smtp.session.SessionState;
import com.mimecast.catcher.smtp.sink.QueueEmailSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailReceiptTest {

    private QueueEmailSink sink;

    @BeforeEach
    void setUp() {
        sink = new QueueEmailSink();
    }

    @Test
    void endToEnd() {
        List<String> replies = run("HELO client.example\r\n" +
                "MAIL FROM:<sender@example.com>\r\n" +
                "RCPT TO:<rcpt@example.com>\r\n" +
                "DATA\r\n" +
                "Subject: Test\r\n" +
                "\r\n" +
                "Hello\r\n" +
                ".\r\n" +
                "QUIT\r\n");

        assertEquals(Arrays.asList(
                "220 Welcome to Catcher",
                "250 catcher.local Hello client.example",
                "250 OK",
                "250 OK",
                "354 End data with <CR><LF>.<CR><LF>",
                "250 OK",
                "221 Bye"), replies);

        List<Email> emails = sink.drain();
        assertEquals(1, emails.size());
        assertEquals("sender@example.com", emails.get(0).getFrom());
        assertEquals(List.of("rcpt@example.com"), emails.get(0).getTo());
        assertEquals("Subject: Test\n\nHello", emails.get(0).getData());
    }

    @Test
    void ehloCapabilities() {
        List<String> replies = run("EHLO client.example\r\nQUIT\r\n");

        assertEquals(Arrays.asList(
                "220 Welcome to Catcher",
                "250-catcher.local Hello client.example",
                "250-PIPELINING",
                "250 SIZE 10485760",
                "221 Bye"), replies);
    }

    @Test
    void errorsKeepConnectionOpen() {
        List<String> replies = run("MAIL FROM:<a@b.com>\r\n" +
                "BOGUS\r\n" +
                "\r\n" +
                "NOOP\r\n" +
                "QUIT\r\n");

        assertEquals(Arrays.asList(
                "220 Welcome to Catcher",
                "503 Bad sequence of commands: MAIL command requires HELO first",
                "500 Syntax error, command unrecognized",
                "500 Syntax error, command unrecognized",
                "250 OK",
                "221 Bye"), replies);
    }

    @Test
    void multipleTransactions() {
        String transaction = "MAIL FROM:<s@example.com>\r\n" +
                "RCPT TO:<r@example.com>\r\n" +
                "DATA\r\n" +
                "body\r\n" +
                ".\r\n";
        run("HELO client.example\r\n" + transaction + transaction + "QUIT\r\n");

        assertEquals(2, sink.size());
    }

    @Test
    void dataLineTooLongAbortsTransaction() {
        List<String> replies = run("HELO client.example\r\n" +
                "MAIL FROM:<s@example.com>\r\n" +
                "RCPT TO:<r@example.com>\r\n" +
                "DATA\r\n" +
                "x".repeat(999) + "\r\n" +
                "after\r\n" +
                "MAIL FROM:<s@example.com>\r\n" +
                "QUIT\r\n");

        assertEquals(Arrays.asList(
                "220 Welcome to Catcher",
                "250 catcher.local Hello client.example",
                "250 OK",
                "250 OK",
                "354 End data with <CR><LF>.<CR><LF>",
                "500 Line too long (max 1000 characters)",
                "500 Syntax error, command unrecognized",
                "250 OK",
                "221 Bye"), replies);
        assertEquals(0, sink.size());
    }

    @Test
    void rsetThenCleanTransaction() {
        List<String> replies = run("HELO a.example\r\n" +
                "MAIL FROM:<aborted@e.com>\r\n" +
                "RSET\r\n" +
                "MAIL FROM:<s@e.com>\r\n" +
                "RCPT TO:<r@e.com>\r\n" +
                "DATA\r\n" +
                "Subject: X\r\n" +
                "\r\n" +
                "Body\r\n" +
                ".\r\n" +
                "QUIT\r\n");

        assertEquals(Arrays.asList(
                "220 Welcome to Catcher",
                "250 catcher.local Hello a.example",
                "250 OK",
                "250 OK",
                "250 OK",
                "250 OK",
                "354 End data with <CR><LF>.<CR><LF>",
                "250 OK",
                "221 Bye"), replies);

        List<Email> emails = sink.drain();
        assertEquals(1, emails.size());
        assertEquals("s@e.com", emails.get(0).getFrom());
        assertEquals(List.of("r@e.com"), emails.get(0).getTo());
        assertEquals("Subject: X\n\nBody", emails.get(0).getData());
    }

    @Test
    void bareCarriageReturnKeptInData() {
        List<String> replies = run("HELO client.example\r\n" +
                "MAIL FROM:<s@example.com>\r\n" +
                "RCPT TO:<r@example.com>\r\n" +
                "DATA\r\n" +
                "A\rB\r\n" +
                "C\r\n" +
                ".\r\n" +
                "QUIT\r\n");

        assertEquals("250 OK", replies.get(5));
        List<Email> emails = sink.drain();
        assertEquals(1, emails.size());
        assertEquals("A\rB\nC", emails.get(0).getData());
    }

    @Test
    void invalidBytesAreReplaced() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] input = {(byte) 0xC3, (byte) 0x28, '\r', '\n', 'Q', 'U', 'I', 'T', '\r', '\n'};
        receipt(new Connection(new ByteArrayInputStream(input), out)).run();

        assertEquals("220 Welcome to Catcher\r\n" +
                "500 Syntax error, command unrecognized\r\n" +
                "221 Bye\r\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void commandLineTooLong() {
        List<String> replies = run("NOOP " + "x".repeat(600) + "\r\nQUIT\r\n");

        assertEquals("500 Line too long (max 512 characters)", replies.get(1));
        assertEquals("221 Bye", replies.get(2));
    }

    @Test
    void quitStopsReading() {
        List<String> replies = run("QUIT\r\nNOOP\r\n");
        assertEquals(Arrays.asList("220 Welcome to Catcher", "221 Bye"), replies);
    }

    @Test
    void clientCloseEndsSession() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Connection connection = new Connection(input("HELO client.example\r\n"), out);
        EmailReceipt receipt = receipt(connection);

        receipt.run();

        assertTrue(connection.isClosed());
        assertEquals("client.example", receipt.getSession().getClientDomain());
        assertEquals(SessionState.GREETING_RECEIVED, receipt.getSession().getState());
    }

    @Test
    void unterminatedDataIsDiscarded() {
        run("HELO client.example\r\n" +
                "MAIL FROM:<s@example.com>\r\n" +
                "RCPT TO:<r@example.com>\r\n" +
                "DATA\r\n" +
                "partial\r\n");

        assertEquals(0, sink.size());
    }

    @Test
    void readTimeoutSendsNotice() {
        InputStream timingOut = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new SocketTimeoutException("Read timed out");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                throw new SocketTimeoutException("Read timed out");
            }
        };

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Connection connection = new Connection(timingOut, out);
        receipt(connection).run();

        assertEquals("220 Welcome to Catcher\r\n421 Service not available\r\n", out.toString(StandardCharsets.UTF_8));
        assertTrue(connection.isClosed());
    }

    private List<String> run(String input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        receipt(new Connection(input(input), out)).run();

        String wire = out.toString(StandardCharsets.UTF_8);
        assertTrue(wire.endsWith("\r\n"));
        return Arrays.asList(wire.split("\r\n"));
    }

    private EmailReceipt receipt(Connection connection) {
        return new EmailReceipt(connection, new CommandHandler("catcher.local"), new DataCollector(sink), SmtpResponses.GREETING_DEFAULT);
    }

    private static InputStream input(String input) {
        return new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
    }
}
