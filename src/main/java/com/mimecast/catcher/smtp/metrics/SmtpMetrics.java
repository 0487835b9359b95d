package com.mimecast.catcher.smtp.metrics;

import com.mimecast.catcher.metrics.MetricsRegistry;
import com.mimecast.catcher.smtp.error.SmtpError;
import io.micrometer.core.instrument.Counter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SMTP-related Micrometer metrics.
 *
 * <p>Provides counters for connections, received emails, protocol errors and exceptions.
 * <p>Failures to record are logged and never propagate to the connection.
 */
public final class SmtpMetrics {
    private static final Logger log = LogManager.getLogger(SmtpMetrics.class);

    /**
     * Private constructor for utility class.
     */
    private SmtpMetrics() {
    }

    /**
     * Increment the email receipt start counter.
     * <p>Called when a connection is greeted.
     */
    public static void incrementEmailReceiptStart() {
        try {
            Counter.builder("smtp.email.receipt.start")
                    .description("Number of email receipt connections started")
                    .register(MetricsRegistry.getRegistry())
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment email receipt start counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the email receipt success counter.
     * <p>Called for every email handed to the sink.
     */
    public static void incrementEmailReceiptSuccess() {
        try {
            Counter.builder("smtp.email.receipt.success")
                    .description("Number of emails received")
                    .register(MetricsRegistry.getRegistry())
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment email receipt success counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the email receipt exception counter.
     *
     * @param exceptionType The simple name of the exception class.
     */
    public static void incrementEmailReceiptException(String exceptionType) {
        try {
            Counter.builder("smtp.email.receipt.exceptions")
                    .description("Number of exceptions during email receipt processing")
                    .tag("exception_type", exceptionType)
                    .register(MetricsRegistry.getRegistry())
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment email receipt exception counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the protocol error counter.
     *
     * @param error SmtpError kind replied to the client.
     */
    public static void incrementProtocolError(SmtpError error) {
        try {
            Counter.builder("smtp.protocol.errors")
                    .description("Number of error replies sent")
                    .tag("error", error.name())
                    .tag("code", error.getCode())
                    .register(MetricsRegistry.getRegistry())
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment protocol error counter: {}", e.getMessage());
        }
    }
}
