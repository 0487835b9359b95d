/**
 * SMTP receiving engine.
 *
 * <p>{@link com.mimecast.catcher.smtp.SmtpServer} is the embeddable entry point.
 * <br>{@link com.mimecast.catcher.smtp.SmtpListener} accepts connections and runs one
 * {@link com.mimecast.catcher.smtp.EmailReceipt} per socket on a worker pool.
 * <br>Completed transactions become {@link com.mimecast.catcher.smtp.Email} instances handed to an
 * {@link com.mimecast.catcher.smtp.sink.EmailSink}.
 */
package com.mimecast.catcher.smtp;
