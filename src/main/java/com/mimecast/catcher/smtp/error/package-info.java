/**
 * SMTP error taxonomy.
 *
 * <p>The {@link com.mimecast.catcher.smtp.error.SmtpError} enum is the one place where error kinds map to reply codes
 * and messages.
 * <br>Protocol handlers throw {@link com.mimecast.catcher.smtp.error.SmtpException} and the connection writes
 * the mapped reply back.
 */
package com.mimecast.catcher.smtp.error;
