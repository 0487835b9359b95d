/**
 * Connection to an SMTP client.
 *
 * <p>{@link com.mimecast.catcher.smtp.connection.Connection} frames the byte stream into lines and writes replies.
 */
package com.mimecast.catcher.smtp.connection;
