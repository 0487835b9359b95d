/**
 * Email hand-off to consumers.
 *
 * <p>Completed emails are pushed to an {@link com.mimecast.catcher.smtp.sink.EmailSink}.
 * <br>{@link com.mimecast.catcher.smtp.sink.QueueEmailSink} is the default queue based implementation.
 */
package com.mimecast.catcher.smtp.sink;
