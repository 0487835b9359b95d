/**
 * Responsible for parsing SMTP verbs.
 *
 * <p>{@link com.mimecast.catcher.smtp.verb.Verb} tokenizes a command line.
 * <br>{@link com.mimecast.catcher.smtp.verb.PathVerb} extracts MAIL and RCPT addresses
 * which are then checked by {@link com.mimecast.catcher.smtp.verb.AddressValidator}.
 */
package com.mimecast.catcher.smtp.verb;
