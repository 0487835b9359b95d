/**
 * Contains the SMTP session state machine.
 *
 * <p>The {@link com.mimecast.catcher.smtp.session.Session} class holds the state of one connection.
 * <br>Allowed commands per state are decided by {@link com.mimecast.catcher.smtp.session.Session#canExecute}.
 */
package com.mimecast.catcher.smtp.session;
