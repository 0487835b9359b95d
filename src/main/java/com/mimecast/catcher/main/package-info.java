/**
 * Standalone server components.
 *
 * <h2>Server</h2>
 * <p>SMTP catch server.
 * <br>Binds the configured listener and prints a summary of every received email.
 *
 * <h2>Config</h2>
 * <p>Static container for the server configuration loaded from a directory holding <i>server.json5</i>.
 */
package com.mimecast.catcher.main;
