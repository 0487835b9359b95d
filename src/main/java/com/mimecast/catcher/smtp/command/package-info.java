/**
 * SMTP command processing.
 *
 * <p>{@link com.mimecast.catcher.smtp.command.CommandHandler} handles command lines.
 * <br>{@link com.mimecast.catcher.smtp.command.DataCollector} handles lines while in DATA mode.
 */
package com.mimecast.catcher.smtp.command;
