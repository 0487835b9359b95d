/**
 * Input stream line framing.
 */
package com.mimecast.catcher.smtp.io;
