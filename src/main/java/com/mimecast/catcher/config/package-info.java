/**
 * Configuration foundation.
 *
 * <p>{@link com.mimecast.catcher.config.ConfigFoundation} wraps a configuration map read from a JSON5 file.
 * <br>Typed configuration classes extend it.
 */
package com.mimecast.catcher.config;
