/**
 * Server configuration.
 *
 * <p>Server configuration lives in {@code server.json5} inside the configuration directory.
 * <br>Listener options live under the {@code smtpConfig} key of the same file.
 *
 * <h2>Example:</h2>
 * <pre>
 * {
 *   hostname: "catcher.local",
 *   bind: "127.0.0.1",
 *   smtpPort: 2525,
 *   greeting: "Welcome to Catcher",
 *   ehloEnabled: true,
 *   capabilities: ["PIPELINING", "SIZE 10485760"],
 *   smtpConfig: {
 *     backlog: 25,
 *     minimumPoolSize: 1,
 *     maximumPoolSize: 10,
 *     threadKeepAliveTime: 60,
 *     readTimeout: 0
 *   }
 * }
 * </pre>
 */
package com.mimecast.catcher.config.server;
