/**
 * Catcher, an embeddable SMTP catch server.
 *
 * <p>Accepts mail over plain SMTP, validates the command sequence and hands each completed message to a sink.
 * <br>It can run standalone from the CLI or be started from test code via {@link com.mimecast.catcher.smtp.SmtpServer}.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar catcher.jar --help
 *      java -jar catcher.jar [address [hostname]]
 *       SMTP catch server
 *
 *      -b,--bind &lt;arg&gt;       Interface address to bind (Default: 127.0.0.1)
 *      -c,--conf &lt;arg&gt;       Path to configuration dir holding server.json5
 *      -h,--help             Show usage help
 *      -n,--hostname &lt;arg&gt;   Hostname announced to clients (Default: catcher.local)
 *      -p,--port &lt;arg&gt;       Port to listen on (Default: 2525)
 *      -v,--verbose          Enable logging
 * </pre>
 *
 * <h2>Embedded usage:</h2>
 * <pre>
 *     QueueEmailSink sink = new QueueEmailSink();
 *     SmtpServer server = new SmtpServer("catcher.local").start("127.0.0.1", 0, sink);
 *     Email email = sink.poll(5, TimeUnit.SECONDS);
 *     server.stop();
 * </pre>
 */
package com.mimecast.catcher;
