package com.mimecast.catcher.config.server;

import com.mimecast.catcher.config.ConfigFoundation;
import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.SmtpResponses;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to server configuration.
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Default EHLO capabilities.
     */
    public static final List<String> DEFAULT_CAPABILITIES = Arrays.asList("PIPELINING", "SIZE " + SmtpLimits.MAX_DATA_SIZE);

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Constructs a new ServerConfig instance with given hostname and defaults otherwise.
     *
     * @param hostname Hostname.
     * @return ServerConfig instance.
     */
    public static ServerConfig forHostname(String hostname) {
        Map<String, Object> map = new HashMap<>();
        map.put("hostname", hostname);
        return new ServerConfig(map);
    }

    /**
     * Gets hostname.
     *
     * @return Hostname.
     */
    public String getHostname() {
        return getStringProperty("hostname", "catcher.local");
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "127.0.0.1");
    }

    /**
     * Gets SMTP port.
     *
     * @return Port number.
     */
    public int getSmtpPort() {
        return Math.toIntExact(getLongProperty("smtpPort", 2525L));
    }

    /**
     * Gets greeting text sent after 220.
     *
     * @return Greeting string.
     */
    public String getGreeting() {
        return getStringProperty("greeting", SmtpResponses.GREETING_DEFAULT);
    }

    /**
     * Is EHLO enabled.
     *
     * @return Boolean.
     */
    public boolean isEhloEnabled() {
        return getBooleanProperty("ehloEnabled", true);
    }

    /**
     * Gets EHLO capabilities.
     *
     * @return List of String.
     */
    public List<String> getCapabilities() {
        return getListProperty("capabilities", DEFAULT_CAPABILITIES);
    }

    /**
     * Gets SMTP port listener configuration.
     *
     * @return ListenerConfig instance.
     */
    public ListenerConfig getSmtpConfig() {
        return new ListenerConfig(getMapProperty("smtpConfig"));
    }
}
