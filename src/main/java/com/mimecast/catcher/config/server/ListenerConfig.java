package com.mimecast.catcher.config.server;

import com.mimecast.catcher.config.ConfigFoundation;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Listener configuration.
 *
 * <p>This class provides type safe access to listener-specific configuration.
 */
public class ListenerConfig extends ConfigFoundation {

    /**
     * Constructs a new ListenerConfig instance.
     */
    public ListenerConfig() {
        super();
    }

    /**
     * Constructs a new ListenerConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ListenerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets backlog size.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 25L));
    }

    /**
     * Gets minimum pool size.
     *
     * @return Thread pool min size.
     */
    public int getMinimumPoolSize() {
        return Math.toIntExact(getLongProperty("minimumPoolSize", 1L));
    }

    /**
     * Gets maximum pool size.
     * <p>Caps concurrent connections, connections over the cap get 421 and are closed.
     * <p>0 or less means no cap.
     *
     * @return Thread pool max size.
     */
    public int getMaximumPoolSize() {
        long size = getLongProperty("maximumPoolSize", 0L);
        return size > 0 ? (int) Math.min(size, Integer.MAX_VALUE) : Integer.MAX_VALUE;
    }

    /**
     * Gets thread keep alive time.
     *
     * @return Time in seconds.
     */
    public int getThreadKeepAliveTime() {
        return Math.toIntExact(getLongProperty("threadKeepAliveTime", 60L));
    }

    /**
     * Gets read timeout.
     * <p>Idle connections are closed once it expires, 0 waits forever.
     *
     * @return Time in seconds.
     */
    public long getReadTimeout() {
        return Math.max(0L, getLongProperty("readTimeout", 0L));
    }

    /**
     * Gets read timeout as a socket timeout.
     *
     * @return Time in milliseconds, capped to the int range.
     */
    public int getReadTimeoutMillis() {
        long seconds = Math.min(getReadTimeout(), TimeUnit.MILLISECONDS.toSeconds(Integer.MAX_VALUE));
        return Math.toIntExact(TimeUnit.SECONDS.toMillis(seconds));
    }
}
