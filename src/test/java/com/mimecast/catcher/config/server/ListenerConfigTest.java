package com.mimecast.catcher.config.server;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListenerConfigTest {

    @Test
    void readTimeoutMillis() {
        assertEquals(30000, config("readTimeout", 30L).getReadTimeoutMillis());
    }

    @Test
    void readTimeoutMillisDoesNotOverflow() {
        ListenerConfig config = config("readTimeout", 3_000_000L);

        assertEquals(3_000_000L, config.getReadTimeout());
        assertTrue(config.getReadTimeoutMillis() > 0);
        assertTrue(config.getReadTimeoutMillis() <= Integer.MAX_VALUE);
        assertEquals(2_147_483_000, config("readTimeout", Long.MAX_VALUE).getReadTimeoutMillis());
    }

    @Test
    void negativeReadTimeoutWaitsForever() {
        ListenerConfig config = config("readTimeout", -5L);

        assertEquals(0, config.getReadTimeout());
        assertEquals(0, config.getReadTimeoutMillis());
    }

    @Test
    void maximumPoolSize() {
        assertEquals(Integer.MAX_VALUE, new ListenerConfig().getMaximumPoolSize());
        assertEquals(Integer.MAX_VALUE, config("maximumPoolSize", 0L).getMaximumPoolSize());
        assertEquals(3, config("maximumPoolSize", 3L).getMaximumPoolSize());
    }

    private static ListenerConfig config(String key, Object value) {
        Map<String, Object> map = new HashMap<>();
        map.put(key, value);
        return new ListenerConfig(map);
    }
}
