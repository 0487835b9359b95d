package com.mimecast.catcher.config.server;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    private static ServerConfig config;

    @BeforeAll
    static void before() throws IOException {
        config = new ServerConfig("src/test/resources/cfg/server.json5");
    }

    @Test
    void getHostname() {
        assertEquals("test.catcher.local", config.getHostname());
    }

    @Test
    void getBind() {
        assertEquals("127.0.0.1", config.getBind());
    }

    @Test
    void getSmtpPort() {
        assertEquals(0, config.getSmtpPort());
    }

    @Test
    void getGreeting() {
        assertEquals("Test Catcher ready", config.getGreeting());
    }

    @Test
    void isEhloEnabled() {
        assertTrue(config.isEhloEnabled());
    }

    @Test
    void getCapabilities() {
        assertEquals(Arrays.asList("PIPELINING", "SIZE 1024", "8BITMIME"), config.getCapabilities());
    }

    @Test
    void getSmtpConfig() {
        ListenerConfig listener = config.getSmtpConfig();

        assertEquals(10, listener.getBacklog());
        assertEquals(2, listener.getMinimumPoolSize());
        assertEquals(4, listener.getMaximumPoolSize());
        assertEquals(30, listener.getThreadKeepAliveTime());
        assertEquals(5, listener.getReadTimeout());
        assertEquals(5000, listener.getReadTimeoutMillis());
    }

    @Test
    void defaults() {
        ServerConfig defaults = new ServerConfig();

        assertEquals("catcher.local", defaults.getHostname());
        assertEquals("127.0.0.1", defaults.getBind());
        assertEquals(2525, defaults.getSmtpPort());
        assertEquals("Welcome to Catcher", defaults.getGreeting());
        assertTrue(defaults.isEhloEnabled());
        assertEquals(ServerConfig.DEFAULT_CAPABILITIES, defaults.getCapabilities());

        ListenerConfig listener = defaults.getSmtpConfig();
        assertEquals(25, listener.getBacklog());
        assertEquals(1, listener.getMinimumPoolSize());
        assertEquals(Integer.MAX_VALUE, listener.getMaximumPoolSize());
        assertEquals(60, listener.getThreadKeepAliveTime());
        assertEquals(0, listener.getReadTimeout());
        assertEquals(0, listener.getReadTimeoutMillis());
    }

    @Test
    void forHostname() {
        ServerConfig custom = ServerConfig.forHostname("mx.example");

        assertEquals("mx.example", custom.getHostname());
        assertEquals(2525, custom.getSmtpPort());
    }
}
