package com.mimecast.catcher.main;

import com.mimecast.catcher.config.server.ServerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Master configuration initializer and container.
 *
 * <p>ServerConfig configuration holds the hostname, bind address, port, greeting and listener tuning.
 *
 * @see ServerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Server configuration file name.
     */
    public static final String SERVER_FILE = "server.json5";

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Init server configuration from directory.
     * <p>A missing file leaves the defaults in place.
     *
     * @param dir Configuration directory path.
     * @throws ConfigurationException Unable to read or parse the file.
     */
    public static void init(String dir) throws ConfigurationException {
        Path path = Paths.get(dir, SERVER_FILE);
        if (!Files.isRegularFile(path)) {
            log.warn("No server config found at {}, using defaults", path);
            server = new ServerConfig();
            return;
        }

        try {
            initServer(path.toString());
        } catch (IOException e) {
            log.error("Unable to load server config {}: {}", path, e.getMessage());
            throw new ConfigurationException("Unable to load server config " + path + ": " + e.getMessage());
        }
    }

    /**
     * Init server.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String path) throws IOException {
        server = new ServerConfig(path);
        log.debug("Loaded server file: {}", path);
    }

    /**
     * Gets server config.
     *
     * @return ServerConfig instance.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Sets server config.
     *
     * @param serverConfig ServerConfig instance.
     */
    public static void setServer(ServerConfig serverConfig) {
        server = serverConfig;
    }
}
