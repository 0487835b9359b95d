package com.mimecast.catcher;

import com.mimecast.catcher.config.server.ServerConfig;
import com.mimecast.catcher.main.Config;
import com.mimecast.catcher.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Runs the SMTP catch server.
 * <p>Address and hostname may be given as options or as positional arguments: <i>[address [hostname]]</i>.
 */
@SuppressWarnings("squid:S106")
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "catcher.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME + " [address [hostname]]";

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "SMTP catch server";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        Optional<ServerConfig> config = main.resolve();

        if (config.isPresent()) {
            try {
                new Server(config.get()).run();
            } catch (IOException e) {
                main.log("Unable to start server: " + e.getMessage());
                System.exit(1);
            }
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Parses arguments and builds the server configuration.
     * <p>Options override positional arguments which override the configuration file.
     *
     * @return Optional of ServerConfig, empty when usage was shown or arguments are invalid.
     */
    Optional<ServerConfig> resolve() {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            return Optional.empty();
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options);
            return Optional.empty();
        }

        // Disable logging.
        if (!cmd.hasOption("verbose")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);
        }

        try {
            if (cmd.hasOption("conf")) {
                Config.init(cmd.getOptionValue("conf"));
            }
        } catch (ConfigurationException e) {
            log("Config error: " + e.getMessage());
            return Optional.empty();
        }

        Map<String, Object> map = new HashMap<>(Config.getServer().getMap());

        try {
            List<String> positional = cmd.getArgList();
            if (positional.size() > 2) {
                throw new IllegalArgumentException("Too many arguments");
            }
            if (!positional.isEmpty()) {
                applyAddress(positional.get(0), map);
            }
            if (positional.size() > 1) {
                map.put("hostname", positional.get(1));
            }

            if (cmd.hasOption("bind")) {
                map.put("bind", cmd.getOptionValue("bind"));
            }
            if (cmd.hasOption("port")) {
                map.put("smtpPort", parsePort(cmd.getOptionValue("port")));
            }
            if (cmd.hasOption("hostname")) {
                map.put("hostname", cmd.getOptionValue("hostname"));
            }
        } catch (IllegalArgumentException e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
            return Optional.empty();
        }

        return Optional.of(new ServerConfig(map));
    }

    /**
     * Applies a <i>host:port</i> or <i>host</i> address.
     *
     * @param address Address string.
     * @param map     Configuration map.
     */
    static void applyAddress(String address, Map<String, Object> map) {
        if (StringUtils.isBlank(address)) {
            throw new IllegalArgumentException("Empty address");
        }

        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            map.put("bind", address);
            return;
        }

        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }

        map.put("bind", host);
        map.put("smtpPort", parsePort(address.substring(colon + 1)));
    }

    /**
     * Parses a port number.
     *
     * @param value Port string.
     * @return Port number.
     */
    static long parsePort(String value) {
        try {
            long port = Long.parseLong(value.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("b", "bind", true, "Interface address to bind (Default: 127.0.0.1)");
        options.addOption("p", "port", true, "Port to listen on (Default: 2525)");
        options.addOption("n", "hostname", true, "Hostname announced to clients (Default: catcher.local)");
        options.addOption("c", "conf", true, "Path to configuration dir holding server.json5");
        options.addOption("v", "verbose", false, "Enable logging");
        options.addOption("h", "help", false, "Show usage help");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter writer = new StringWriter();
        new HelpFormatter().printOptions(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD);

        log(writer.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, false);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        System.out.println(string);
    }
}
