// file: server/src/main/java/io/fset/server/ServerConfig.java
package io.fset.server;

import java.nio.file.Path;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:    HTTP API port
 *  - store:       database settings; from --config if given, then overridden by individual flags
 */
public record ServerConfig(
        int httpPort,
        StoreConfig store
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --config,    -c   <path to JSON store config>
     *   --db-url,    -d   <jdbc url>
     *   --db-user         <user>
     *   --db-password     <password>
     *   --max-connections <n>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     * Invalid values raise IllegalArgumentException; Main turns that into a usage error.
     */
    public static ServerConfig parse(String[] args) {
        int httpPort = 8080;
        String configPath = null;
        String url = null;
        String user = null;
        String password = null;
        Integer maxConnections = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> throw new HelpRequested();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[i], args[++i]);
                    if (httpPort <= 0 || httpPort > 65535) {
                        throw new IllegalArgumentException("http-port out of range: " + httpPort);
                    }
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--db-url", "-d" -> {
                    ensureValue(args, i);
                    url = args[++i];
                }

                case "--db-user" -> {
                    ensureValue(args, i);
                    user = args[++i];
                }

                case "--db-password" -> {
                    ensureValue(args, i);
                    password = args[++i];
                }

                case "--max-connections" -> {
                    ensureValue(args, i);
                    maxConnections = parseInt(args[i], args[++i]);
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        StoreConfig store = configPath != null
                ? StoreConfig.fromJsonFile(Path.of(configPath))
                : StoreConfig.defaults();
        if (url != null) {
            store = store.withUrl(url);
        }
        if (user != null || password != null) {
            store = store.withCredentials(
                    user != null ? user : store.user(),
                    password != null ? password : store.password());
        }
        if (maxConnections != null) {
            store = store.withMaxConnections(maxConnections);
        }
        return new ServerConfig(httpPort, store);
    }

    /**
     * Parse args for the process entry point: prints help or the error and exits
     * on bad input.
     */
    public static ServerConfig fromArgs(String[] args) {
        try {
            return parse(args);
        } catch (HelpRequested help) {
            System.out.println(usage());
            System.exit(0);
        } catch (IllegalArgumentException bad) {
            System.err.println(bad.getMessage());
            System.err.println(usage());
            System.exit(1);
        }
        throw new IllegalStateException("unreachable");
    }

    static String usage() {
        return """
            Usage: fset-server [options]

            Options:
              --http-port,  -p   HTTP port (default: 8080)
              --config,     -c   JSON store config file (optional)
              --db-url,     -d   JDBC url (default: jdbc:h2:./data/fset)
              --db-user          Database user (default: sa)
              --db-password      Database password (default: empty)
              --max-connections  Connection pool size (default: 10)
              --help,       -h   Show this help message
            """;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + ": " + value, e);
        }
    }

    /** Thrown by {@link #parse(String[])} when --help is given. */
    static final class HelpRequested extends RuntimeException {
        HelpRequested() {
            super("help requested");
        }
    }
}
