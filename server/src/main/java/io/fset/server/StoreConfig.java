// file: server/src/main/java/io/fset/server/StoreConfig.java
package io.fset.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fset.server.dto.JsonStoreConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Connection settings for the backing database.
 */
public record StoreConfig(
        String url,
        String user,
        String password,
        int maxConnections
) {
    public static final String DEFAULT_URL = "jdbc:h2:./data/fset";
    public static final String DEFAULT_USER = "sa";
    public static final int DEFAULT_MAX_CONNECTIONS = 10;

    public StoreConfig {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(user, "user");
        password = password == null ? "" : password;
        if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
    }

    public static StoreConfig defaults() {
        return new StoreConfig(DEFAULT_URL, DEFAULT_USER, "", DEFAULT_MAX_CONNECTIONS);
    }

    /**
     * Read settings from a JSON file; fields missing from the file keep their defaults.
     * Example:
     * <pre>
     *   { "url": "jdbc:h2:/var/lib/fset/db", "user": "sa", "password": "", "maxConnections": 20 }
     * </pre>
     */
    public static StoreConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonStoreConfig cfg = mapper.readValue(path.toFile(), JsonStoreConfig.class);
            StoreConfig d = defaults();
            return new StoreConfig(
                    cfg.url != null ? cfg.url : d.url(),
                    cfg.user != null ? cfg.user : d.user(),
                    cfg.password != null ? cfg.password : d.password(),
                    cfg.maxConnections != null ? cfg.maxConnections : d.maxConnections()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load StoreConfig from " + path, e);
        }
    }

    public StoreConfig withUrl(String url) {
        return new StoreConfig(url, user, password, maxConnections);
    }

    public StoreConfig withCredentials(String user, String password) {
        return new StoreConfig(url, user, password, maxConnections);
    }

    public StoreConfig withMaxConnections(int maxConnections) {
        return new StoreConfig(url, user, password, maxConnections);
    }
}
