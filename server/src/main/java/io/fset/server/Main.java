// file: server/src/main/java/io/fset/server/Main.java
package io.fset.server;

import io.fset.core.ProjectDefaults;
import io.fset.storage.JdbcProjectRepository;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for an fset server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON store config).
 *  - Open the connection pool and create the schema if needed.
 *  - Wire ProjectService (and its DiffReconciler) and the HTTP layer.
 *  - Close the pool on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        var store = cfg.store();

        // ------ Storage Layer -------
        var repository = JdbcProjectRepository.open(
                store.url(), store.user(), store.password(), store.maxConnections());

        // ------ Application + HTTP layer ------
        var service = new ProjectService(repository, ProjectDefaults.system());
        var web = new WebServer(cfg.httpPort(), service);

        web.start();
        log.log(Level.INFO, "fset server listening on http://localhost:{0} (store {1})",
                new Object[]{String.valueOf(cfg.httpPort()), store.url()});

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                repository.close();
            }
        }));
    }
}
