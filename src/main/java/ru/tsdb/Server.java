package ru.tsdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tsdb.config.LoggingConfigurator;
import ru.tsdb.config.TSDBConfig;
import ru.tsdb.errors.TSDBException;
import ru.tsdb.server.TSDBServer;

/**
 * Starts the service from the environment configuration and waits for shutdown
 */
public final class Server {

    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private Server() {
        // Not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        final TSDBConfig config = TSDBConfig.load();
        LoggingConfigurator.apply(config.getLogging());
        TSDBServer.configureHttpTimeouts(config.getServer());

        final TSDBService service;
        try {
            service = TSDBServiceFactory.create(config);
            service.start();
        } catch (TSDBException e) {
            log.error("Failed to start server: [{}] {}", e.getType(), e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                service.shutdown(config.getServer().getShutdownTimeout());
            } catch (TSDBException e) {
                log.error("Server forced to shutdown: [{}] {}", e.getType(), e.getMessage());
            }
        }, "tsdb-shutdown"));

        service.awaitTermination();
        log.info("Server exited");
    }
}
