package com.mpl;

import com.mpl.infrastructure.config.JacksonConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String CONFIG_RESOURCE = "application.json";

    public static void main(String[] args) {
        log.info("Starting Maternity Pay Ledger...");

        writePidToFile();

        JsonObject config = loadConfig();
        JacksonConfig.configureVertx();

        Vertx vertx = Vertx.vertx(new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2));

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Maternity Pay Ledger...");
                        vertx.close();
                    }));

                    int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);
                    log.info("Maternity Pay Ledger is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/cases", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    static JsonObject loadConfig() {
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(CONFIG_RESOURCE + " not found in classpath");
            }
            JsonObject config = new JsonObject(new String(is.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Loaded configuration from {}", CONFIG_RESOURCE);
            return config;
        } catch (IOException e) {
            log.error("Failed to load {}: {}", CONFIG_RESOURCE, e.getMessage());
            throw new IllegalStateException("Configuration error: " + CONFIG_RESOURCE + " required", e);
        }
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
