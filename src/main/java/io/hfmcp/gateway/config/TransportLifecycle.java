package io.hfmcp.gateway.config;

import io.hfmcp.gateway.transport.McpTransport;
import io.hfmcp.gateway.transport.TransportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the transport with the application context and stops it first on shutdown, before the
 * web server goes away.
 */
@Component
public class TransportLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TransportLifecycle.class);

    private final McpTransport transport;
    private final ConfigurableApplicationContext applicationContext;
    private volatile boolean running;

    public TransportLifecycle(McpTransport transport, ConfigurableApplicationContext applicationContext) {
        this.transport = transport;
        this.applicationContext = applicationContext;
    }

    @Override
    public void start() {
        transport.initialize(new TransportOptions(
            (clientInfo, sampling, roots) -> log.info("Client initialized: {} (sampling: {}, roots: {})",
                clientInfo != null ? clientInfo.key() : "unknown", sampling, roots),
            this::closeApplication));
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping {} transport", transport.type().value());
        transport.shutdown();
        transport.cleanup();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void closeApplication() {
        log.info("Transport input closed, stopping application");
        applicationContext.close();
    }
}
