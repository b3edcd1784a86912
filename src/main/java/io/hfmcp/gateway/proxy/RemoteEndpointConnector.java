package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.client.RemoteToolProvider;
import io.hfmcp.gateway.client.SpaceVisibilityResolver;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;
import io.hfmcp.gateway.model.RemoteToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Discovers the tools of remote endpoints in parallel.
 *
 * <p>Every endpoint gets its own timeout, counted from the moment its discovery task starts
 * running. A task that times out is cancelled so its pool thread is released. A slow or failing
 * endpoint turns into a failed {@link RemoteConnection} without affecting the others, and the
 * call returns once every endpoint has either answered or timed out.</p>
 */
@Service
public class RemoteEndpointConnector {

    private static final Logger log = LoggerFactory.getLogger(RemoteEndpointConnector.class);

    private final RemoteToolProvider provider;
    private final SpaceVisibilityResolver visibilityResolver;
    private final SchemaParser schemaParser;
    private final Executor executor;
    private final Duration timeout;
    private final Set<String> reportedFailures = ConcurrentHashMap.newKeySet();

    @Autowired
    public RemoteEndpointConnector(RemoteToolProvider provider,
                                   SpaceVisibilityResolver visibilityResolver,
                                   SchemaParser schemaParser,
                                   @Qualifier("connectorExecutor") Executor executor,
                                   GatewayProperties properties) {
        this(provider, visibilityResolver, schemaParser, executor, properties.getRemote().getConnectionTimeout());
    }

    public RemoteEndpointConnector(RemoteToolProvider provider,
                                   SpaceVisibilityResolver visibilityResolver,
                                   SchemaParser schemaParser,
                                   Executor executor,
                                   Duration timeout) {
        this.provider = provider;
        this.visibilityResolver = visibilityResolver;
        this.schemaParser = schemaParser;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Discover the tools of every endpoint.
     *
     * @param endpoints candidate endpoints; the 1-based position is the endpoint ordinal
     * @param token caller token, sent only to private endpoints
     * @return one connection per endpoint with an address, in input order
     */
    public List<RemoteConnection> connect(List<RemoteEndpoint> endpoints, String token) {
        List<CompletableFuture<RemoteConnection>> futures = new ArrayList<>();
        for (int i = 0; i < endpoints.size(); i++) {
            RemoteEndpoint endpoint = endpoints.get(i);
            int ordinal = i + 1;
            if (!endpoint.hasAddress()) {
                log.warn("Skipping remote endpoint {}: no subdomain", endpoint.name());
                continue;
            }
            futures.add(submit(endpoint, ordinal, token)
                .exceptionally(error -> failed(endpoint, ordinal, error)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<RemoteConnection> connections = futures.stream().map(CompletableFuture::join).toList();
        long successful = connections.stream().filter(RemoteConnection::success).count();
        log.debug("Connected to {}/{} remote endpoints", successful, connections.size());
        return connections;
    }

    private CompletableFuture<RemoteConnection> submit(RemoteEndpoint endpoint, int ordinal, String token) {
        CompletableFuture<RemoteConnection> result = new CompletableFuture<>();
        FutureTask<Void> task = new FutureTask<>(() -> {
            result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(discover(endpoint, ordinal, token));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, null);
        result.whenComplete((connection, error) -> {
            if (error != null && unwrap(error) instanceof TimeoutException) {
                task.cancel(true);
            }
        });
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private RemoteConnection discover(RemoteEndpoint endpoint, int ordinal, String token) {
        Visibility visibility = visibilityResolver.resolve(endpoint.name(), token);
        RemoteEndpoint resolved = endpoint.withVisibility(visibility);
        String schemaToken = visibility == Visibility.PRIVATE ? token : null;
        List<RemoteToolSpec> tools = schemaParser.parse(provider.fetchSchema(resolved, schemaToken), endpoint.id());
        return RemoteConnection.success(resolved, ordinal, tools);
    }

    private RemoteConnection failed(RemoteEndpoint endpoint, int ordinal, Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause instanceof TimeoutException
            ? "Connection timeout after " + timeout.toMillis() + "ms"
            : String.valueOf(cause.getMessage());
        if (reportedFailures.add(endpoint.name())) {
            log.error("Failed to connect to remote endpoint {}: {}", endpoint.name(), message);
        } else {
            log.debug("Failed to connect to remote endpoint {}: {}", endpoint.name(), message);
        }
        return RemoteConnection.failure(endpoint, ordinal, message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
