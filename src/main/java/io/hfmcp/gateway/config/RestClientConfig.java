package io.hfmcp.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients and thread pools used to reach the Hub and remote endpoints.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class RestClientConfig {

    private static final Logger log = LoggerFactory.getLogger(RestClientConfig.class);

    private final GatewayProperties properties;

    public RestClientConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * RestTemplate for Hub API calls made by the local tools.
     */
    @Bean
    @Primary
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        GatewayProperties.RemoteConfig remote = properties.getRemote();
        log.info("Created Hub RestTemplate with connect timeout: {}, read timeout: {}",
            remote.getConnectTimeout(), remote.getReadTimeout());
        return builder
            .setConnectTimeout(remote.getConnectTimeout())
            .setReadTimeout(remote.getReadTimeout())
            .build();
    }

    /**
     * RestTemplate for schema fetches. Neither connect nor read may outlast the per-endpoint
     * connection timeout.
     */
    @Bean
    public RestTemplate schemaRestTemplate(RestTemplateBuilder builder) {
        GatewayProperties.RemoteConfig remote = properties.getRemote();
        Duration limit = remote.getConnectionTimeout();
        Duration connect = remote.getConnectTimeout().compareTo(limit) < 0 ? remote.getConnectTimeout() : limit;
        log.info("Created schema RestTemplate with connect timeout: {}, read timeout: {}", connect, limit);
        return builder
            .setConnectTimeout(connect)
            .setReadTimeout(limit)
            .build();
    }

    /**
     * RestTemplate for tool calls against remote endpoints. Tool calls may stream for minutes,
     * so reads are bounded by the call timeout.
     */
    @Bean
    public RestTemplate remoteRestTemplate(RestTemplateBuilder builder) {
        GatewayProperties.RemoteConfig remote = properties.getRemote();
        log.info("Created remote RestTemplate with connect timeout: {}, call timeout: {}",
            remote.getConnectTimeout(), remote.getCallTimeout());
        return builder
            .setConnectTimeout(remote.getConnectTimeout())
            .setReadTimeout(remote.getCallTimeout())
            .build();
    }

    @Bean
    public ThreadPoolTaskExecutor connectorExecutor() {
        int threads = properties.getRemote().getConnectorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("endpoint-connector-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Created endpoint connector pool with {} threads", threads);
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler transportScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("transport-");
        scheduler.initialize();
        return scheduler;
    }
}
