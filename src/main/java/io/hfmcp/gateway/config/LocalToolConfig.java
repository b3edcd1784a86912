package io.hfmcp.gateway.config;

import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.server.tools.RepoSearchTool;
import io.hfmcp.gateway.server.tools.RepoSearchTool.RepoKind;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the repository search tools, one per repository kind.
 */
@Configuration
public class LocalToolConfig {

    @Bean
    public RepoSearchTool modelSearchTool(HubApiClient hubApiClient) {
        return new RepoSearchTool(hubApiClient, RepoKind.MODEL);
    }

    @Bean
    public RepoSearchTool datasetSearchTool(HubApiClient hubApiClient) {
        return new RepoSearchTool(hubApiClient, RepoKind.DATASET);
    }

    @Bean
    public RepoSearchTool spaceSearchTool(HubApiClient hubApiClient) {
        return new RepoSearchTool(hubApiClient, RepoKind.SPACE);
    }
}
