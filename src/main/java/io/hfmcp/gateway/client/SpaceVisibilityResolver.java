package io.hfmcp.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

/**
 * Decides whether a Space is private, and therefore whether it gets the caller's token.
 *
 * <p>Without a token every Space is treated as public. Lookups are cached.</p>
 */
@Service
public class SpaceVisibilityResolver {

    private static final Logger log = LoggerFactory.getLogger(SpaceVisibilityResolver.class);

    private final HubApiClient hubApiClient;
    private final Cache<String, Visibility> cache;

    public SpaceVisibilityResolver(HubApiClient hubApiClient, Cache<String, Visibility> spaceVisibilityCache) {
        this.hubApiClient = hubApiClient;
        this.cache = spaceVisibilityCache;
    }

    /**
     * @param spaceName {@code owner/space}
     * @param token caller token, may be null
     * @return the visibility; public when it cannot be determined
     */
    public Visibility resolve(String spaceName, String token) {
        if (token == null) {
            return Visibility.PUBLIC;
        }
        Visibility cached = cache.getIfPresent(spaceName);
        if (cached != null) {
            return cached;
        }
        try {
            JsonNode info = hubApiClient.getJson("/api/spaces/" + spaceName, null, token);
            Visibility visibility = info != null && info.path("private").asBoolean(false)
                ? Visibility.PRIVATE : Visibility.PUBLIC;
            cache.put(spaceName, visibility);
            log.debug("Space {} is {}", spaceName, visibility);
            return visibility;
        } catch (RestClientException e) {
            log.debug("Visibility lookup for {} failed, treating as public: {}", spaceName, e.getMessage());
            return Visibility.PUBLIC;
        }
    }
}
