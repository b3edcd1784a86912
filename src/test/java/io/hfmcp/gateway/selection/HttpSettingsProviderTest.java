package io.hfmcp.gateway.selection;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.model.AppSettings;
import io.hfmcp.gateway.model.RemoteEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSettingsProviderTest {

    private static final String URL = "http://settings.local/api/settings";

    private MockRestServiceServer server;
    private HttpSettingsProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new HttpSettingsProvider(restTemplate, new ObjectMapper(), URL);
    }

    @Test
    void parsesToolsAndSpacesWithBearerToken() {
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer hf_abc"))
            .andRespond(withSuccess("""
                {
                  "builtInTools": ["model_search", 7, "hf_doc_search"],
                  "spaceTools": [
                    {"_id": "s1", "name": "evalstate/flux", "subdomain": "evalstate-flux", "emoji": "🎨"},
                    {"name": "owner/plain", "subdomain": "owner-plain"},
                    {"subdomain": "nameless"}
                  ]
                }
                """, MediaType.APPLICATION_JSON));

        AppSettings settings = provider.getSettings("hf_abc");

        server.verify();
        assertThat(settings.builtInTools()).containsExactly("model_search", "hf_doc_search");
        assertThat(settings.spaceTools()).containsExactly(
            new RemoteEndpoint("s1", "evalstate/flux", "evalstate-flux", "🎨", RemoteEndpoint.Visibility.PUBLIC),
            new RemoteEndpoint("owner/plain", "owner/plain", "owner-plain", HttpSettingsProvider.DEFAULT_EMOJI,
                RemoteEndpoint.Visibility.PUBLIC));
        assertThat(provider.isExternal()).isTrue();
    }

    @Test
    void serverErrorYieldsNoSettings() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThat(provider.getSettings(null)).isNull();
        server.verify();
    }

    @Test
    void nonObjectBodyYieldsNoSettings() {
        server.expect(requestTo(URL)).andRespond(withSuccess("[1, 2]", MediaType.APPLICATION_JSON));

        assertThat(provider.getSettings(null)).isNull();
    }
}
