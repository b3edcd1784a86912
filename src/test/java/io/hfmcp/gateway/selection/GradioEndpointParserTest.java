package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.model.RemoteEndpoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GradioEndpointParserTest {

    @Test
    void parsesCommaSeparatedNames() {
        List<RemoteEndpoint> endpoints = GradioEndpointParser.parse(" owner/space , other/my_app.v2 ");

        assertThat(endpoints).extracting(RemoteEndpoint::name).containsExactly("owner/space", "other/my_app.v2");
        assertThat(endpoints).extracting(RemoteEndpoint::subdomain).containsExactly("owner-space", "other-my-app-v2");
        assertThat(endpoints.get(0).id()).isEqualTo("gradio_owner-space");
        assertThat(endpoints.get(0).visibility()).isEqualTo(RemoteEndpoint.Visibility.PUBLIC);
    }

    @Test
    void skipsEntriesWithoutExactlyOneSlash() {
        assertThat(GradioEndpointParser.parse("noslash,a/b/c,,ok/one"))
            .extracting(RemoteEndpoint::name)
            .containsExactly("ok/one");
    }

    @Test
    void noneAndBlankYieldNothing() {
        assertThat(GradioEndpointParser.parse(null)).isEmpty();
        assertThat(GradioEndpointParser.parse("  ")).isEmpty();
        assertThat(GradioEndpointParser.parse("NONE")).isEmpty();
    }
}
