package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InvalidParamsException;
import io.hfmcp.gateway.protocol.ToolResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.hfmcp.gateway.server.tools.DocFetchToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobsToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HubApiClient hubApiClient;
    private JobsTool tool;

    @BeforeEach
    void setUp() {
        hubApiClient = mock(HubApiClient.class);
        tool = new JobsTool(hubApiClient, mapper);
    }

    @Test
    void psListsOnlyRunningJobsByDefault() throws Exception {
        when(hubApiClient.getJson("/api/jobs/alice", null, "tok")).thenReturn(mapper.readTree("""
            [
              {"id": "j1", "status": {"stage": "RUNNING"}, "dockerImage": "python:3.12", "command": ["python", "train.py"]},
              {"id": "j2", "status": {"stage": "COMPLETED"}, "dockerImage": "ubuntu"}
            ]
            """));

        Map<String, Object> result = tool.dispatch(
            Map.of("operation", "ps", "args", Map.of("namespace", "alice")), new JobsTool.JobContext("tok"));

        assertThat(text(result)).isEqualTo("- j1 [RUNNING] python:3.12 `python train.py`");
    }

    @Test
    void psResolvesNamespaceFromToken() throws Exception {
        when(hubApiClient.getJson("/api/whoami-v2", null, "tok")).thenReturn(mapper.readTree("{\"name\": \"bob\"}"));
        when(hubApiClient.getJson("/api/jobs/bob", null, "tok")).thenReturn(mapper.readTree("[]"));

        Map<String, Object> result = tool.dispatch(
            Map.of("operation", "ps", "args", Map.of("all", true)), new JobsTool.JobContext("tok"));

        assertThat(text(result)).isEqualTo("No jobs found for bob.");
    }

    @Test
    void logsKeepTheLastLines() throws Exception {
        when(hubApiClient.getHubUrl()).thenReturn("https://huggingface.co");
        when(hubApiClient.getText("https://huggingface.co/api/jobs/alice/j1/logs", "tok")).thenReturn(
            "data: {\"data\": \"one\", \"timestamp\": \"t1\"}\n"
                + "data: {\"data\": \"two\", \"timestamp\": \"t2\"}\n"
                + "\n"
                + "data: {\"data\": \"three\", \"timestamp\": \"t3\"}\n");

        Map<String, Object> result = tool.dispatch(
            Map.of("operation", "logs", "args", Map.of("job_id", "j1", "namespace", "alice", "tail", 2)),
            new JobsTool.JobContext("tok"));

        assertThat(text(result)).isEqualTo("two\nthree");
    }

    @Test
    void cancelPostsToJob() throws Exception {
        Map<String, Object> result = tool.dispatch(
            Map.of("operation", "cancel", "args", Map.of("job_id", "j1", "namespace", "alice")),
            new JobsTool.JobContext("tok"));

        verify(hubApiClient).postJson(eq("/api/jobs/alice/j1/cancel"), any(), eq("tok"));
        assertThat(text(result)).isEqualTo("Cancellation requested for job j1.");
    }

    @Test
    void unknownOperationListsAvailableOnes() throws Exception {
        Map<String, Object> result = tool.dispatch(Map.of("operation", "run"), new JobsTool.JobContext(null));

        assertThat(ToolResults.isError(result)).isTrue();
        assertThat(text(result)).startsWith("Unknown operation 'run'").contains("ps", "inspect", "logs", "cancel");
    }

    @Test
    void missingJobIdIsInvalidParams() {
        assertThatThrownBy(() -> tool.dispatch(
            Map.of("operation", "inspect", "args", Map.of("namespace", "alice")), new JobsTool.JobContext(null)))
            .isInstanceOf(InvalidParamsException.class)
            .hasMessageContaining("job_id");
    }

    @Test
    void psWithoutNamespaceOrTokenFails() {
        assertThatThrownBy(() -> tool.dispatch(Map.of("operation", "ps"), new JobsTool.JobContext(null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Authentication required");
    }
}
