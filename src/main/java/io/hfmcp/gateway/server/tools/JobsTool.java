package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Manages Hugging Face Jobs: {@code ps}, {@code inspect}, {@code logs} and {@code cancel}.
 *
 * <p>The {@code operation} argument selects a command from a {@link CommandTable}; the
 * {@code args} object is validated against that command's own schema.</p>
 */
@Component
public class JobsTool implements LocalTool {

    private static final Logger log = LoggerFactory.getLogger(JobsTool.class);

    static final int DEFAULT_LOG_LINES = 50;

    /**
     * Per-call state shared by the commands.
     */
    record JobContext(String token) {
    }

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final HubApiClient hubApiClient;
    private final ObjectMapper objectMapper;
    private final CommandTable<JobContext> commands;

    public JobsTool(HubApiClient hubApiClient, ObjectMapper objectMapper) {
        this.hubApiClient = hubApiClient;
        this.objectMapper = objectMapper;
        this.commands = CommandTable.<JobContext>builder()
            .command("ps", "List jobs (running only unless all=true)",
                InputSchema.builder()
                    .property("namespace", ParamSchema.string("User or organization; defaults to the caller").asOptional())
                    .property("all", ParamSchema.bool("Include finished jobs").withDefault(false))
                    .build(),
                this::listJobs)
            .command("inspect", "Show the details of a job",
                jobSchema().build(),
                this::inspectJob)
            .command("logs", "Show the last log lines of a job",
                jobSchema()
                    .property("tail", ParamSchema.number("Number of lines").withDefault(DEFAULT_LOG_LINES))
                    .build(),
                this::jobLogs)
            .command("cancel", "Cancel a running job",
                jobSchema().build(),
                this::cancelJob)
            .build();
    }

    @Override
    public String id() {
        return ToolIds.JOBS;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Hugging Face Jobs")
            .description("Manage Hugging Face Jobs. Operations:\n" + commands.usage())
            .inputSchema(InputSchema.builder()
                .property("operation", ParamSchema.string("One of: " + String.join(", ", commands.operations())))
                .property("args", ParamSchema.of(ParamSchema.Type.OBJECT).withDescription("Operation arguments").asOptional())
                .build())
            .annotation("openWorldHint", true)
            .handler((arguments, context) -> dispatch(arguments, new JobContext(token)))
            .build();
    }

    Map<String, Object> dispatch(Map<String, Object> arguments, JobContext context) throws Exception {
        String operation = (String) arguments.get("operation");
        if ("help".equals(operation)) {
            return ToolResults.text("Available operations:\n" + commands.usage());
        }
        CommandTable.Command<JobContext> command = commands.find(operation).orElse(null);
        if (command == null) {
            return ToolResults.error("Unknown operation '" + operation + "'. Available operations:\n" + commands.usage());
        }
        Map<String, Object> args = objectMapper.convertValue(arguments.getOrDefault("args", Map.of()), ARGS_TYPE);
        log.debug("Running jobs operation {}", operation);
        return command.handler().execute(command.arguments().validate(args), context);
    }

    private Map<String, Object> listJobs(Map<String, Object> args, JobContext context) {
        String namespace = namespace(args, context);
        boolean all = Boolean.TRUE.equals(args.get("all"));
        JsonNode jobs = hubApiClient.getJson("/api/jobs/" + namespace, null, context.token());
        StringBuilder text = new StringBuilder();
        int shown = 0;
        if (jobs != null) {
            for (JsonNode job : jobs) {
                String stage = job.path("status").path("stage").asText("UNKNOWN");
                if (!all && !"RUNNING".equals(stage)) {
                    continue;
                }
                shown++;
                text.append("- ").append(job.path("id").asText()).append(" [").append(stage).append("] ")
                    .append(job.path("dockerImage").asText(job.path("spaceId").asText("")));
                if (job.path("command").isArray()) {
                    StringBuilder command = new StringBuilder();
                    job.path("command").forEach(part -> command.append(command.length() > 0 ? " " : "").append(part.asText()));
                    text.append(" `").append(command).append('`');
                }
                text.append('\n');
            }
        }
        if (shown == 0) {
            return ToolResults.text(all ? "No jobs found for " + namespace + "." : "No running jobs for " + namespace + ".");
        }
        return ToolResults.text(text.toString().trim());
    }

    private Map<String, Object> inspectJob(Map<String, Object> args, JobContext context) throws Exception {
        JsonNode job = hubApiClient.getJson(jobPath(args, context), null, context.token());
        return ToolResults.text(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(job));
    }

    private Map<String, Object> jobLogs(Map<String, Object> args, JobContext context) {
        int tail = Math.max(1, ((Number) args.get("tail")).intValue());
        String body = hubApiClient.getText(hubApiClient.getHubUrl() + jobPath(args, context) + "/logs", context.token());
        Deque<String> lines = new ArrayDeque<>();
        for (String line : body.split("\n")) {
            String entry = logLine(line);
            if (entry == null) {
                continue;
            }
            lines.addLast(entry);
            if (lines.size() > tail) {
                lines.removeFirst();
            }
        }
        return ToolResults.text(lines.isEmpty() ? "No logs available." : String.join("\n", lines));
    }

    private Map<String, Object> cancelJob(Map<String, Object> args, JobContext context) {
        hubApiClient.postJson(jobPath(args, context) + "/cancel", Map.of(), context.token());
        return ToolResults.text("Cancellation requested for job " + args.get("job_id") + ".");
    }

    /**
     * Log lines arrive as server-sent events whose data is {@code {"data": "...", "timestamp": "..."}}.
     */
    private String logLine(String line) {
        if (!line.startsWith("data:")) {
            return line.isBlank() ? null : line;
        }
        String payload = line.substring(5).trim();
        try {
            JsonNode node = objectMapper.readTree(payload);
            return node.has("data") ? node.path("data").asText() : payload;
        } catch (Exception e) {
            return payload;
        }
    }

    private String jobPath(Map<String, Object> args, JobContext context) {
        return "/api/jobs/" + namespace(args, context) + "/" + args.get("job_id");
    }

    private String namespace(Map<String, Object> args, JobContext context) {
        if (args.get("namespace") instanceof String namespace && !namespace.isBlank()) {
            return namespace;
        }
        if (context.token() == null) {
            throw new IllegalStateException("Authentication required: provide a namespace or a Hugging Face token");
        }
        return hubApiClient.getJson("/api/whoami-v2", null, context.token()).path("name").asText();
    }

    private static InputSchema.Builder jobSchema() {
        return InputSchema.builder()
            .property("job_id", ParamSchema.string("Job id"))
            .property("namespace", ParamSchema.string("User or organization; defaults to the caller").asOptional());
    }
}
