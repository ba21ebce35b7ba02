package com.agentflow.dispatch.cli;

import com.agentflow.core.model.Task;
import com.agentflow.core.model.Workflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a {@link Workflow} (with its agents) from a JSON file.
 * <p>
 * Tasks that omit {@code maxRetries} get {@link Task#DEFAULT_MAX_RETRIES}.
 * Unknown properties are ignored so files exported by other tools still load.
 */
@Component
public class WorkflowFileReader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowFileReader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalArgumentException if the file is not a workflow JSON object
     */
    public Workflow read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow file " + file, e);
        }
        return parse(json);
    }

    public Workflow parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Workflow file must contain a JSON object");
        }
        JsonNode tasks = root.get("tasks");
        if (tasks != null && tasks.isArray()) {
            for (JsonNode task : tasks) {
                if (task.isObject() && !task.has("maxRetries")) {
                    ((ObjectNode) task).put("maxRetries", Task.DEFAULT_MAX_RETRIES);
                }
            }
        }
        try {
            Workflow workflow = mapper.treeToValue(root, Workflow.class);
            log.debug("Loaded workflow {} with {} tasks and {} agents",
                    workflow.id(), workflow.tasks().size(), workflow.agents().size());
            return workflow;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow JSON: " + e.getMessage(), e);
        }
    }
}
