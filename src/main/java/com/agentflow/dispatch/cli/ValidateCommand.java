package com.agentflow.dispatch.cli;

import com.agentflow.core.graph.GraphValidator;
import com.agentflow.core.graph.WorkflowValidationException;
import com.agentflow.core.model.Workflow;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: agentflow validate &lt;file.json&gt;
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a workflow file without running it")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow JSON file")
    private Path file;

    private final GraphValidator graphValidator;
    private final WorkflowFileReader reader;

    public ValidateCommand(GraphValidator graphValidator, WorkflowFileReader reader) {
        this.graphValidator = graphValidator;
        this.reader = reader;
    }

    @Override
    public Integer call() {
        Workflow workflow;
        try {
            workflow = reader.read(file);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        try {
            graphValidator.validateWorkflow(workflow);
        } catch (WorkflowValidationException e) {
            ConsoleOutput.error("Workflow " + workflow.id() + " is invalid (" + e.getViolations().size() + "):");
            for (var violation : e.getViolations()) {
                ConsoleOutput.error("  " + violation);
            }
            return 1;
        }

        int edges = graphValidator.deriveEdges(workflow).size();
        ConsoleOutput.success(String.format("Workflow %s is valid: %d tasks, %d agents, %d edges",
                workflow.id(), workflow.tasks().size(), workflow.agents().size(), edges));
        return 0;
    }
}
