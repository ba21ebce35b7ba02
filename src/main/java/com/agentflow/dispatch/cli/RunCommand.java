package com.agentflow.dispatch.cli;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.graph.WorkflowValidationException;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.scheduler.DeadlockException;
import com.agentflow.core.scheduler.WorkflowScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentflow run &lt;file.json&gt; [--input key=value ...]
 * <p>
 * Loads a workflow file, runs it with the agents it declares and prints
 * per-wave progress followed by a summary. Exits 1 when the run does not
 * complete successfully.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow file")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow JSON file")
    private Path file;

    @Option(names = {"--input", "-i"}, description = "Workflow input entry (repeatable): key=value")
    private Map<String, String> input = new LinkedHashMap<>();

    private final WorkflowScheduler scheduler;
    private final WorkflowFileReader reader;
    private final EventBus eventBus;

    public RunCommand(WorkflowScheduler scheduler, WorkflowFileReader reader, EventBus eventBus) {
        this.scheduler = scheduler;
        this.reader = reader;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Workflow workflow;
        try {
            workflow = reader.read(file);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info(String.format("Running workflow %s (%s): %d tasks, %d agents",
                workflow.id(), workflow.name(), workflow.tasks().size(), workflow.agents().size()));

        var subscription = eventBus.subscribe(workflow.id(), ConsoleOutput::event);
        WorkflowExecution execution;
        try {
            execution = scheduler.run(workflow, workflow.agents(), new LinkedHashMap<>(input), null);
        } catch (WorkflowValidationException e) {
            ConsoleOutput.error("Workflow is invalid:");
            for (var violation : e.getViolations()) {
                ConsoleOutput.error("  " + violation);
            }
            return 1;
        } catch (DeadlockException e) {
            printResults(workflow, e.getExecution());
            System.out.println();
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        printResults(workflow, execution);

        System.out.println();
        if (execution.getStatus() == ExecutionStatus.COMPLETED) {
            ConsoleOutput.success("Workflow complete.");
            return 0;
        }
        ConsoleOutput.error("Workflow " + execution.getStatus().name().toLowerCase() + ".");
        return 1;
    }

    private static void printResults(Workflow workflow, WorkflowExecution execution) {
        System.out.println();
        for (var task : workflow.tasks()) {
            var result = execution.getResult(task.id());
            if (result != null) {
                ConsoleOutput.taskResult(result);
            } else if (execution.getBlockedTaskIds().contains(task.id())) {
                ConsoleOutput.error("  " + task.id() + " not run: a dependency failed");
            }
        }
        ConsoleOutput.summary(execution.summary(), execution.getWaveCount());
    }
}
