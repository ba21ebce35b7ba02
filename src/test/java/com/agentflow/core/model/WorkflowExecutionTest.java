package com.agentflow.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowExecutionTest {

    private WorkflowExecution execution;

    @BeforeEach
    void setUp() {
        execution = new WorkflowExecution("wf-1", 4, Map.of("topic", "x"));
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        @DisplayName("starts pending, start moves to running and stamps startedAt")
        void start() {
            assertEquals(ExecutionStatus.PENDING, execution.getStatus());
            assertTrue(execution.start());
            assertEquals(ExecutionStatus.RUNNING, execution.getStatus());
            assertNotNull(execution.getStartedAt());
            assertFalse(execution.start());
        }

        @Test
        @DisplayName("pause and resume only from the matching state")
        void pauseResume() {
            assertFalse(execution.pause());
            execution.start();
            assertFalse(execution.resume());
            assertTrue(execution.pause());
            assertEquals(ExecutionStatus.PAUSED, execution.getStatus());
            execution.releaseController();
            assertTrue(execution.resume());
            assertTrue(execution.isRunning());
            assertTrue(execution.isControllerActive());
        }

        @Test
        @DisplayName("resume is refused while the pausing loop still holds the controller")
        void resumeWaitsForController() {
            execution.start();
            execution.pause();

            assertFalse(execution.resume());
            assertEquals(ExecutionStatus.PAUSED, execution.getStatus());

            execution.releaseController();
            assertTrue(execution.resume());
            assertFalse(execution.resume());
        }

        @Test
        @DisplayName("waves are numbered only while running")
        void beginWave() {
            assertEquals(0, execution.beginWave());
            execution.start();
            assertEquals(1, execution.beginWave());
            assertEquals(2, execution.beginWave());
            execution.pause();
            assertEquals(0, execution.beginWave());
            assertEquals(2, execution.getWaveCount());
        }

        @Test
        @DisplayName("stop finalizes as completed once")
        void stop() {
            execution.start();
            assertTrue(execution.stop());
            assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
            assertNotNull(execution.getCompletedAt());
            assertFalse(execution.stop());
            assertFalse(execution.pause());
        }

        @Test
        @DisplayName("finish is a no-op on a terminal execution")
        void finish() {
            execution.start();
            assertTrue(execution.finish(ExecutionStatus.FAILED, "Deadlock"));
            assertEquals("Deadlock", execution.getError());
            assertFalse(execution.finish(ExecutionStatus.COMPLETED, null));
            assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        }

        @Test
        @DisplayName("finish leaves a paused execution paused")
        void finishKeepsPause() {
            execution.start();
            execution.pause();

            assertFalse(execution.finish(ExecutionStatus.COMPLETED, null));
            assertEquals(ExecutionStatus.PAUSED, execution.getStatus());
            assertNull(execution.getCompletedAt());
        }

        @Test
        @DisplayName("finish rejects non-terminal statuses")
        void finishRequiresTerminal() {
            assertThrows(IllegalArgumentException.class, () -> execution.finish(ExecutionStatus.PAUSED, null));
        }
    }

    @Nested
    @DisplayName("results and progress")
    class Results {

        @Test
        @DisplayName("progress is the share of tasks with a result")
        void progress() {
            execution.start();
            execution.recordResult(TaskResult.completed("A", Map.of(), 0, Instant.now()));
            assertEquals(25.0, execution.getProgress());
            execution.recordResult(TaskResult.failed("B", "x", 0, Instant.now()));
            assertEquals(50.0, execution.getProgress());
        }

        @Test
        @DisplayName("a later result for the same task replaces the earlier one")
        void replaces() {
            execution.recordResult(TaskResult.failed("A", "x", 0, Instant.now()));
            execution.recordResult(TaskResult.completed("A", Map.of(), 1, Instant.now()));
            assertEquals(1, execution.getResults().size());
            assertTrue(execution.getResult("A").isCompleted());
        }

        @Test
        @DisplayName("completion sets progress to 100")
        void completeProgress() {
            execution.start();
            execution.finish(ExecutionStatus.COMPLETED, null);
            assertEquals(100.0, execution.getProgress());
        }

        @Test
        @DisplayName("summary counts outcomes and unrun tasks")
        void summary() {
            execution.start();
            execution.recordResult(TaskResult.completed("A", Map.of(), 0, Instant.now()));
            execution.recordResult(TaskResult.failed("B", "x", 0, Instant.now()));
            execution.markBlocked(Set.of("D"));
            execution.finish(ExecutionStatus.FAILED, null);

            var summary = execution.summary();
            assertEquals(4, summary.total());
            assertEquals(1, summary.completed());
            assertEquals(1, summary.failed());
            assertEquals(2, summary.pending());
            assertNotNull(summary.durationMs());
            assertEquals(Set.of("D"), execution.getBlockedTaskIds());
        }

        @Test
        @DisplayName("results view is read-only")
        void readOnlyResults() {
            assertThrows(UnsupportedOperationException.class,
                    () -> execution.getResults().put("A", TaskResult.failed("A", "x", 0, null)));
        }

        @Test
        @DisplayName("null listener falls back to a no-op")
        void nullListener() {
            execution.setListener(null);
            assertDoesNotThrow(() -> execution.getListener().onProgress(execution));
        }
    }
}
