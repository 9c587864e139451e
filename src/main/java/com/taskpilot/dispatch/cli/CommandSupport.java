package com.taskpilot.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.core.exception.WorkflowException;
import com.taskpilot.core.persistence.WorkflowJson;
import com.taskpilot.core.persistence.WorkflowStateStoreException;
import com.taskpilot.core.task.TaskNotFoundException;
import com.taskpilot.core.task.TaskRepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntSupplier;

/**
 * Maps core failures to console output and exit codes: 1 for workflow errors, 2 for bad input.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);
    private static final ObjectMapper JSON = WorkflowJson.newObjectMapper();

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private CommandSupport() {}

    static int guard(IntSupplier body) {
        try {
            return body.getAsInt();
        } catch (WorkflowException e) {
            log.debug("Command failed with {}", e.kind(), e);
            ConsoleOutput.workflowError(e);
            return FAILED;
        } catch (TaskNotFoundException | TaskRepositoryException | WorkflowStateStoreException e) {
            log.debug("Storage access failed", e);
            ConsoleOutput.error(e.getMessage());
            return FAILED;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return USAGE;
        }
    }

    static void printJson(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
