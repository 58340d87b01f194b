package com.example.taskhub.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Execution contract of a task body. Receives parameters already bound against the task's schema,
 * returns a JSON result or throws. Long-running bodies should poll {@link TaskContext#isCancelled()}
 * or react to thread interruption.
 */
@FunctionalInterface
public interface TaskContract {

    JsonNode execute(BoundParameters params, TaskContext context) throws Exception;
}
