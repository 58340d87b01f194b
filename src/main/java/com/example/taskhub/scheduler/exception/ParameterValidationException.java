package com.example.taskhub.scheduler.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Bound parameters do not satisfy a task's schema. Carries every problem found, not only the first.
 */
@Getter
public class ParameterValidationException extends SchedulerException {

    private final String taskName;
    private final List<String> problems;

    public ParameterValidationException(String taskName, List<String> problems) {
        super("Invalid parameters for task '" + taskName + "': " + String.join("; ", problems));
        this.taskName = taskName;
        this.problems = Collections.unmodifiableList(problems);
    }
}
