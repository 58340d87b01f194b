package com.example.taskhub.scheduler.domain;

import com.example.taskhub.scheduler.exception.ParameterValidationException;
import com.example.taskhub.scheduler.exception.TaskTimeoutException;
import com.example.taskhub.scheduler.exception.UnknownTaskException;

public enum ErrorKind {
    UNKNOWN_TASK(false),
    PARAMETER_VALIDATION(false),
    TASK_TIMEOUT(true),
    TASK_EXECUTION(true),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ErrorKind of(Throwable error) {
        if (error instanceof UnknownTaskException) return UNKNOWN_TASK;
        if (error instanceof ParameterValidationException) return PARAMETER_VALIDATION;
        if (error instanceof TaskTimeoutException) return TASK_TIMEOUT;
        return TASK_EXECUTION;
    }
}
