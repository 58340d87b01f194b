package com.example.taskhub.scheduler.exception;

import lombok.Getter;

@Getter
public class InvalidCronExpressionException extends SchedulerException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }
}
