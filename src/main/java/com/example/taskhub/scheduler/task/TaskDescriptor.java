package com.example.taskhub.scheduler.task;

import com.example.taskhub.scheduler.service.RetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Registered task: schema, execution contract and per-task execution settings.
 * {@code timeout} and {@code retryPolicy} may be null, in which case the global defaults apply.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "contract")
public class TaskDescriptor {
    private final String name;
    private final String description;
    @Singular
    private final List<ParameterSpec> parameters;
    private final TaskContract contract;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public Optional<ParameterSpec> findParameter(String parameterName) {
        for (ParameterSpec p : parameters) {
            if (p.getName().equals(parameterName)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
