package com.example.taskhub.scheduler.config;

import com.example.taskhub.scheduler.service.ExponentialBackoffRetryPolicy;
import com.example.taskhub.scheduler.service.RetryPolicy;
import com.example.taskhub.scheduler.task.TaskDefinitionProvider;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.example.taskhub.scheduler.task.TaskRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

/**
 * 启动时把所有 TaskDefinitionProvider bean 提供的任务注册到 TaskRegistry。
 * 优先级：tasks.properties 覆盖项 > 任务自身声明 > 全局默认（scheduler.default-timeout-ms / scheduler.retry.*）。
 * 重名任务直接启动失败。
 */
@Slf4j
@Component
public class TaskRegistrar {

    private final TaskRegistry registry;
    private final List<TaskDefinitionProvider> providers;
    private final TaskOverridesConfig overrides;
    private final SchedulerProperties props;

    public TaskRegistrar(TaskRegistry registry, List<TaskDefinitionProvider> providers,
                         TaskOverridesConfig overrides, SchedulerProperties props) {
        this.registry = registry;
        this.providers = providers;
        this.overrides = overrides;
        this.props = props;
    }

    @PostConstruct
    public void init() {
        if (providers == null || providers.isEmpty()) {
            log.warn("No TaskDefinitionProvider found in context; no tasks registered.");
            return;
        }
        for (TaskDefinitionProvider provider : providers) {
            for (TaskDescriptor d : provider.taskDefinitions()) {
                registry.register(applyOverrides(d));
            }
        }
        log.info("TaskRegistrar finished. Registered tasks: {}", registry.all().size());
    }

    TaskDescriptor applyOverrides(TaskDescriptor d) {
        String name = d.getName();
        Duration timeout = d.getTimeout();
        OptionalLong t = overrides.timeoutMs(name);
        if (t.isPresent()) {
            timeout = Duration.ofMillis(t.getAsLong());
        } else if (timeout == null) {
            timeout = Duration.ofMillis(props.getDefaultTimeoutMs());
        }

        RetryPolicy retry = d.getRetryPolicy();
        if (overrides.hasRetryOverride(name)) {
            SchedulerProperties.RetryConfig defaults = props.getRetry();
            retry = new ExponentialBackoffRetryPolicy(
                    Duration.ofMillis(overrides.retryBaseDelayMs(name).orElse(defaults.getBaseDelayMs())),
                    Duration.ofMillis(overrides.retryMaxDelayMs(name).orElse(defaults.getMaxDelayMs())),
                    (int) overrides.retryMaxAttempts(name).orElse(defaults.getMaxAttempts()));
            log.info("Task {} uses retry override {}", name, retry);
        }
        return d.toBuilder().timeout(timeout).retryPolicy(retry).build();
    }
}
