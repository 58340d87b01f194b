package com.example.taskhub.scheduler.task;

import com.example.taskhub.scheduler.exception.ParameterValidationException;
import com.example.taskhub.scheduler.exception.UnknownTaskException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * name -> TaskDescriptor。启动时由 TaskRegistrar 注册，之后只读。
 */
@Slf4j
@Component
public class TaskRegistry {

    private final ObjectMapper mapper;
    private final Map<String, TaskDescriptor> tasks = new ConcurrentHashMap<>();

    public TaskRegistry(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void register(TaskDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("TaskDescriptor must not be null");
        }
        String name = descriptor.getName();
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Task name must not be empty");
        }
        if (descriptor.getContract() == null) {
            throw new IllegalArgumentException("Task '" + name + "' has no execution contract");
        }
        Set<String> seen = new HashSet<>();
        for (ParameterSpec p : descriptor.getParameters()) {
            if (!seen.add(p.getName())) {
                throw new IllegalArgumentException("Task '" + name + "' declares parameter '" + p.getName() + "' twice");
            }
        }

        TaskDescriptor prev = tasks.putIfAbsent(name, descriptor);
        if (prev != null) {
            String msg = String.format("Duplicate task name attempted: '%s'", name);
            log.error(msg);
            throw new IllegalStateException(msg);
        }
        log.info("Task registered: {} (params={}, timeout={}, retry={})", name,
                descriptor.getParameters().size(), descriptor.getTimeout(), descriptor.getRetryPolicy());
    }

    public Optional<TaskDescriptor> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tasks.get(name));
    }

    public TaskDescriptor resolve(String name) {
        return find(name).orElseThrow(() -> new UnknownTaskException(name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public List<TaskDescriptor> all() {
        List<TaskDescriptor> list = new ArrayList<>(tasks.values());
        list.sort(Comparator.comparing(TaskDescriptor::getName));
        return list;
    }

    /**
     * 按 schema 校验并绑定参数：未知 key 拒绝，可选参数缺省时填默认值，类型按 ParameterType 规则转换。
     * 所有问题一次性汇总到 ParameterValidationException。
     */
    public BoundParameters validate(TaskDescriptor descriptor, JsonNode params) {
        List<String> problems = new ArrayList<>();
        JsonNode input = (params == null || params.isNull() || params.isMissingNode()) ? mapper.createObjectNode() : params;
        if (!input.isObject()) {
            problems.add("Parameters must be a JSON object");
            throw new ParameterValidationException(descriptor.getName(), problems);
        }

        Iterator<String> names = input.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!descriptor.findParameter(key).isPresent()) {
                problems.add("Unknown parameter '" + key + "'");
            }
        }

        ObjectNode bound = mapper.createObjectNode();
        for (ParameterSpec spec : descriptor.getParameters()) {
            JsonNode value = input.get(spec.getName());
            if (value == null || value.isNull()) {
                if (spec.isRequired()) {
                    problems.add("Required parameter '" + spec.getName() + "' is missing");
                } else if (spec.getDefaultValue() != null) {
                    bound.set(spec.getName(), spec.getDefaultValue().deepCopy());
                }
                continue;
            }
            try {
                bound.set(spec.getName(), spec.getType().coerce(value, mapper));
            } catch (IllegalArgumentException e) {
                problems.add("Parameter '" + spec.getName() + "' has invalid value: " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            throw new ParameterValidationException(descriptor.getName(), problems);
        }
        return new BoundParameters(bound);
    }
}
