package com.example.taskhub.scheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 读取 classpath:tasks.properties 中的单任务覆盖项，格式：
 * <pre>
 *   send_email.timeout-ms=30000
 *   send_email.retry.max-attempts=5
 *   send_email.retry.base-delay-ms=1000
 *   send_email.retry.max-delay-ms=60000
 * </pre>
 */
@Slf4j
@Component
public class TaskOverridesConfig {
    static final String FILE = "tasks.properties";

    private final String file;
    private final Map<String, String> values = new HashMap<>();

    public TaskOverridesConfig() {
        this(FILE);
    }

    TaskOverridesConfig(String file) {
        this.file = file;
    }

    @PostConstruct
    public void load() {
        Resource r = new ClassPathResource(file);
        if (!r.exists()) {
            log.debug("No {} found on classpath", file);
            return;
        }
        Properties p = new Properties();
        try (InputStream in = r.getInputStream()) {
            p.load(in);
            for (String name : p.stringPropertyNames()) {
                String val = p.getProperty(name);
                if (val != null && !val.trim().isEmpty()) values.put(name.trim(), val.trim());
            }
            log.info("Loaded {} ({} entries)", file, values.size());
        } catch (IOException e) {
            log.warn("Cannot load {} : {}", file, e.getMessage());
        }
    }

    public OptionalLong timeoutMs(String taskName) {
        return longValue(taskName + ".timeout-ms");
    }

    public OptionalLong retryBaseDelayMs(String taskName) {
        return longValue(taskName + ".retry.base-delay-ms");
    }

    public OptionalLong retryMaxDelayMs(String taskName) {
        return longValue(taskName + ".retry.max-delay-ms");
    }

    public OptionalLong retryMaxAttempts(String taskName) {
        return longValue(taskName + ".retry.max-attempts");
    }

    public boolean hasRetryOverride(String taskName) {
        return retryBaseDelayMs(taskName).isPresent() || retryMaxDelayMs(taskName).isPresent()
                || retryMaxAttempts(taskName).isPresent();
    }

    public Map<String, String> getAll() {
        return Collections.unmodifiableMap(values);
    }

    private OptionalLong longValue(String key) {
        String v = values.get(key);
        if (v == null) return OptionalLong.empty();
        try {
            return OptionalLong.of(Long.parseLong(v));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value {}={} in {}", key, v, file);
            return OptionalLong.empty();
        }
    }
}
