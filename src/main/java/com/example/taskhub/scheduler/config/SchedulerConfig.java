package com.example.taskhub.scheduler.config;

import com.example.taskhub.scheduler.service.CronEvaluator;
import com.example.taskhub.scheduler.service.ExponentialBackoffRetryPolicy;
import com.example.taskhub.scheduler.service.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CronEvaluator cronEvaluator(SchedulerProperties props) {
        ZoneId zone = StringUtils.hasText(props.getZone()) ? ZoneId.of(props.getZone().trim()) : ZoneId.systemDefault();
        log.info("Cron expressions evaluated in zone {}", zone);
        return new CronEvaluator(zone);
    }

    /**
     * 全局默认重试策略；单个任务可在 tasks.properties 中覆盖。
     */
    @Bean
    public RetryPolicy defaultRetryPolicy(SchedulerProperties props) {
        SchedulerProperties.RetryConfig r = props.getRetry();
        return new ExponentialBackoffRetryPolicy(Duration.ofMillis(r.getBaseDelayMs()),
                Duration.ofMillis(r.getMaxDelayMs()), r.getMaxAttempts());
    }
}
