package com.example.taskhub.scheduler.service;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class CronPreview {
    private final String expression;
    private final String description;
    private final String zone;
    private final List<Instant> nextFireTimes;
}
