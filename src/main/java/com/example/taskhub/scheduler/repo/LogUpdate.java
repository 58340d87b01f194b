package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ErrorKind;
import com.example.taskhub.scheduler.domain.ExecutionLog;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Fields written together with a log status transition. Null fields are left untouched.
 */
@Getter
@Builder
@ToString
public class LogUpdate {
    private final String owner;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String result;
    private final ErrorKind errorKind;
    private final String errorMessage;

    public static LogUpdate none() {
        return LogUpdate.builder().build();
    }

    public static LogUpdate finishedAt(Instant at) {
        return LogUpdate.builder().finishedAt(at).build();
    }

    /**
     * Closing fields of a failed attempt. The message is collapsed to one line and cut to fit
     * {@code execution_log.error_message}.
     */
    public static LogUpdate failure(Instant finishedAt, ErrorKind kind, String message) {
        return LogUpdate.builder()
                .finishedAt(finishedAt)
                .errorKind(kind)
                .errorMessage(oneLine(message, ExecutionLog.ERROR_MESSAGE_LENGTH))
                .build();
    }

    static String oneLine(String message, int max) {
        if (message == null) return null;
        String flat = message.replaceAll("\\s+", " ").trim();
        return flat.length() > max ? flat.substring(0, max) : flat;
    }

    public void applyTo(ExecutionLog log) {
        if (owner != null) log.setOwner(owner);
        if (startedAt != null) log.setStartedAt(Timestamp.from(startedAt));
        if (finishedAt != null) {
            log.setFinishedAt(Timestamp.from(finishedAt));
            if (log.getStartedAt() != null) {
                log.setDurationMs(Math.max(0L, finishedAt.toEpochMilli() - log.getStartedAt().getTime()));
            }
        }
        if (result != null) log.setResult(result);
        if (errorKind != null) log.setErrorKind(errorKind);
        if (errorMessage != null) log.setErrorMessage(errorMessage);
    }
}
