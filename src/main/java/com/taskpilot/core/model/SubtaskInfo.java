package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A subtask as tracked by the workflow engine.
 *
 * @param id          subtask identifier (e.g. "1.2")
 * @param title       human-readable title, also used as the commit description
 * @param status      current progress
 * @param attempts    number of failed GREEN attempts so far
 * @param maxAttempts attempt budget before the subtask is marked failed (nullable = unlimited)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubtaskInfo(
    String id,
    String title,
    SubtaskStatus status,
    int attempts,
    Integer maxAttempts
) implements Serializable {

    public SubtaskInfo {
        if (status == null) {
            status = SubtaskStatus.PENDING;
        }
    }

    public static SubtaskInfo pending(String id, String title, Integer maxAttempts) {
        return new SubtaskInfo(id, title, SubtaskStatus.PENDING, 0, maxAttempts);
    }

    public SubtaskInfo withStatus(SubtaskStatus newStatus) {
        return new SubtaskInfo(id, title, newStatus, attempts, maxAttempts);
    }

    public SubtaskInfo withAttempts(int newAttempts) {
        return new SubtaskInfo(id, title, status, newAttempts, maxAttempts);
    }

    @JsonIgnore
    public boolean attemptsExceeded() {
        return maxAttempts != null && maxAttempts > 0 && attempts > maxAttempts;
    }
}
