package com.taskpilot.core.model;

/**
 * Subtask progress of a workflow.
 */
public record Progress(int completed, int total, int current, int percentage) {}
