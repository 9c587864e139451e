package com.taskpilot.core.exception;

import java.util.List;

/**
 * Base type of every typed failure raised by the core. Presentation layers print
 * {@link #kind()}, the message and {@link #suggestions()} verbatim.
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> suggestions;

    protected WorkflowException(ErrorKind kind, String message, List<String> suggestions) {
        super(message);
        this.kind = kind;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    protected WorkflowException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean recoverable() {
        return kind.recoverable();
    }

    public List<String> suggestions() {
        return suggestions;
    }
}
