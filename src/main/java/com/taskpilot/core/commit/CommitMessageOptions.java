package com.taskpilot.core.commit;

import java.util.List;

/**
 * Inputs for a generated commit message. Build with {@link #builder(String, String)}.
 *
 * @param type            conventional-commit type ("feat", "fix", ...)
 * @param description     header description
 * @param changedFiles    files in the commit, used for scope detection
 * @param scope           explicit scope; detected from {@code changedFiles} when null
 * @param body            optional body paragraph
 * @param breaking        marks the header with {@code !}
 * @param taskId          task reference line
 * @param phase           phase reference line
 * @param tag             task group, available to custom templates
 * @param testsPassing    passing test count
 * @param testsFailing    failing test count
 * @param coveragePercent coverage, available to custom templates
 */
public record CommitMessageOptions(
    String type,
    String description,
    List<String> changedFiles,
    String scope,
    String body,
    boolean breaking,
    String taskId,
    String phase,
    String tag,
    Integer testsPassing,
    Integer testsFailing,
    Double coveragePercent
) {

    public CommitMessageOptions {
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    }

    public static Builder builder(String type, String description) {
        return new Builder(type, description);
    }

    public static final class Builder {
        private final String type;
        private final String description;
        private List<String> changedFiles = List.of();
        private String scope;
        private String body;
        private boolean breaking;
        private String taskId;
        private String phase;
        private String tag;
        private Integer testsPassing;
        private Integer testsFailing;
        private Double coveragePercent;

        private Builder(String type, String description) {
            this.type = type;
            this.description = description;
        }

        public Builder changedFiles(List<String> changedFiles) { this.changedFiles = changedFiles; return this; }
        public Builder scope(String scope) { this.scope = scope; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder breaking(boolean breaking) { this.breaking = breaking; return this; }
        public Builder taskId(String taskId) { this.taskId = taskId; return this; }
        public Builder phase(String phase) { this.phase = phase; return this; }
        public Builder tag(String tag) { this.tag = tag; return this; }
        public Builder testsPassing(Integer testsPassing) { this.testsPassing = testsPassing; return this; }
        public Builder testsFailing(Integer testsFailing) { this.testsFailing = testsFailing; return this; }
        public Builder coveragePercent(Double coveragePercent) { this.coveragePercent = coveragePercent; return this; }

        public CommitMessageOptions build() {
            return new CommitMessageOptions(type, description, changedFiles, scope, body, breaking,
                    taskId, phase, tag, testsPassing, testsFailing, coveragePercent);
        }
    }
}
