package com.taskpilot.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskpilot")
public class TaskpilotProperties {

    /** Project the workflow runs in; the working directory when unset. */
    private String projectRoot;
    /** Where per-project state lives; {@code ~/.taskpilot} when unset. */
    private String stateHome;

    private Workflow workflow = new Workflow();
    private Commit commit = new Commit();
    private Coverage coverage = new Coverage();
    private Tasks tasks = new Tasks();
    private Dependencies dependencies = new Dependencies();

    public Path resolveProjectRoot() {
        String root = projectRoot == null || projectRoot.isBlank() ? System.getProperty("user.dir") : projectRoot;
        return Path.of(root).toAbsolutePath().normalize();
    }

    public Path resolveStateHome() {
        if (stateHome != null && !stateHome.isBlank()) {
            return Path.of(stateHome).toAbsolutePath().normalize();
        }
        return Path.of(System.getProperty("user.home"), ".taskpilot");
    }

    public Path resolveTasksFile() {
        if (tasks.file != null && !tasks.file.isBlank()) {
            Path file = Path.of(tasks.file);
            return file.isAbsolute() ? file : resolveProjectRoot().resolve(file);
        }
        return resolveProjectRoot().resolve(".taskmaster").resolve("tasks").resolve("tasks.json");
    }

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getStateHome() { return stateHome; }
    public void setStateHome(String stateHome) { this.stateHome = stateHome; }
    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Commit getCommit() { return commit; }
    public void setCommit(Commit commit) { this.commit = commit; }
    public Coverage getCoverage() { return coverage; }
    public void setCoverage(Coverage coverage) { this.coverage = coverage; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Dependencies getDependencies() { return dependencies; }
    public void setDependencies(Dependencies dependencies) { this.dependencies = dependencies; }

    public static class Workflow {
        private String branchPattern = "{tagPrefix}task-{taskId}-{slug}";
        private int maxAttempts = 3;
        private boolean abortOnMaxAttempts = false;
        private boolean requireCleanStart = true;
        private int maxBackups = 5;

        public String getBranchPattern() { return branchPattern; }
        public void setBranchPattern(String branchPattern) { this.branchPattern = branchPattern; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public boolean isAbortOnMaxAttempts() { return abortOnMaxAttempts; }
        public void setAbortOnMaxAttempts(boolean abortOnMaxAttempts) { this.abortOnMaxAttempts = abortOnMaxAttempts; }
        public boolean isRequireCleanStart() { return requireCleanStart; }
        public void setRequireCleanStart(boolean requireCleanStart) { this.requireCleanStart = requireCleanStart; }
        public int getMaxBackups() { return maxBackups; }
        public void setMaxBackups(int maxBackups) { this.maxBackups = maxBackups; }
    }

    public static class Commit {
        private String template = "commitMessage";
        private String type = "feat";
        /** {@code "Name <email>"}; no trailer when unset. */
        private String coAuthor;
        private Map<String, String> templates = new LinkedHashMap<>();

        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCoAuthor() { return coAuthor; }
        public void setCoAuthor(String coAuthor) { this.coAuthor = coAuthor; }
        public Map<String, String> getTemplates() { return templates; }
        public void setTemplates(Map<String, String> templates) { this.templates = templates; }
    }

    public static class Coverage {
        private Double line;
        private Double branch;
        private Double function;
        private Double statement;

        public Double getLine() { return line; }
        public void setLine(Double line) { this.line = line; }
        public Double getBranch() { return branch; }
        public void setBranch(Double branch) { this.branch = branch; }
        public Double getFunction() { return function; }
        public void setFunction(Double function) { this.function = function; }
        public Double getStatement() { return statement; }
        public void setStatement(Double statement) { this.statement = statement; }
    }

    public static class Tasks {
        private String file;
        private String defaultGroup = "master";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public String getDefaultGroup() { return defaultGroup; }
        public void setDefaultGroup(String defaultGroup) { this.defaultGroup = defaultGroup; }
    }

    public static class Dependencies {
        private int maxTraversalDepth = 10_000;

        public int getMaxTraversalDepth() { return maxTraversalDepth; }
        public void setMaxTraversalDepth(int maxTraversalDepth) { this.maxTraversalDepth = maxTraversalDepth; }
    }
}
