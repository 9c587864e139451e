package com.taskpilot.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link VersionControlAdapter} backed by the {@code git} CLI.
 *
 * <p>This class shells out via {@link ProcessBuilder} rather than depending on JGit.
 * Any non-zero exit raises {@link VersionControlException} carrying the command's stderr.
 */
public class GitCliAdapter implements VersionControlAdapter {

    private static final Logger log = LoggerFactory.getLogger(GitCliAdapter.class);

    private final Path workDir;

    public GitCliAdapter(Path workDir) {
        this.workDir = workDir;
    }

    @Override
    public boolean isWorkingTreeClean() {
        return git("status", "--porcelain", "--untracked-files=all").isBlank();
    }

    @Override
    public GitStatusSummary getStatusSummary() {
        return parseStatusSummary(git("status", "--porcelain", "--untracked-files=all"));
    }

    @Override
    public String getCurrentBranch() {
        return git("branch", "--show-current").strip();
    }

    @Override
    public boolean branchExists(String branchName) {
        GitResult result = runGit("rev-parse", "--verify", "--quiet", "refs/heads/" + branchName);
        if (result.exitCode() > 1) {
            throw failure(result, "rev-parse", "--verify", branchName);
        }
        return result.exitCode() == 0;
    }

    @Override
    public void createBranch(String branchName, boolean checkout) {
        log.info("Creating branch '{}' in {}", branchName, workDir);
        if (checkout) {
            git("checkout", "-b", branchName);
        } else {
            git("branch", branchName);
        }
    }

    @Override
    public void checkoutBranch(String branchName) {
        log.info("Checking out branch '{}'", branchName);
        git("checkout", branchName);
    }

    @Override
    public void stageFiles(List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return;
        }
        var args = new ArrayList<String>();
        args.add("add");
        args.add("--");
        args.addAll(paths);
        git(args.toArray(String[]::new));
    }

    @Override
    public boolean hasStagedChanges() {
        GitResult result = runGit("diff", "--cached", "--quiet");
        if (result.exitCode() > 1) {
            throw failure(result, "diff", "--cached", "--quiet");
        }
        return result.exitCode() == 1;
    }

    @Override
    public List<String> getChangedFiles() {
        return parseChangedFiles(git("status", "--porcelain", "--untracked-files=all"));
    }

    @Override
    public void createCommit(String message, CommitOptions options) {
        CommitOptions opts = options == null ? CommitOptions.defaults() : options;
        if (opts.enforceNonDefaultBranch()) {
            String branch = getCurrentBranch();
            if (isDefaultBranch(branch)) {
                throw new VersionControlException(
                        "Cannot commit to default branch: " + branch + ". Create a feature branch first");
            }
        }
        if (!opts.allowEmpty() && !hasStagedChanges()) {
            throw new VersionControlException("No staged changes to commit");
        }

        var args = new ArrayList<String>(List.of("commit", "-m", message));
        for (Map.Entry<String, String> entry : opts.metadata().entrySet()) {
            args.add("-m");
            args.add("[" + entry.getKey() + ":" + entry.getValue() + "]");
        }
        args.add("--no-gpg-sign");
        if (opts.allowEmpty()) {
            args.add("--allow-empty");
        }
        git(args.toArray(String[]::new));
        log.info("Created commit on {}", workDir);
    }

    @Override
    public String getLastCommitSha() {
        return git("rev-parse", "HEAD").strip();
    }

    public Path workDir() {
        return workDir;
    }

    /**
     * Runs git and returns stdout, failing on any non-zero exit.
     */
    String git(String... args) {
        GitResult result = runGit(args);
        if (result.exitCode() != 0) {
            throw failure(result, args);
        }
        return result.stdout();
    }

    /**
     * Runs a git command and captures its exit code, stdout and stderr.
     *
     * @param args git arguments (e.g. "checkout", "-b", "branch-name")
     */
    GitResult runGit(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();

            // drain stderr concurrently so a chatty command cannot block on a full pipe
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
            String stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            return new GitResult(exitCode, stdout, stderr.join());
        } catch (IOException e) {
            throw new VersionControlException("Failed to run git " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VersionControlException("Interrupted while running git " + String.join(" ", args), e);
        }
    }

    static GitStatusSummary parseStatusSummary(String porcelain) {
        int staged = 0;
        int modified = 0;
        int deleted = 0;
        int untracked = 0;
        for (String line : porcelain.split("\n")) {
            if (line.length() < 3) {
                continue;
            }
            char x = line.charAt(0);
            char y = line.charAt(1);
            if (x == '?' && y == '?') {
                untracked++;
                continue;
            }
            if (x != ' ') {
                staged++;
            }
            if (y == 'M') {
                modified++;
            }
            if (x == 'D' || y == 'D') {
                deleted++;
            }
        }
        boolean clean = staged + modified + deleted + untracked == 0;
        return new GitStatusSummary(clean, staged, modified, deleted, untracked);
    }

    static List<String> parseChangedFiles(String porcelain) {
        var files = new LinkedHashSet<String>();
        for (String line : porcelain.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            String path = line.substring(3);
            int arrow = path.indexOf(" -> ");
            if (arrow >= 0) {
                path = path.substring(arrow + 4);
            }
            files.add(unquote(path));
        }
        return List.copyOf(files);
    }

    private static String unquote(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    private static String readAll(InputStream in) {
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static VersionControlException failure(GitResult result, String... args) {
        log.warn("git {} exited with code {}", String.join(" ", args), result.exitCode());
        return new VersionControlException(
                "git %s failed (exit code %d)".formatted(args.length > 0 ? args[0] : "", result.exitCode()),
                result.exitCode(), result.stderr());
    }

    /**
     * Outcome of a single git invocation.
     */
    record GitResult(int exitCode, String stdout, String stderr) {}
}
