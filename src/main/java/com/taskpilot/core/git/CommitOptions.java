package com.taskpilot.core.git;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link VersionControlAdapter#createCommit}.
 *
 * @param metadata                appended to the message as {@code [key:value]} lines, in order
 * @param allowEmpty              permit a commit with nothing staged
 * @param enforceNonDefaultBranch refuse to commit on main, master or develop
 */
public record CommitOptions(
    Map<String, String> metadata,
    boolean allowEmpty,
    boolean enforceNonDefaultBranch
) {

    public CommitOptions {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CommitOptions defaults() {
        return new CommitOptions(Map.of(), false, false);
    }
}
