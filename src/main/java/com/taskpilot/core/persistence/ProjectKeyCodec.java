package com.taskpilot.core.persistence;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Bijective mapping between a project directory and the directory name its state lives under.
 * The key is the unpadded base64url encoding of the normalized absolute path.
 */
public final class ProjectKeyCodec {

    private ProjectKeyCodec() {}

    public static String encode(Path projectRoot) {
        String normalized = projectRoot.toAbsolutePath().normalize().toString();
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(normalized.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if {@code key} is not valid base64url
     */
    public static String decode(String key) {
        return new String(Base64.getUrlDecoder().decode(key), StandardCharsets.UTF_8);
    }
}
