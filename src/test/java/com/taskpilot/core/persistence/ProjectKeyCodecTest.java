package com.taskpilot.core.persistence;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectKeyCodecTest {

    @Test
    void decodesBackToTheNormalizedPath() {
        Path root = Path.of("/home/dev/projects/../projects/report-builder");

        String key = ProjectKeyCodec.encode(root);

        assertEquals(root.toAbsolutePath().normalize().toString(), ProjectKeyCodec.decode(key));
    }

    @Test
    void keyIsSafeAsADirectoryName() {
        String key = ProjectKeyCodec.encode(Path.of("/tmp/a b/ü/project"));

        assertFalse(key.contains("/"));
        assertFalse(key.contains("+"));
        assertFalse(key.contains("="));
    }

    @Test
    void distinctPathsGetDistinctKeys() {
        assertNotEquals(ProjectKeyCodec.encode(Path.of("/tmp/a")), ProjectKeyCodec.encode(Path.of("/tmp/b")));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ProjectKeyCodec.decode("not*base64"));
    }
}
