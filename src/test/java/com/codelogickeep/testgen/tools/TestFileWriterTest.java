package com.codelogickeep.testgen.tools;

import com.codelogickeep.testgen.exception.TestGenException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TestFileWriter.
 */
class TestFileWriterTest {

    @TempDir
    Path tempDir;

    private static Map<String, String> documents(String... pathsAndContents) {
        Map<String, String> docs = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            docs.put(pathsAndContents[i], pathsAndContents[i + 1]);
        }
        return docs;
    }

    @Test
    @DisplayName("write should create package directories and files")
    void write_shouldCreateDirectoriesAndFiles() throws IOException {
        List<Path> written = new TestFileWriter(false).write(tempDir, documents(
                "com/acme/test/WidgetTest.java", "class WidgetTest {}\n",
                "MainTest.java", "class MainTest {}\n"));

        assertEquals(2, written.size());
        assertEquals("class WidgetTest {}\n",
                Files.readString(tempDir.resolve("com/acme/test/WidgetTest.java")));
        assertTrue(Files.exists(tempDir.resolve("MainTest.java")));
    }

    @Test
    @DisplayName("write should skip existing files unless overwrite is enabled")
    void write_shouldRespectOverwriteFlag() throws IOException {
        Path existing = tempDir.resolve("a/test/XTest.java");
        Files.createDirectories(existing.getParent());
        Files.writeString(existing, "original");

        List<Path> skipped = new TestFileWriter(false).write(tempDir, documents("a/test/XTest.java", "new"));
        assertTrue(skipped.isEmpty());
        assertEquals("original", Files.readString(existing));

        List<Path> replaced = new TestFileWriter(true).write(tempDir, documents("a/test/XTest.java", "new"));
        assertEquals(1, replaced.size());
        assertEquals("new", Files.readString(existing));
    }

    @Test
    @DisplayName("write should reject paths escaping the output directory")
    void write_shouldRejectPathTraversal() {
        TestGenException ex = assertThrows(TestGenException.class,
                () -> new TestFileWriter(true).write(tempDir.resolve("out"), documents("../Evil.java", "x")));

        assertEquals(TestGenException.ErrorCode.INVALID_ARGUMENT, ex.getErrorCode());
        assertFalse(Files.exists(tempDir.resolve("Evil.java")));
    }

    @Test
    @DisplayName("write should report a file blocking the package directory")
    void write_shouldFailWhenDirectoryIsAFile() throws IOException {
        Files.writeString(tempDir.resolve("com"), "not a directory");

        TestGenException ex = assertThrows(TestGenException.class,
                () -> new TestFileWriter(false).write(tempDir, documents("com/test/ATest.java", "x")));

        assertEquals(TestGenException.ErrorCode.FILE_WRITE_FAILED, ex.getErrorCode());
        assertEquals("com/test/ATest.java", ex.getContext());
    }
}
