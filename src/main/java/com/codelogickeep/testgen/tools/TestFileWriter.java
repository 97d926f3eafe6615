package com.codelogickeep.testgen.tools;

import com.codelogickeep.testgen.exception.TestGenException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.codelogickeep.testgen.exception.TestGenException.ErrorCode.FILE_WRITE_FAILED;
import static com.codelogickeep.testgen.exception.TestGenException.ErrorCode.INVALID_ARGUMENT;

/**
 * Writes assembled test class sources below an output directory.
 */
@Slf4j
public class TestFileWriter {

    private final boolean overwrite;

    public TestFileWriter(boolean overwrite) {
        this.overwrite = overwrite;
    }

    /**
     * @param outputDir root directory for the generated sources
     * @param documents relative file path to source text
     * @return paths actually written; existing files are skipped unless overwrite is enabled
     */
    public List<Path> write(Path outputDir, Map<String, String> documents) {
        log.info("Tool Input - write: outputDir={}, files={}", outputDir, documents.size());
        Path root = outputDir.toAbsolutePath().normalize();
        List<Path> written = new ArrayList<>();

        for (Map.Entry<String, String> entry : documents.entrySet()) {
            Path target = resolveSafePath(root, entry.getKey());
            if (Files.exists(target) && !overwrite) {
                log.warn("Skipping existing file {} (enable overwrite to replace it)", target);
                continue;
            }
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
                written.add(target);
            } catch (IOException e) {
                throw new TestGenException(FILE_WRITE_FAILED,
                        "Failed to write " + target + ": " + e.getMessage(), entry.getKey(), e);
            }
        }

        log.info("Tool Output - write: written={}", written.size());
        return written;
    }

    private Path resolveSafePath(Path root, String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new TestGenException(INVALID_ARGUMENT,
                    "Path is outside the output directory: " + relativePath, root.toString());
        }
        return resolved;
    }
}
