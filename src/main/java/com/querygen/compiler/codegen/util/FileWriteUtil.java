package com.querygen.compiler.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File operations for artifact output with automatic directory creation.
 */
public final class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes only when the file is missing or its contents differ.
     *
     * @return true if the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        if (readIfExists(filePath).filter(content::equals).isPresent()) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }

    public static Optional<String> readIfExists(Path filePath) throws IOException {
        if (!Files.isRegularFile(filePath)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(filePath));
    }
}
