package com.stellarcast.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file read and atomic replace.
 * Writers go through a sibling temp file and an atomic move, so readers never
 * observe a half-written document.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Read a JSON document as a tree.
     *
     * @return the tree, or null if the file does not exist or is blank
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static JsonNode readTree(Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return null;
        }
        return MAPPER.readTree(raw);
    }

    /**
     * Replace the file with the JSON form of {@code data}.
     */
    public static void writeAtomically(Path path, Object data) throws IOException {
        writeAtomically(path, MAPPER.writeValueAsBytes(data));
    }

    /**
     * Replace the file with raw bytes (JSON or otherwise).
     */
    public static void writeAtomically(Path path, byte[] bytes) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (java.nio.file.AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
