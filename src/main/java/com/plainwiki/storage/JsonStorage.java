package com.plainwiki.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <T> T readJson(Path path, TypeReference<T> type) throws IOException {
        return mapper.readValue(Files.readString(path, StandardCharsets.UTF_8), type);
    }

    /**
     * Write to a sibling temp file, then move it over the target so readers
     * never see a half written document.
     */
    public static void writeJsonAtomic(Path target, Object data) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
