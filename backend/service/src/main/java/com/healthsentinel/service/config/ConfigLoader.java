package com.healthsentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsentinel.core.model.MonitorConfig;
import com.healthsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static MonitorConfig load(Path path, ConfigValidator validator) {
        return validator.validate(readDocument(path));
    }

    public static byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    public static Map<String, Object> readDocument(Path path) {
        return parse(readBytes(path), path);
    }

    public static Map<String, Object> parse(byte[] content, Path source) {
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> document = mapperFor(source).readValue(content, new TypeReference<>() {
            });
            return document == null ? Map.of() : new LinkedHashMap<>(document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + source, e);
        }
    }

    private static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? JsonUtils.yamlMapper() : JsonUtils.objectMapper();
    }
}
