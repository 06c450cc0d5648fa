package com.healthsentinel.service.config;

import java.util.List;

public class ConfigValidationException extends RuntimeException {
    private final List<String> problems;

    public ConfigValidationException(List<String> problems) {
        super("Invalid configuration: " + problems.size() + " problem(s): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
