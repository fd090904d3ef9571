package com.opsdashboard.domain.model;

import com.opsdashboard.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Supported record categories. Each one is served under its own URL path.
 */
public enum Domain {
    TRANSACTIONS("transactions"),
    EQUIPMENT("equipment");

    private final String path;

    Domain(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public static Domain fromPath(String path) {
        for (Domain domain : values()) {
            if (domain.path.equalsIgnoreCase(path)) {
                return domain;
            }
        }
        String known = Arrays.stream(values()).map(Domain::getPath).collect(Collectors.joining(", "));
        throw new ValidationException(ValidationException.Kind.UNKNOWN_DOMAIN, "domain",
                "Unknown domain '" + path + "', expected one of: " + known);
    }
}
