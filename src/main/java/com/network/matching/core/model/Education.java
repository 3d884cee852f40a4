package com.network.matching.core.model;

import java.util.Optional;

/**
 * Education record of a profile. Every field is optional.
 */
public record Education(String university, String degree, String field) {

    public Education {
        university = blankToNull(university);
        degree = blankToNull(degree);
        field = blankToNull(field);
    }

    public Optional<String> universityName() {
        return Optional.ofNullable(university);
    }

    public Optional<String> degreeName() {
        return Optional.ofNullable(degree);
    }

    public Optional<String> fieldName() {
        return Optional.ofNullable(field);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
