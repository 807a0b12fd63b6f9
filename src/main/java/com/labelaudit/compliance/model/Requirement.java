package com.labelaudit.compliance.model;

import java.util.Locale;
import java.util.Optional;

public enum Requirement {
    REQUIRED,
    OPTIONAL;

    public static Optional<Requirement> fromKey(String key) {
        if (key == null) return Optional.empty();
        switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "required":
            case "mandatory":
                return Optional.of(REQUIRED);
            case "optional":
            case "recommended":
                return Optional.of(OPTIONAL);
            default:
                return Optional.empty();
        }
    }
}
