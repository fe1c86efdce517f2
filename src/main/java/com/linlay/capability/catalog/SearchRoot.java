package com.linlay.capability.catalog;

import java.nio.file.Path;
import java.util.Objects;

public record SearchRoot(
        Path path,
        SourceType sourceType
) {
    public SearchRoot {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sourceType, "sourceType");
        if (sourceType == SourceType.PROGRAMMATIC) {
            throw new IllegalArgumentException("programmatic resources have no search root");
        }
    }
}
