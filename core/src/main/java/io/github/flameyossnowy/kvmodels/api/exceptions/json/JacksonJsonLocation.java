package io.github.flameyossnowy.kvmodels.api.exceptions.json;

import org.jetbrains.annotations.Nullable;

public final class JacksonJsonLocation {
    private JacksonJsonLocation() {
    }

    public static JsonLocation from(@Nullable com.fasterxml.jackson.core.JsonLocation location) {
        if (location == null) {
            return JsonLocation.UNKNOWN;
        }
        return new JsonLocation(location.getLineNr(), location.getColumnNr(), location.getCharOffset());
    }
}
