package io.github.flameyossnowy.kvmodels.api.exceptions.json;

import io.github.flameyossnowy.kvmodels.api.exceptions.ModelException;

public class JsonProcessException extends ModelException {
    private final JsonLocation location;

    public JsonProcessException(String message, Throwable cause, JsonLocation location) {
        super(message, cause);
        this.location = location;
    }

    public JsonLocation getLocation() {
        return location;
    }
}
