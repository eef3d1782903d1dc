package io.github.flameyossnowy.kvmodels.api.exceptions.json;

public record JsonLocation(int lineNumber, int columnNumber, long charOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1);
}
