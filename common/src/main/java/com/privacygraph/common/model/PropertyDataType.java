package com.privacygraph.common.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Data type tags used by entity type property declarations.
 */
public enum PropertyDataType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    JSON;

    /** Checks whether a JSON-compatible value matches this tag */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof BigInteger;
            case FLOAT -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case JSON -> value instanceof Map || value instanceof List || value instanceof String;
        };
    }
}
