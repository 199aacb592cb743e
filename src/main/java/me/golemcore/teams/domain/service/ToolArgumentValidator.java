package me.golemcore.teams.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.teams.domain.exception.ToolValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema that tool definitions
 * use: required keys, primitive types, enums and
 * {@code additionalProperties: false}.
 */
public final class ToolArgumentValidator {

    private ToolArgumentValidator() {
    }

    @SuppressWarnings("unchecked")
    public static void validate(Map<String, Object> arguments, Map<String, Object> schema) {
        if (arguments == null) {
            throw new ToolValidationException("Arguments must be an object");
        }
        if (schema == null) {
            return;
        }
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> props
                ? (Map<String, Object>) props
                : Map.of();

        if (schema.get("required") instanceof Collection<?> required) {
            for (Object key : required) {
                if (arguments.get(String.valueOf(key)) == null) {
                    throw new ToolValidationException("Missing required argument: " + key);
                }
            }
        }

        for (Map.Entry<String, Object> argument : arguments.entrySet()) {
            Object propertySchema = properties.get(argument.getKey());
            if (propertySchema == null) {
                if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                    throw new ToolValidationException("Unexpected argument: " + argument.getKey());
                }
                continue;
            }
            if (argument.getValue() != null && propertySchema instanceof Map<?, ?> property) {
                checkValue(argument.getKey(), argument.getValue(), (Map<String, Object>) property);
            }
        }
    }

    private static void checkValue(String name, Object value, Map<String, Object> property) {
        Object type = property.get("type");
        if (type instanceof String expected && !matchesType(value, expected)) {
            throw new ToolValidationException("Argument '" + name + "' must be of type " + expected
                    + " but was " + describe(value));
        }
        if (property.get("enum") instanceof List<?> allowed && !allowed.contains(value)) {
            throw new ToolValidationException("Argument '" + name + "' must be one of " + allowed);
        }
    }

    private static boolean matchesType(Object value, String expected) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "integer" -> isIntegral(value);
        case "number" -> value instanceof Number;
        case "array" -> value instanceof Collection<?> || value.getClass().isArray();
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof java.math.BigInteger) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static String describe(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
