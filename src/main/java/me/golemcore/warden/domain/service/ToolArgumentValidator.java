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

package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks tool arguments against the declared input schema before dispatch:
 * required properties must be present and top-level property values must match
 * their declared JSON type. Nested schemas are not inspected.
 */
@Component
public class ToolArgumentValidator {

    private static final String PROPERTIES = "properties";
    private static final String REQUIRED = "required";
    private static final String TYPE = "type";

    /**
     * @return a description of the first problem found, or empty when the
     *         arguments are acceptable
     */
    public Optional<String> validate(ToolDefinition definition, Map<String, Object> arguments) {
        Map<String, Object> schema = definition.getInputSchema();
        if (schema == null) {
            return Optional.empty();
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        if (schema.get(REQUIRED) instanceof Collection<?> required) {
            for (Object name : required) {
                if (args.get(String.valueOf(name)) == null) {
                    return Optional.of("Missing required argument '" + name + "'");
                }
            }
        }

        if (schema.get(PROPERTIES) instanceof Map<?, ?> properties) {
            for (Map.Entry<String, Object> entry : args.entrySet()) {
                if (entry.getValue() == null
                        || !(properties.get(entry.getKey()) instanceof Map<?, ?> property)) {
                    continue;
                }
                Object type = property.get(TYPE);
                if (type instanceof String expected && !matchesType(expected, entry.getValue())) {
                    return Optional.of("Argument '" + entry.getKey() + "' must be of type " + expected);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> isWholeNumber(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private static boolean isWholeNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        return value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
    }
}
