package io.kitchensync.core.toolconfig;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record FieldSpec(
    String id,
    String label,
    FieldType type,
    Object defaultValue,
    boolean required,
    Integer maxLength,
    Integer min,
    Integer max,
    List<String> choices
) {

    public static FieldSpec text(String id, String label, String defaultValue, boolean required, int maxLength) {
        return new FieldSpec(id, label, FieldType.TEXT, defaultValue, required, maxLength, null, null, List.of());
    }

    public static FieldSpec number(String id, String label, int defaultValue, boolean required, int min, int max) {
        return new FieldSpec(id, label, FieldType.NUMBER, defaultValue, required, null, min, max, List.of());
    }

    public static FieldSpec choice(String id, String label, String defaultValue, List<String> choices) {
        return new FieldSpec(id, label, FieldType.CHOICE, defaultValue, false, null, null, null, List.copyOf(choices));
    }

    public static FieldSpec flag(String id, String label, boolean defaultValue) {
        return new FieldSpec(id, label, FieldType.FLAG, defaultValue, false, null, null, null, List.of());
    }

    /**
     * Reads this field from {@code raw}. Invalid input falls back to the default and adds a
     * message to {@code errors}; a missing required field is only an error when the option is on.
     */
    Object read(JsonNode raw, boolean enabled, List<String> errors) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            if (enabled && required) {
                errors.add(label + " is required.");
            }
            return defaultValue;
        }

        return switch (type) {
            case TEXT -> {
                if (!raw.isTextual()) {
                    errors.add(label + " must be a string.");
                    yield defaultValue;
                }
                String value = raw.asText();
                if (maxLength != null && value.length() > maxLength) {
                    errors.add(label + " must be " + maxLength + " characters or fewer.");
                }
                yield value;
            }
            case NUMBER -> {
                Integer value = readNumber(raw);
                if (value == null) {
                    errors.add(label + " must be a number.");
                    yield defaultValue;
                }
                if (min != null && value < min) {
                    errors.add(label + " must be greater than or equal to " + min + ".");
                }
                if (max != null && value > max) {
                    errors.add(label + " must be less than or equal to " + max + ".");
                }
                yield value;
            }
            case CHOICE -> {
                if (!raw.isTextual() || !choices.contains(raw.asText())) {
                    errors.add(label + " must be one of the provided options.");
                    yield defaultValue;
                }
                yield raw.asText();
            }
            case FLAG -> {
                if (!raw.isBoolean()) {
                    errors.add(label + " must be true or false.");
                    yield defaultValue;
                }
                yield raw.asBoolean();
            }
        };
    }

    private static Integer readNumber(JsonNode raw) {
        if (raw.isIntegralNumber()) {
            return raw.asInt();
        }
        if (raw.isNumber()) {
            return (int) Math.round(raw.asDouble());
        }
        if (raw.isTextual() && !raw.asText().isBlank()) {
            try {
                return Integer.parseInt(raw.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
