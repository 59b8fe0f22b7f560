package io.kitchensync.core.toolconfig;

import java.util.Map;

public record OptionState(boolean enabled, Map<String, Object> values) {

    public OptionState {
        values = values == null ? Map.of() : Map.copyOf(values);
    }
}
