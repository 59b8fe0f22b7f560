package io.kitchensync.core.toolconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved option states for one job, keyed by option id in registry order.
 */
public record OptionSelection(Map<String, OptionState> states) {

    public OptionSelection {
        states = states == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public Optional<OptionState> state(String optionId) {
        return Optional.ofNullable(states.get(optionId));
    }

    public boolean isEnabled(String optionId) {
        OptionState state = states.get(optionId);
        return state != null && state.enabled();
    }
}
