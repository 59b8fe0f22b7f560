package io.kitchensync.core.toolconfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AllDayOption implements SyncOption {
    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.flag("exclude", "Skip all-day events", true)
    );

    @Override
    public String id() {
        return "allDay";
    }

    @Override
    public OptionKind kind() {
        return OptionKind.FILTER;
    }

    @Override
    public String label() {
        return "All-day event filter";
    }

    @Override
    public boolean defaultEnabled() {
        return true;
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public String summarize(Map<String, Object> values) {
        return OptionValues.flag(values, "exclude")
            ? "Skips all-day events from being copied."
            : "Keeps all-day events in the sync.";
    }

    @Override
    public Optional<Map<String, Object>> toToolEntry(Map<String, Object> values) {
        if (!OptionValues.flag(values, "exclude")) {
            return Optional.empty();
        }
        return Optional.of(Map.of("name", "AllDayEvents"));
    }
}
