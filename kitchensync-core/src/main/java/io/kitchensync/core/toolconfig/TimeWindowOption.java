package io.kitchensync.core.toolconfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TimeWindowOption implements SyncOption {
    private static final int MAX_PAST_DAYS = 365;
    private static final int MAX_FUTURE_DAYS = 730;

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.number("pastDays", "Include events from the past (days)", 7, false, 0, MAX_PAST_DAYS),
        FieldSpec.number("futureDays", "Include events in the future (days)", 30, true, 1, MAX_FUTURE_DAYS)
    );

    @Override
    public String id() {
        return "timeWindow";
    }

    @Override
    public OptionKind kind() {
        return OptionKind.FILTER;
    }

    @Override
    public String label() {
        return "Time window filter";
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public List<String> validate(Map<String, Object> values) {
        int pastDays = OptionValues.number(values, "pastDays", 0);
        int futureDays = OptionValues.number(values, "futureDays", 0);
        List<String> errors = new ArrayList<>();
        if (pastDays < 0) {
            errors.add("Past days must be zero or a positive integer.");
        }
        if (futureDays <= 0) {
            errors.add("Future days must be greater than zero.");
        }
        return errors;
    }

    @Override
    public String summarize(Map<String, Object> values) {
        int pastDays = OptionValues.number(values, "pastDays", 0);
        int futureDays = OptionValues.number(values, "futureDays", 0);
        String past = pastDays > 0 ? pastDays + " day" + plural(pastDays) + " of history" : "no history";
        return "Syncs " + past + " and the next " + futureDays + " day" + plural(futureDays) + ".";
    }

    @Override
    public Optional<Map<String, Object>> toToolEntry(Map<String, Object> values) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("HourStart", 0);
        config.put("HourEnd", 24);
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", "TimeFrame");
        entry.put("config", config);
        return Optional.of(entry);
    }

    private static String plural(int count) {
        return count == 1 ? "" : "s";
    }
}
