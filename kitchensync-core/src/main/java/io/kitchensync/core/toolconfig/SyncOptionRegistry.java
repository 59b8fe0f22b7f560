package io.kitchensync.core.toolconfig;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog of the options a job may enable. Jobs store their options as a JSON object keyed by
 * option id, each entry shaped {@code {"enabled": bool, "values": {...}}}.
 */
public final class SyncOptionRegistry {
    private final List<SyncOption> options;

    public SyncOptionRegistry(List<SyncOption> options) {
        this.options = List.copyOf(Objects.requireNonNull(options, "options must not be null"));
    }

    public static SyncOptionRegistry defaultRegistry() {
        return new SyncOptionRegistry(List.of(
            new TitleTemplateOption(),
            new DescriptionNoteOption(),
            new TimeWindowOption(),
            new AllDayOption()
        ));
    }

    public List<SyncOption> options() {
        return options;
    }

    public Optional<SyncOption> find(String optionId) {
        return options.stream().filter(option -> option.id().equals(optionId)).findFirst();
    }

    public OptionSelection defaults() {
        return resolve(null);
    }

    /**
     * Returns every problem with {@code raw}; an empty list means the options are acceptable.
     */
    public List<String> validate(JsonNode raw) {
        List<String> errors = new ArrayList<>();
        if (raw != null && !raw.isNull() && !raw.isObject()) {
            errors.add("Options must be an object keyed by option id.");
            return errors;
        }
        parse(raw, errors);
        return errors;
    }

    /**
     * Resolves {@code raw} leniently: unknown ids are ignored and invalid values fall back to the
     * option's defaults.
     */
    public OptionSelection resolve(JsonNode raw) {
        JsonNode input = raw != null && raw.isObject() ? raw : null;
        return parse(input, new ArrayList<>());
    }

    public List<Map<String, Object>> toolEntries(OptionSelection selection, OptionKind kind) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (SyncOption option : options) {
            if (option.kind() != kind || !selection.isEnabled(option.id())) {
                continue;
            }
            OptionState state = selection.state(option.id()).orElseThrow();
            option.toToolEntry(state.values()).ifPresent(entries::add);
        }
        return entries;
    }

    public List<String> summaries(OptionSelection selection) {
        List<String> summaries = new ArrayList<>();
        for (SyncOption option : options) {
            selection.state(option.id())
                .filter(OptionState::enabled)
                .ifPresent(state -> summaries.add(option.label() + ": " + option.summarize(state.values())));
        }
        return summaries;
    }

    private OptionSelection parse(JsonNode raw, List<String> errors) {
        Map<String, OptionState> states = new LinkedHashMap<>();
        for (SyncOption option : options) {
            JsonNode entry = raw == null ? null : raw.get(option.id());
            states.put(option.id(), parseOption(option, entry, errors));
        }
        return new OptionSelection(states);
    }

    private OptionState parseOption(SyncOption option, JsonNode entry, List<String> errors) {
        boolean enabled = option.defaultEnabled();
        JsonNode rawValues = null;
        if (entry != null && !entry.isNull()) {
            if (!entry.isObject()) {
                errors.add(option.label() + " must be an object.");
            } else {
                JsonNode enabledNode = entry.get("enabled");
                if (enabledNode != null && !enabledNode.isNull()) {
                    if (enabledNode.isBoolean()) {
                        enabled = enabledNode.asBoolean();
                    } else {
                        errors.add(option.label() + ": enabled must be true or false.");
                    }
                }
                rawValues = entry.get("values");
                if (rawValues != null && !rawValues.isNull() && !rawValues.isObject()) {
                    errors.add(option.label() + ": values must be an object.");
                    rawValues = null;
                }
            }
        }

        List<String> fieldErrors = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec field : option.fields()) {
            JsonNode rawField = rawValues == null ? null : rawValues.get(field.id());
            values.put(field.id(), field.read(rawField, enabled, fieldErrors));
        }
        if (enabled && fieldErrors.isEmpty()) {
            fieldErrors.addAll(option.validate(values));
        }
        fieldErrors.forEach(error -> errors.add(option.label() + ": " + error));
        return new OptionState(enabled, values);
    }
}
