package io.kitchensync.core.toolconfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TitleTemplateOption implements SyncOption {
    static final String TITLE_TOKEN = "{{title}}";

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.text("prefix", "Prefix", "[Synced] ", false, 40),
        FieldSpec.text("suffix", "Suffix", "", false, 40),
        FieldSpec.flag("uppercase", "Transform final title to uppercase", false)
    );

    @Override
    public String id() {
        return "titleTemplate";
    }

    @Override
    public OptionKind kind() {
        return OptionKind.TRANSFORMER;
    }

    @Override
    public String label() {
        return "Title template";
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public String summarize(Map<String, Object> values) {
        String prefix = OptionValues.text(values, "prefix").trim();
        String suffix = OptionValues.text(values, "suffix").trim();
        List<String> parts = new ArrayList<>();
        if (!prefix.isEmpty()) {
            parts.add("adds prefix \"" + prefix + "\"");
        }
        if (!suffix.isEmpty()) {
            parts.add("adds suffix \"" + suffix + "\"");
        }
        if (OptionValues.flag(values, "uppercase")) {
            parts.add("converts titles to uppercase");
        }
        if (parts.isEmpty()) {
            return "Uses the original title without modifications.";
        }
        return "Title template " + String.join(" and ", parts) + ".";
    }

    @Override
    public Optional<Map<String, Object>> toToolEntry(Map<String, Object> values) {
        String template = OptionValues.text(values, "prefix") + TITLE_TOKEN + OptionValues.text(values, "suffix");
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("NewTitle", template);
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", "ReplaceTitle");
        entry.put("config", config);
        return Optional.of(entry);
    }
}
