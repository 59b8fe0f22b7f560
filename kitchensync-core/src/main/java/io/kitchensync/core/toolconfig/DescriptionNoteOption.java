package io.kitchensync.core.toolconfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class DescriptionNoteOption implements SyncOption {
    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.text("note", "Note text", "This event is synchronised by Kitchen Sync.", true, 280),
        FieldSpec.choice("placement", "Placement", "APPEND", List.of("APPEND", "PREPEND"))
    );

    @Override
    public String id() {
        return "descriptionNote";
    }

    @Override
    public OptionKind kind() {
        return OptionKind.TRANSFORMER;
    }

    @Override
    public String label() {
        return "Description note";
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public List<String> validate(Map<String, Object> values) {
        if (OptionValues.text(values, "note").isBlank()) {
            return List.of("Provide a note to include in the event description.");
        }
        return List.of();
    }

    @Override
    public String summarize(Map<String, Object> values) {
        String note = OptionValues.text(values, "note").trim();
        if (note.isEmpty()) {
            return "Note text not provided.";
        }
        String placement = "PREPEND".equals(values.get("placement")) ? "Prepended" : "Appended";
        return placement + " note \"" + note + "\" to the description.";
    }

    // The sync tool has no note transformer; keeping the source description is the closest match.
    @Override
    public Optional<Map<String, Object>> toToolEntry(Map<String, Object> values) {
        return Optional.of(Map.of("name", "KeepDescription"));
    }
}
