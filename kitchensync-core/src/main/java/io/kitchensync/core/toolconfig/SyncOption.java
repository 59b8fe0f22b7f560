package io.kitchensync.core.toolconfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One named transform or filter a job can enable. Each variant owns its field schema, its
 * cross-field validation and its serialization into the sync tool's config format.
 */
public interface SyncOption {
    String id();

    OptionKind kind();

    String label();

    default boolean defaultEnabled() {
        return false;
    }

    List<FieldSpec> fields();

    default List<String> validate(Map<String, Object> values) {
        return List.of();
    }

    String summarize(Map<String, Object> values);

    /**
     * Returns the entry for the tool's {@code transformations} or {@code filters} list, or empty
     * when these values produce nothing to send.
     */
    Optional<Map<String, Object>> toToolEntry(Map<String, Object> values);
}
