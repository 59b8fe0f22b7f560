package io.kitchensync.core.toolconfig;

public enum OptionKind {
    TRANSFORMER,
    FILTER
}
