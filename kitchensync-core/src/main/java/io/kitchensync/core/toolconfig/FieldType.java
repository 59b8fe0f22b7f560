package io.kitchensync.core.toolconfig;

public enum FieldType {
    TEXT,
    NUMBER,
    CHOICE,
    FLAG
}
