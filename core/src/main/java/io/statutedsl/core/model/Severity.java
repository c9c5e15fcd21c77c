package io.statutedsl.core.model;

/** Diagnostic severity. Only {@link #ERROR} makes strict parsing or validation fail. */
public enum Severity {
    ERROR,
    WARNING
}
