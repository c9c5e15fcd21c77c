package io.statutedsl.core.model;

/** Statute visibility outside its document. Omitted visibility means {@link #PRIVATE}. */
public enum Visibility {
    PUBLIC,
    PRIVATE
}
