package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of legal effect a statute produces. Serialized as {@code Grant}, {@code Revoke}, etc. */
public enum EffectType {
    GRANT("Grant", TokenKind.GRANT),
    REVOKE("Revoke", TokenKind.REVOKE),
    OBLIGATION("Obligation", TokenKind.OBLIGATION),
    PROHIBITION("Prohibition", TokenKind.PROHIBITION);

    private final String tag;
    private final TokenKind keyword;

    EffectType(String tag, TokenKind keyword) {
        this.tag = tag;
        this.keyword = keyword;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /** The DSL keyword introducing this effect after {@code THEN}. */
    public TokenKind keyword() {
        return keyword;
    }

    /** Returns the effect type for a keyword token, or {@code null} if it is not an effect keyword. */
    public static EffectType fromKeyword(TokenKind kind) {
        for (EffectType type : values()) {
            if (type.keyword == kind) {
                return type;
            }
        }
        return null;
    }

    @JsonCreator
    public static EffectType fromTag(String tag) {
        for (EffectType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown effect type: '" + tag + "'");
    }
}
