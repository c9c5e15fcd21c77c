package io.statutedsl.core.error;

/** Thrown when DSL configuration cannot be read or holds an invalid value. */
public final class ConfigLoadException extends DslException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null, Phase.CONFIG);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null, Phase.CONFIG);
    }
}
