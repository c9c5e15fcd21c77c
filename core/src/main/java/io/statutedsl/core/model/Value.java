package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed scalar used for condition literals, {@code DEFAULT} values, effect parameters and entity
 * attributes.
 *
 * <p>Sealed: every kind is known at compile time and {@link #kind()} allows exhaustive switches.
 * {@link AbsentValue} never appears in parsed source; it marks an entity attribute that is
 * recorded as inapplicable.
 *
 * <p>Thread-safe and immutable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Value.NumberValue.class, name = "number"),
    @JsonSubTypes.Type(value = Value.StringValue.class, name = "string"),
    @JsonSubTypes.Type(value = Value.BooleanValue.class, name = "boolean"),
    @JsonSubTypes.Type(value = Value.DateValue.class, name = "date"),
    @JsonSubTypes.Type(value = Value.AbsentValue.class, name = "absent")
})
public sealed interface Value {

    /** Discriminator for exhaustive switches. */
    enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        DATE,
        ABSENT
    }

    Kind kind();

    /** Whether values of this kind have a total order usable by {@code <}, {@code BETWEEN}, etc. */
    @JsonIgnore
    default boolean isOrdered() {
        return kind() == Kind.NUMBER || kind() == Kind.DATE;
    }

    static Value of(long number) {
        return new NumberValue(BigDecimal.valueOf(number));
    }

    static Value of(BigDecimal number) {
        return new NumberValue(number);
    }

    static Value of(String text) {
        return new StringValue(text);
    }

    static Value of(boolean flag) {
        return new BooleanValue(flag);
    }

    static Value of(LocalDate date) {
        return new DateValue(date);
    }

    static Value absent() {
        return AbsentValue.INSTANCE;
    }

    /** Whether {@code a} and {@code b} share an ordered kind and can be passed to {@link #compare}. */
    static boolean comparable(Value a, Value b) {
        return a.kind() == b.kind() && a.isOrdered();
    }

    /**
     * Compares two numbers or two dates.
     *
     * @throws IllegalArgumentException if the values are not of the same ordered kind
     */
    static int compare(Value a, Value b) {
        if (!comparable(a, b)) {
            throw new IllegalArgumentException("cannot order " + a.kind() + " against " + b.kind());
        }
        if (a.kind() == Kind.NUMBER) {
            return ((NumberValue) a).value().compareTo(((NumberValue) b).value());
        }
        return ((DateValue) a).value().compareTo(((DateValue) b).value());
    }

    /**
     * Number value. The magnitude is normalised on construction so that {@code 20} and {@code 20.0}
     * compare and hash equal.
     */
    record NumberValue(BigDecimal value) implements Value {
        public NumberValue {
            Objects.requireNonNull(value, "value must not be null");
            value = normalise(value);
        }

        private static BigDecimal normalise(BigDecimal raw) {
            BigDecimal stripped = raw.stripTrailingZeros();
            return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record BooleanValue(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record DateValue(LocalDate value) implements Value {
        public DateValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.DATE;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /** An attribute that is known to be inapplicable to the entity. */
    record AbsentValue() implements Value {
        static final AbsentValue INSTANCE = new AbsentValue();

        @Override
        public Kind kind() {
            return Kind.ABSENT;
        }

        @Override
        public String toString() {
            return "absent";
        }
    }
}
