package io.statutedsl.core.engine;

import io.statutedsl.core.model.LegalResult;

/**
 * Three-valued connectives over {@code LegalResult<Boolean>}.
 *
 * <p>{@code AND}: Void if either side is Void; otherwise a deterministic {@code false} on either
 * side wins over discretion; otherwise discretion if either side needs it; otherwise
 * {@code true}.
 *
 * <p>{@code OR}: a deterministic {@code true} on either side wins; otherwise discretion; Void only
 * when both sides are Void; otherwise {@code false}.
 *
 * <p>{@code NOT}: flips deterministic values and passes discretion and Void through unchanged.
 *
 * <p>When both sides need discretion their factors are merged, left first.
 */
public final class TruthTable {

    private static final LegalResult<Boolean> TRUE = LegalResult.deterministic(Boolean.TRUE);
    private static final LegalResult<Boolean> FALSE = LegalResult.deterministic(Boolean.FALSE);

    private TruthTable() {
        // utility class
    }

    public static LegalResult<Boolean> of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LegalResult<Boolean> and(LegalResult<Boolean> a, LegalResult<Boolean> b) {
        if (a.isVoid()) {
            return a;
        }
        if (b.isVoid()) {
            return b;
        }
        if (isFalse(a) || isFalse(b)) {
            return FALSE;
        }
        if (a.isDiscretion() || b.isDiscretion()) {
            return mergeDiscretion(a, b);
        }
        return TRUE;
    }

    public static LegalResult<Boolean> or(LegalResult<Boolean> a, LegalResult<Boolean> b) {
        if (isTrue(a) || isTrue(b)) {
            return TRUE;
        }
        if (a.isDiscretion() || b.isDiscretion()) {
            return mergeDiscretion(a, b);
        }
        if (a.isVoid() && b.isVoid()) {
            return a;
        }
        return FALSE;
    }

    public static LegalResult<Boolean> not(LegalResult<Boolean> a) {
        if (a.isDeterministic()) {
            return of(!((LegalResult.Deterministic<Boolean>) a).value());
        }
        return a;
    }

    public static boolean isTrue(LegalResult<Boolean> result) {
        return result.isDeterministic() && ((LegalResult.Deterministic<Boolean>) result).value();
    }

    public static boolean isFalse(LegalResult<Boolean> result) {
        return result.isDeterministic() && !((LegalResult.Deterministic<Boolean>) result).value();
    }

    private static LegalResult<Boolean> mergeDiscretion(LegalResult<Boolean> a, LegalResult<Boolean> b) {
        if (a.isDiscretion() && b.isDiscretion()) {
            return ((LegalResult.JudicialDiscretion<Boolean>) a).merge((LegalResult.JudicialDiscretion<Boolean>) b);
        }
        return a.isDiscretion() ? a : b;
    }
}
