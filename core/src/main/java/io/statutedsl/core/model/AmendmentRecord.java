package io.statutedsl.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One entry of a statute's amendment history. Amendments are additive: recording one never
 * rewrites the amended statute.
 *
 * @param targetId      id of the amended statute
 * @param version       version introduced by the amendment (>= 1)
 * @param effectiveDate date the amendment takes effect, or {@code null}
 * @param description   what the amendment changes
 */
public record AmendmentRecord(String targetId, int version, LocalDate effectiveDate, String description) {

    public AmendmentRecord {
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(description, "description must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("amendment version must be >= 1, got: " + version);
        }
    }
}
