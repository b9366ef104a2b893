package com.lexguard.security;

import java.util.Map;

/**
 * The tenant restriction every tenant-scoped data operation carries: either a firm or a solo
 * practitioner. Exactly one predicate applies to an actor.
 */
public sealed interface ScopePredicate permits ScopePredicate.FirmScope, ScopePredicate.LawyerScope {

    /** Field name of the tenant key this predicate constrains. */
    String tenantKey();

    /** Required value of the tenant key. */
    String tenantValue();

    /** The predicate as a filter clause, e.g. {@code {firmId: "F1"}}. */
    default Map<String, Object> asClause() {
        return Map.of(tenantKey(), tenantValue());
    }

    /** Rendered form used in logs and metrics, e.g. {@code firm:F1}. */
    String render();

    static ScopePredicate firm(String firmId) {
        return new FirmScope(firmId);
    }

    static ScopePredicate lawyer(String lawyerId) {
        return new LawyerScope(lawyerId);
    }

    /**
     * Documents owned by a firm.
     *
     * @param firmId the firm
     */
    record FirmScope(String firmId) implements ScopePredicate {

        public FirmScope {
            if (firmId == null || firmId.isBlank()) {
                throw new IllegalArgumentException("firmId must not be null or blank");
            }
        }

        @Override
        public String tenantKey() {
            return TenantKeys.FIRM_ID;
        }

        @Override
        public String tenantValue() {
            return firmId;
        }

        @Override
        public String render() {
            return "firm:" + firmId;
        }
    }

    /**
     * Documents owned by a solo practitioner.
     *
     * @param lawyerId the practitioner's user ID
     */
    record LawyerScope(String lawyerId) implements ScopePredicate {

        public LawyerScope {
            if (lawyerId == null || lawyerId.isBlank()) {
                throw new IllegalArgumentException("lawyerId must not be null or blank");
            }
        }

        @Override
        public String tenantKey() {
            return TenantKeys.LAWYER_ID;
        }

        @Override
        public String tenantValue() {
            return lawyerId;
        }

        @Override
        public String render() {
            return "lawyer:" + lawyerId;
        }
    }
}
