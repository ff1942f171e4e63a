package com.zeus.people.domain.rules;

import java.util.Objects;
import java.util.UUID;

/**
 * A recorded audit relation: {@code auditorId} audits the teaching of {@code auditeeId}.
 */
public record AuditPair(UUID auditorId, UUID auditeeId) {

    public AuditPair {
        Objects.requireNonNull(auditorId, "auditorId");
        Objects.requireNonNull(auditeeId, "auditeeId");
    }
}
