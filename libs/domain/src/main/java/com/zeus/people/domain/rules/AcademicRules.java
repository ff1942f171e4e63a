package com.zeus.people.domain.rules;

import com.zeus.people.domain.aggregate.Academic;
import com.zeus.people.domain.aggregate.Chair;
import com.zeus.people.domain.aggregate.Committee;
import com.zeus.people.domain.aggregate.Department;
import com.zeus.people.domain.aggregate.Room;

import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Invariants that span several aggregates.
 *
 * <p>Every rule is a pure function of its arguments: the caller supplies the candidate set and is
 * responsible for reading it consistently enough for the decision to be meaningful. Violations are
 * returned as {@link RuleResult.Violated}, never thrown.
 */
public final class AcademicRules {

    /**
     * Rejects the assignment if another academic already working for {@code departmentId} has the
     * same name.
     *
     * @param academics academics to compare against; those outside the department are ignored
     */
    public RuleResult uniqueNameInDepartment(
            Academic candidate, UUID departmentId, Collection<Academic> academics) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(departmentId, "departmentId");
        boolean taken = academics.stream()
                .filter(a -> !a.id().equals(candidate.id()))
                .filter(a -> !a.isDeleted())
                .filter(a -> a.departmentId().filter(departmentId::equals).isPresent())
                .anyMatch(a -> a.empName().equals(candidate.empName()));
        if (taken) {
            return RuleResult.violated(
                    BusinessRule.UNIQUE_NAME_IN_DEPARTMENT,
                    "Each Academic that works for a Dept must have a unique EmpName in that Dept. '"
                            + candidate.empName() + "' already exists in department " + departmentId);
        }
        return RuleResult.satisfied();
    }

    /** The candidate must be a professor who already works for the department. */
    public RuleResult departmentHeadEligibility(Academic candidate, Department department) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(department, "department");
        if (!candidate.isProfessor()) {
            return RuleResult.violated(
                    BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY, "Only professors can head departments");
        }
        boolean member = candidate.departmentId().filter(department.id()::equals).isPresent();
        if (!member) {
            return RuleResult.violated(BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY);
        }
        return RuleResult.satisfied();
    }

    /**
     * The professor may hold {@code chair} only if no other chair in {@code chairs} is held by them.
     */
    public RuleResult chairCardinality(Academic professor, Chair chair, Collection<Chair> chairs) {
        Objects.requireNonNull(professor, "professor");
        Objects.requireNonNull(chair, "chair");
        if (!professor.isProfessor()) {
            return RuleResult.violated(BusinessRule.CHAIR_REQUIRES_PROFESSOR);
        }
        boolean holdsAnother = chairs.stream()
                .filter(c -> !c.id().equals(chair.id()))
                .filter(c -> !c.isDeleted())
                .anyMatch(c -> c.isHeldBy(professor.id()));
        boolean referencesAnother = professor.chairId().filter(id -> !id.equals(chair.id())).isPresent();
        if (holdsAnother || referencesAnother) {
            return RuleResult.violated(BusinessRule.CHAIR_CARDINALITY);
        }
        return RuleResult.satisfied();
    }

    /**
     * Both parties must be teachers, an academic cannot audit themselves, and the reverse pair must
     * not already be recorded.
     */
    public RuleResult auditRelation(Academic auditor, Academic auditee, Collection<AuditPair> existingPairs) {
        Objects.requireNonNull(auditor, "auditor");
        Objects.requireNonNull(auditee, "auditee");
        if (!auditor.isTeacher() || !auditee.isTeacher()) {
            return RuleResult.violated(
                    BusinessRule.AUDIT_ANTI_SYMMETRY, "Only teachers can participate in audit relationships");
        }
        if (auditor.id().equals(auditee.id())) {
            return RuleResult.violated(
                    BusinessRule.AUDIT_ANTI_SYMMETRY, "An academic cannot audit their own teaching");
        }
        AuditPair reverse = new AuditPair(auditee.id(), auditor.id());
        if (existingPairs.contains(reverse)) {
            return RuleResult.violated(BusinessRule.AUDIT_ANTI_SYMMETRY);
        }
        return RuleResult.satisfied();
    }

    /** Only a professor who teaches at least one subject serves on a committee. */
    public RuleResult committeeEligibility(Academic candidate, Committee committee) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(committee, "committee");
        if (!candidate.isTeachingProfessor()) {
            return RuleResult.violated(BusinessRule.COMMITTEE_ELIGIBILITY);
        }
        return RuleResult.satisfied();
    }

    /** No other room may share both the building and the room number of {@code candidate}. */
    public RuleResult roomUniqueness(Room candidate, Collection<Room> rooms) {
        Objects.requireNonNull(candidate, "candidate");
        boolean duplicate = rooms.stream()
                .filter(r -> !r.id().equals(candidate.id()))
                .filter(r -> !r.isDeleted())
                .anyMatch(r -> r.buildingId().equals(candidate.buildingId())
                        && r.roomNr().equals(candidate.roomNr()));
        if (duplicate) {
            return RuleResult.violated(
                    BusinessRule.ROOM_UNIQUENESS,
                    "Room " + candidate.roomNr() + " already exists in building " + candidate.buildingId());
        }
        return RuleResult.satisfied();
    }
}
