package com.zeus.people.domain.rules;

/**
 * Every invariant an operation can be rejected for, local to one aggregate or spanning several.
 */
public enum BusinessRule {

    // ---- cross-aggregate ----
    UNIQUE_NAME_IN_DEPARTMENT("Each Academic that works for a Dept must have a unique EmpName in that Dept"),
    DEPARTMENT_HEAD_ELIGIBILITY("Professor who heads a Dept must work for that Dept"),
    CHAIR_CARDINALITY("Professor holds at most one Chair"),
    AUDIT_ANTI_SYMMETRY("A Teacher that audits another Teacher cannot be audited by that Teacher"),
    COMMITTEE_ELIGIBILITY("Only teaching professors can serve on committees"),
    ROOM_UNIQUENESS("The combination of a Room has roomNr and Room is in Building is unique"),

    // ---- local ----
    TENURE_EXCLUDES_CONTRACT_END("Academic who is tenured must not have a Date indicating their contract end"),
    CHAIR_REQUIRES_PROFESSOR("Only professors can hold chairs"),
    REFERENCE_ALREADY_SET("An assigned reference cannot be overwritten"),
    REFERENCE_MISMATCH("Only the currently assigned reference can be removed"),
    DUPLICATE_ASSOCIATION("The association already exists"),
    UNKNOWN_ASSOCIATION("The association does not exist"),
    NO_STATE_CHANGE("The operation would not change anything"),
    CHAIR_HELD("A chair that is held cannot be deleted"),
    DEGREE_FROM_ONE_UNIVERSITY("An Academic obtains that Degree from at most one University"),
    RATING_REQUIRES_TEACHER("Only a current teacher of a Subject can be rated for it"),
    AGGREGATE_DELETED("A deleted aggregate cannot be changed");

    private final String description;

    BusinessRule(String description) {
        this.description = description;
    }

    /** The rule as stated in the domain model. */
    public String description() {
        return description;
    }
}
