package com.zeus.people.domain.valueobject;

/**
 * Academic rank: {@code P} (professor), {@code SL} (senior lecturer) or {@code L} (lecturer).
 *
 * @param value the wrapped rank code
 */
public record Rank(String value) {

    public static final String PROFESSOR = "P";
    public static final String SENIOR_LECTURER = "SL";
    public static final String LECTURER = "L";

    public Rank {
        validate(value).throwIfInvalid("rank");
    }

    public static Rank of(String value) {
        return new Rank(value);
    }

    public static Rank professor() {
        return new Rank(PROFESSOR);
    }

    public static Rank seniorLecturer() {
        return new Rank(SENIOR_LECTURER);
    }

    public static Rank lecturer() {
        return new Rank(LECTURER);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.oneOf(
                        value,
                        "Rank",
                        "Rank must be 'P' (Professor), 'SL' (Senior Lecturer), or 'L' (Lecturer)",
                        PROFESSOR,
                        SENIOR_LECTURER,
                        LECTURER));
    }

    public boolean isProfessor() {
        return PROFESSOR.equals(value);
    }

    public boolean isSeniorLecturer() {
        return SENIOR_LECTURER.equals(value);
    }

    public boolean isLecturer() {
        return LECTURER.equals(value);
    }

    /** The telephone access level a holder of this rank is entitled to. */
    public AccessLevel ensuredAccessLevel() {
        return switch (value) {
            case PROFESSOR -> AccessLevel.national();
            case SENIOR_LECTURER -> AccessLevel.international();
            default -> AccessLevel.local();
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
