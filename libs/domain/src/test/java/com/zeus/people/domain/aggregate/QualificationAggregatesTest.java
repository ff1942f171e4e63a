package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.BusinessRuleViolationException;
import com.zeus.people.domain.ValidationException;
import com.zeus.people.domain.event.DegreeEvent;
import com.zeus.people.domain.event.EventType;
import com.zeus.people.domain.rules.BusinessRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Degree and University aggregates")
class QualificationAggregatesTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC);

    private static BusinessRule ruleOf(Throwable t) {
        return ((BusinessRuleViolationException) t).rule();
    }

    @Nested
    @DisplayName("Degree")
    class DegreeTests {

        @Test
        @DisplayName("an academic obtains a degree from at most one university")
        void oneUniversityPerAcademic() {
            var degree = Degree.create("PhD", clock);
            var academic = UUID.randomUUID();
            var oxford = UUID.randomUUID();
            var cambridge = UUID.randomUUID();
            degree.addObtainment(academic, oxford);

            assertThatThrownBy(() -> degree.addObtainment(academic, cambridge))
                    .isInstanceOf(BusinessRuleViolationException.class)
                    .hasMessageContaining(oxford.toString())
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.DEGREE_FROM_ONE_UNIVERSITY));
            assertThatThrownBy(() -> degree.addObtainment(academic, oxford))
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.DEGREE_FROM_ONE_UNIVERSITY));
            assertThat(degree.universityOf(academic)).contains(oxford);
            assertThat(degree.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("different academics may obtain it from different universities")
        void manyAcademics() {
            var degree = Degree.create("BSc", clock);
            var smith = UUID.randomUUID();
            var jones = UUID.randomUUID();
            var oxford = UUID.randomUUID();
            var cambridge = UUID.randomUUID();

            degree.addObtainment(smith, oxford);
            degree.addObtainment(jones, cambridge);

            assertThat(degree.obtainments()).containsEntry(smith, oxford).containsEntry(jones, cambridge);
        }

        @Test
        @DisplayName("removing an obtainment frees the academic to record it again")
        void removeObtainment() {
            var degree = Degree.create("MSc", clock);
            var academic = UUID.randomUUID();
            degree.addObtainment(academic, UUID.randomUUID());
            degree.removeObtainment(academic);
            var other = UUID.randomUUID();

            degree.addObtainment(academic, other);

            assertThat(degree.universityOf(academic)).contains(other);
            assertThatThrownBy(() -> degree.removeObtainment(UUID.randomUUID()))
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.UNKNOWN_ASSOCIATION));
        }

        @Test
        @DisplayName("the code is required and at most 10 characters")
        void codeValidation() {
            assertThatThrownBy(() -> Degree.create(" ", clock)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> Degree.create("ABCDEFGHIJK", clock)).isInstanceOf(ValidationException.class);
            assertThat(Degree.create(" PhD ", clock).code()).isEqualTo("PhD");
        }

        @Test
        @DisplayName("replay restores obtainments and a deleted degree rejects changes")
        void replayAndDelete() {
            var degree = Degree.create("PhD", clock);
            var academic = UUID.randomUUID();
            var university = UUID.randomUUID();
            degree.addObtainment(academic, university);
            degree.delete();

            var rebuilt = Degree.reconstruct(degree.uncommittedEvents(), clock);

            assertThat(rebuilt.uncommittedEvents()).isEmpty();
            assertThat(rebuilt.isDeleted()).isTrue();
            assertThat(rebuilt.universityOf(academic)).contains(university);
            assertThat(degree.uncommittedEvents()).extracting(DegreeEvent::eventType)
                    .containsExactly(EventType.DEGREE_CREATED, EventType.DEGREE_OBTAINED, EventType.DEGREE_DELETED);
            assertThatThrownBy(() -> rebuilt.addObtainment(UUID.randomUUID(), university))
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.AGGREGATE_DELETED));
        }
    }

    @Nested
    @DisplayName("University")
    class UniversityTests {

        @Test
        @DisplayName("degrees are added only if absent and removed only if present")
        void degrees() {
            var university = University.create("OXF", clock);
            var degree = UUID.randomUUID();
            university.addDegree(degree);

            assertThat(university.awards(degree)).isTrue();
            assertThatThrownBy(() -> university.addDegree(degree))
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.DUPLICATE_ASSOCIATION));
            university.removeDegree(degree);
            assertThatThrownBy(() -> university.removeDegree(degree))
                    .satisfies(t -> assertThat(ruleOf(t)).isEqualTo(BusinessRule.UNKNOWN_ASSOCIATION));
            assertThat(university.degreeIds()).isEmpty();
        }

        @Test
        @DisplayName("the code is required and at most 20 characters")
        void codeValidation() {
            assertThatThrownBy(() -> University.create(null, clock)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> University.create("X".repeat(21), clock)).isInstanceOf(ValidationException.class);
            assertThat(University.create("X".repeat(20), clock).code()).hasSize(20);
        }

        @Test
        @DisplayName("replay restores the awarded degrees")
        void replay() {
            var university = University.create("CAM", clock);
            var degree = UUID.randomUUID();
            university.addDegree(degree);

            var rebuilt = University.reconstruct(university.uncommittedEvents(), clock);

            assertThat(rebuilt.code()).isEqualTo("CAM");
            assertThat(rebuilt.degreeIds()).containsExactly(degree);
            assertThat(rebuilt.version()).isEqualTo(2);
        }
    }
}
