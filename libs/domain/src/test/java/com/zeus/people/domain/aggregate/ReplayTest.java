package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.MutableClock;
import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.MoneyAmt;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Reconstruction by replay")
class ReplayTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-15T10:00:00Z");

    private Academic busyAcademic() {
        var academic = Academic.create(EmpNr.of("AB1234"), EmpName.of("Smith J."), Rank.lecturer(), clock);
        clock.advance(Duration.ofMinutes(5));
        academic.changeRank(Rank.professor());
        academic.assignToDepartment(UUID.randomUUID());
        academic.assignToRoom(UUID.randomUUID());
        academic.setContractEndDate(LocalDate.of(2027, 8, 31));
        academic.setHomePhone(PhoneNr.of("555-0199"));
        academic.assignExtension(UUID.randomUUID());
        academic.assignChair(UUID.randomUUID());
        academic.addSubject(UUID.randomUUID());
        academic.addDegree(UUID.randomUUID());
        clock.advance(Duration.ofMinutes(5));
        academic.addAuditee(UUID.randomUUID());
        return academic;
    }

    @Test
    @DisplayName("folding the raised events reproduces the aggregate's state and version")
    void reconstructMatchesOriginal() {
        var original = busyAcademic();
        var laterClock = Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC);

        var rebuilt = Academic.reconstruct(original.uncommittedEvents(), laterClock);

        assertThat(rebuilt.version()).isEqualTo(original.uncommittedEvents().size()).isEqualTo(original.version());
        assertSameState(rebuilt, original);
        assertThat(rebuilt.uncommittedEvents()).isEmpty();
        assertThat(rebuilt.createdAt()).isEqualTo(Instant.parse("2025-01-15T10:00:00Z"));
        assertThat(rebuilt.modifiedAt()).isEqualTo(Instant.parse("2025-01-15T10:10:00Z"));
    }

    @Test
    @DisplayName("replaying the same stream twice yields identical state")
    void replayIsIdempotent() {
        List<AcademicEvent> events = busyAcademic().uncommittedEvents();

        var first = Academic.reconstruct(events);
        var second = Academic.reconstruct(events);

        assertSameState(first, second);
        assertThat(first.createdAt()).isEqualTo(second.createdAt());
        assertThat(first.modifiedAt()).isEqualTo(second.modifiedAt());
    }

    @Test
    @DisplayName("a replayed aggregate continues at the next version")
    void continuesAfterReplay() {
        var department = Department.create("Computer Science", clock);
        department.setBudgets(MoneyAmt.of("1000"), MoneyAmt.of("2000"));
        var rebuilt = Department.reconstruct(department.uncommittedEvents(), clock);

        rebuilt.addAcademic(UUID.randomUUID());

        assertThat(rebuilt.uncommittedEvents()).singleElement()
                .satisfies(e -> assertThat(e.version()).isEqualTo(3));
        assertThat(rebuilt.committedVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("raised events carry the clock's instant cut to microseconds")
    void raisedEventsAtMicrosecondPrecision() {
        var clock = Clock.fixed(Instant.parse("2032-01-01T00:00:00.000001999Z"), ZoneOffset.UTC);

        var department = Department.create("Physics", clock);

        assertThat(department.uncommittedEvents()).singleElement()
                .satisfies(e -> assertThat(e.occurredAt()).isEqualTo(Instant.parse("2032-01-01T00:00:00.000001Z")));
        assertThat(department.createdAt()).isEqualTo(Instant.parse("2032-01-01T00:00:00.000001Z"));
    }

    @Test
    @DisplayName("a version gap is rejected")
    void gapRejected() {
        var id = UUID.randomUUID();
        var at = Instant.parse("2025-01-15T10:00:00Z");
        List<DepartmentEvent> events = List.of(
                new DepartmentEvent.Created(UUID.randomUUID(), at, 1, id, "Physics"),
                new DepartmentEvent.AcademicAdded(UUID.randomUUID(), at, 3, id, UUID.randomUUID()));

        assertThatThrownBy(() -> Department.reconstruct(events))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("version 2 was expected");
    }

    @Test
    @DisplayName("events of another aggregate are rejected")
    void foreignEventRejected() {
        var at = Instant.parse("2025-01-15T10:00:00Z");
        List<DepartmentEvent> events = List.of(
                new DepartmentEvent.Created(UUID.randomUUID(), at, 1, UUID.randomUUID(), "Physics"),
                new DepartmentEvent.Deleted(UUID.randomUUID(), at, 2, UUID.randomUUID()));

        assertThatThrownBy(() -> Department.reconstruct(events)).isInstanceOf(IllegalStateException.class);
    }

    private static void assertSameState(Academic actual, Academic expected) {
        assertThat(actual.id()).isEqualTo(expected.id());
        assertThat(actual.version()).isEqualTo(expected.version());
        assertThat(actual.empNr()).isEqualTo(expected.empNr());
        assertThat(actual.empName()).isEqualTo(expected.empName());
        assertThat(actual.rank()).isEqualTo(expected.rank());
        assertThat(actual.isTenured()).isEqualTo(expected.isTenured());
        assertThat(actual.contractEndDate()).isEqualTo(expected.contractEndDate());
        assertThat(actual.homePhone()).isEqualTo(expected.homePhone());
        assertThat(actual.departmentId()).isEqualTo(expected.departmentId());
        assertThat(actual.roomId()).isEqualTo(expected.roomId());
        assertThat(actual.extensionId()).isEqualTo(expected.extensionId());
        assertThat(actual.chairId()).isEqualTo(expected.chairId());
        assertThat(actual.subjectIds()).containsExactlyElementsOf(expected.subjectIds());
        assertThat(actual.degreeIds()).containsExactlyElementsOf(expected.degreeIds());
        assertThat(actual.auditeeIds()).containsExactlyElementsOf(expected.auditeeIds());
        assertThat(actual.isDeleted()).isEqualTo(expected.isDeleted());
    }
}
