package com.zeus.people.service.repository;

import com.zeus.people.domain.BusinessRuleViolationException;
import com.zeus.people.domain.aggregate.Academic;
import com.zeus.people.domain.aggregate.Chair;
import com.zeus.people.domain.aggregate.Department;
import com.zeus.people.domain.aggregate.Room;
import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.MoneyAmt;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;
import com.zeus.people.domain.valueobject.RoomNr;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.codec.EventDecodingException;
import com.zeus.people.eventstore.inmemory.InMemoryEventStore;
import com.zeus.people.service.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventSourcedRepository")
class EventSourcedRepositoryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-02-01T08:30:00Z"), ZoneOffset.UTC);

    private EventStore store;
    private RecordingEventPublisher publisher;
    private EventSourcedRepository<Department, DepartmentEvent> departments;
    private EventSourcedRepository<Academic, AcademicEvent> academics;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        publisher = new RecordingEventPublisher();
        departments = new EventSourcedRepository<>(store, AggregateDefinition.department(), publisher, clock, 3);
        academics = new EventSourcedRepository<>(store, AggregateDefinition.academic(), publisher, clock, 3);
    }

    private UUID addDepartment(String name) {
        return departments.add(Department.create(name, clock)).value();
    }

    @Nested
    @DisplayName("add and load")
    class AddAndLoad {

        @Test
        @DisplayName("a created aggregate is stored, published and loads back by replay")
        void addThenLoad() {
            Department department = Department.create("Computer Science", clock);
            department.addAcademic(UUID.randomUUID());

            Result<UUID> added = departments.add(department);

            assertThat(added.isSuccess()).isTrue();
            assertThat(department.uncommittedEvents()).isEmpty();
            assertThat(store.currentVersion(department.id())).isEqualTo(2);
            assertThat(publisher.eventTypes()).containsExactly("DepartmentCreated", "DepartmentAcademicAdded");

            Department loaded = departments.load(department.id()).value();
            assertThat(loaded.name()).isEqualTo("Computer Science");
            assertThat(loaded.academicIds()).isEqualTo(department.academicIds());
            assertThat(loaded.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("adding the same aggregate id twice conflicts")
        void addTwice() {
            UUID id = UUID.randomUUID();
            departments.add(Department.create(id, "Physics", clock));

            Result<UUID> again = departments.add(Department.create(id, "Physics", clock));

            assertThat(again).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.CONCURRENCY_CONFLICT));
        }

        @Test
        @DisplayName("a loaded aggregate cannot be added")
        void addLoaded() {
            UUID id = addDepartment("Physics");
            Department loaded = departments.load(id).value();
            loaded.setBudgets(MoneyAmt.zero(), MoneyAmt.zero());

            assertThatThrownBy(() -> departments.add(loaded)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an unknown id is not found")
        void unknown() {
            Result<Department> missing = departments.load(UUID.randomUUID());

            assertThat(missing).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        }

        @Test
        @DisplayName("a stream of another aggregate type fails to load")
        void wrongFamily() {
            UUID id = addDepartment("Physics");

            assertThatThrownBy(() -> academics.load(id)).isInstanceOf(EventDecodingException.class);
        }

        @Test
        @DisplayName("the MDC is restored after the call")
        void mdcRestored() {
            MDC.put(AggregateLogContext.MDC_AGGREGATE_TYPE, "outer");

            departments.load(UUID.randomUUID());

            assertThat(MDC.get(AggregateLogContext.MDC_AGGREGATE_TYPE)).isEqualTo("outer");
            assertThat(MDC.get(AggregateLogContext.MDC_AGGREGATE_ID)).isNull();
            MDC.clear();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("appends the mutations of a loaded aggregate")
        void appendsMutations() {
            UUID id = addDepartment("Chemistry");
            Department department = departments.load(id).value();
            department.addAcademic(UUID.randomUUID());

            assertThat(departments.update(department).isSuccess()).isTrue();
            assertThat(store.currentVersion(id)).isEqualTo(2);
        }

        @Test
        @DisplayName("a stale copy is rejected without retry")
        void staleCopy() {
            UUID id = addDepartment("Chemistry");
            Department first = departments.load(id).value();
            Department second = departments.load(id).value();
            first.addAcademic(UUID.randomUUID());
            second.addAcademic(UUID.randomUUID());
            departments.update(first);

            Result<Department> result = departments.update(second);

            assertThat(result).isInstanceOfSatisfying(Result.Failure.class, f -> {
                assertThat(f.kind()).isEqualTo(ErrorKind.CONCURRENCY_CONFLICT);
                assertThat(f.message()).contains("Expected version 1, but current version is 2");
            });
            assertThat(store.currentVersion(id)).isEqualTo(2);
        }

        @Test
        @DisplayName("nothing to append is a success")
        void noChanges() {
            UUID id = addDepartment("Chemistry");
            int published = publisher.published().size();

            assertThat(departments.update(departments.load(id).value()).isSuccess()).isTrue();
            assertThat(publisher.published()).hasSize(published);
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("retries on a concurrent change and reapplies the mutation")
        void retriesOnConflict() {
            UUID id = addDepartment("Biology");
            UUID member = UUID.randomUUID();
            AtomicInteger calls = new AtomicInteger();

            Result<Department> result = departments.execute(id, department -> {
                if (calls.incrementAndGet() == 1) {
                    departments.execute(id, d -> d.addAcademic(UUID.randomUUID()));
                }
                department.addAcademic(member);
            });

            assertThat(result.isSuccess()).isTrue();
            assertThat(calls).hasValue(2);
            assertThat(store.currentVersion(id)).isEqualTo(3);
            assertThat(departments.load(id).value().academicIds()).contains(member).hasSize(2);
        }

        @Test
        @DisplayName("gives up after the configured number of attempts")
        void exhaustsAttempts() {
            var twoAttempts = new EventSourcedRepository<>(store, AggregateDefinition.department(), publisher, clock, 2);
            UUID id = addDepartment("Biology");
            AtomicInteger calls = new AtomicInteger();

            Result<Department> result = twoAttempts.execute(id, department -> {
                calls.incrementAndGet();
                departments.execute(id, d -> d.addAcademic(UUID.randomUUID()));
                department.addAcademic(UUID.randomUUID());
            });

            assertThat(result).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.CONCURRENCY_CONFLICT));
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("a business rule violation appends nothing")
        void ruleViolation() {
            UUID id = addDepartment("Biology");
            UUID member = UUID.randomUUID();
            departments.execute(id, d -> d.addAcademic(member));

            Result<Department> result = departments.execute(id, d -> d.addAcademic(member));

            assertThat(result).isInstanceOfSatisfying(Result.Failure.class, f -> {
                assertThat(f.kind()).isEqualTo(ErrorKind.BUSINESS_RULE);
                assertThat(f.violatedRule()).contains(BusinessRule.DUPLICATE_ASSOCIATION);
            });
            assertThat(store.currentVersion(id)).isEqualTo(2);
        }

        @Test
        @DisplayName("a rejected value object is a validation failure")
        void validationFailure() {
            UUID id = addDepartment("Biology");
            UUID head = UUID.randomUUID();
            departments.execute(id, d -> d.addAcademic(head));

            Result<Department> result = departments.execute(id, d -> d.assignHead(head, PhoneNr.of("call me")));

            assertThat(result).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.VALIDATION));
        }

        @Test
        @DisplayName("an exception from a rule check inside the mutation is reported with its rule")
        void thrownRule() {
            UUID id = addDepartment("Biology");

            Result<Department> result = departments.execute(id, d -> {
                throw new BusinessRuleViolationException(BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY, "not a member");
            });

            assertThat(result).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.violatedRule()).contains(BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY));
        }

        @Test
        @DisplayName("a publisher failure does not fail the committed change")
        void publisherFailure() {
            var failing = new EventSourcedRepository<>(store, AggregateDefinition.department(),
                    event -> {
                        throw new IllegalStateException("bus down");
                    }, clock, 3);
            UUID id = failing.add(Department.create("Geology", clock)).value();

            assertThat(failing.execute(id, d -> d.addAcademic(UUID.randomUUID())).isSuccess()).isTrue();
            assertThat(store.currentVersion(id)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("a deleted aggregate is no longer found but its history stays")
        void deleteKeepsHistory() {
            UUID id = addDepartment("Music");

            assertThat(departments.delete(id).isSuccess()).isTrue();

            assertThat(departments.load(id)).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.NOT_FOUND));
            assertThat(store.getEvents(id)).hasSize(2);
            assertThat(departments.delete(id)).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        }
    }

    @Nested
    @DisplayName("unique claims")
    class Claims {

        private EventSourcedRepository<Room, RoomEvent> rooms;
        private EventSourcedRepository<Chair, ChairEvent> chairs;

        @BeforeEach
        void setUpRepositories() {
            rooms = new EventSourcedRepository<>(store, AggregateDefinition.room(), publisher, clock, 3);
            chairs = new EventSourcedRepository<>(store, AggregateDefinition.chair(), publisher, clock, 3);
        }

        @Test
        @DisplayName("a second room with the same number in the same building is rejected")
        void duplicateRoom() {
            UUID building = UUID.randomUUID();
            rooms.add(Room.create(RoomNr.of("101"), building, clock));

            Result<UUID> duplicate = rooms.add(Room.create(RoomNr.of("101"), building, clock));

            assertThat(duplicate).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.violatedRule()).contains(BusinessRule.ROOM_UNIQUENESS));
            assertThat(rooms.add(Room.create(RoomNr.of("101"), UUID.randomUUID(), clock)).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("deleting a room frees its number")
        void deleteFreesNumber() {
            UUID building = UUID.randomUUID();
            UUID first = rooms.add(Room.create(RoomNr.of("101"), building, clock)).value();
            rooms.delete(first);

            assertThat(rooms.add(Room.create(RoomNr.of("101"), building, clock)).isSuccess()).isTrue();
            assertThat(store.claimHolder(ClaimKeys.roomNumber(building, RoomNr.of("101"))))
                    .hasValueSatisfying(holder -> assertThat(holder).isNotEqualTo(first));
        }

        @Test
        @DisplayName("a professor cannot be given a second chair even without a rule check")
        void secondChair() {
            UUID professor = academics.add(
                    Academic.create(EmpNr.of("AB1234"), EmpName.of("Smith J."), Rank.professor(), clock)).value();
            UUID databases = chairs.add(Chair.create("Databases", clock)).value();
            UUID ai = chairs.add(Chair.create("AI", clock)).value();
            chairs.execute(databases, c -> c.assignToProfessor(professor));

            Result<Chair> second = chairs.execute(ai, c -> c.assignToProfessor(professor));

            assertThat(second).isInstanceOfSatisfying(Result.Failure.class,
                    f -> assertThat(f.violatedRule()).contains(BusinessRule.CHAIR_CARDINALITY));
            assertThat(store.currentVersion(ai)).isEqualTo(1);
        }

        @Test
        @DisplayName("releasing a chair frees the professor")
        void releaseFreesProfessor() {
            UUID professor = UUID.randomUUID();
            UUID databases = chairs.add(Chair.create("Databases", clock)).value();
            UUID ai = chairs.add(Chair.create("AI", clock)).value();
            chairs.execute(databases, c -> c.assignToProfessor(professor));
            chairs.execute(databases, c -> c.releaseProfessor(professor));

            assertThat(chairs.execute(ai, c -> c.assignToProfessor(professor)).isSuccess()).isTrue();
            assertThat(store.claimHolder(ClaimKeys.chairHolder(professor))).contains(ai);
        }
    }
}
