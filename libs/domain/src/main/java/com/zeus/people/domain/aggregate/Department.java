package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.MoneyAmt;
import com.zeus.people.domain.valueobject.PhoneNr;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireName;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/**
 * An academic department with its budgets, members, head and chair.
 *
 * <p>The head must be a member; removing the head as a member clears the head and the head's
 * home phone.
 */
public final class Department implements AggregateRoot<DepartmentEvent> {

    static final int MAX_NAME_LENGTH = 100;

    private final EventSourcedEntity<DepartmentEvent> entity;

    private String name;
    private MoneyAmt researchBudget;
    private MoneyAmt teachingBudget;
    private UUID headProfessorId;
    private PhoneNr headHomePhone;
    private UUID chairId;
    private final Set<UUID> academicIds = new LinkedHashSet<>();
    private boolean deleted;

    private Department(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Department create(String name, Clock clock) {
        return create(UUID.randomUUID(), name, clock);
    }

    public static Department create(UUID id, String name, Clock clock) {
        String validName = requireName(name, "Department name", MAX_NAME_LENGTH);
        Department department = new Department(clock);
        department.entity.raise((eventId, at, v) ->
                new DepartmentEvent.Created(eventId, at, v, requireId(id, "Department id"), validName));
        return department;
    }

    public static Department reconstruct(List<? extends DepartmentEvent> events, Clock clock) {
        Department department = new Department(clock);
        department.entity.replay(events);
        return department;
    }

    public static Department reconstruct(List<? extends DepartmentEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void setBudgets(MoneyAmt researchBudget, MoneyAmt teachingBudget) {
        Objects.requireNonNull(researchBudget, "researchBudget");
        Objects.requireNonNull(teachingBudget, "teachingBudget");
        requireNotDeleted(this);
        entity.raise((eventId, at, v) ->
                new DepartmentEvent.BudgetsSet(eventId, at, v, id(), researchBudget, teachingBudget));
    }

    public void addAcademic(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(!academicIds.contains(academicId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic " + academicId + " already works for department '" + name + "'");
        entity.raise((eventId, at, v) -> new DepartmentEvent.AcademicAdded(eventId, at, v, id(), academicId));
    }

    public void removeAcademic(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(academicIds.contains(academicId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Academic " + academicId + " does not work for department '" + name + "'");
        entity.raise((eventId, at, v) -> new DepartmentEvent.AcademicRemoved(eventId, at, v, id(), academicId));
    }

    public void assignHead(UUID professorId, PhoneNr headHomePhone) {
        requireId(professorId, "Professor id");
        Objects.requireNonNull(headHomePhone, "headHomePhone");
        requireNotDeleted(this);
        require(academicIds.contains(professorId),
                BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY,
                BusinessRule.DEPARTMENT_HEAD_ELIGIBILITY.description());
        entity.raise((eventId, at, v) ->
                new DepartmentEvent.HeadAssigned(eventId, at, v, id(), professorId, headHomePhone));
    }

    public void assignChair(UUID chairId) {
        requireId(chairId, "Chair id");
        requireNotDeleted(this);
        require(this.chairId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Department '" + name + "' already has chair " + this.chairId);
        entity.raise((eventId, at, v) -> new DepartmentEvent.ChairAssigned(eventId, at, v, id(), chairId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new DepartmentEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(DepartmentEvent event) {
        switch (event.eventType()) {
            case DEPARTMENT_CREATED -> name = ((DepartmentEvent.Created) event).name();
            case DEPARTMENT_BUDGETS_SET -> {
                var e = (DepartmentEvent.BudgetsSet) event;
                researchBudget = e.researchBudget();
                teachingBudget = e.teachingBudget();
            }
            case DEPARTMENT_ACADEMIC_ADDED -> academicIds.add(((DepartmentEvent.AcademicAdded) event).academicId());
            case DEPARTMENT_ACADEMIC_REMOVED -> {
                UUID removed = ((DepartmentEvent.AcademicRemoved) event).academicId();
                academicIds.remove(removed);
                if (removed.equals(headProfessorId)) {
                    headProfessorId = null;
                    headHomePhone = null;
                }
            }
            case PROFESSOR_ASSIGNED_AS_DEPARTMENT_HEAD -> {
                var e = (DepartmentEvent.HeadAssigned) event;
                headProfessorId = e.professorId();
                headHomePhone = e.headHomePhone();
            }
            case CHAIR_ASSIGNED_TO_DEPARTMENT -> chairId = ((DepartmentEvent.ChairAssigned) event).chairId();
            case DEPARTMENT_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a department event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.DEPARTMENT;
    }

    @Override
    public int version() {
        return entity.version();
    }

    @Override
    public Instant createdAt() {
        return entity.createdAt();
    }

    @Override
    public Instant modifiedAt() {
        return entity.modifiedAt();
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public List<DepartmentEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String name() {
        return name;
    }

    public Optional<MoneyAmt> researchBudget() {
        return Optional.ofNullable(researchBudget);
    }

    public Optional<MoneyAmt> teachingBudget() {
        return Optional.ofNullable(teachingBudget);
    }

    public Optional<UUID> headProfessorId() {
        return Optional.ofNullable(headProfessorId);
    }

    public Optional<PhoneNr> headHomePhone() {
        return Optional.ofNullable(headHomePhone);
    }

    public Optional<UUID> chairId() {
        return Optional.ofNullable(chairId);
    }

    public Set<UUID> academicIds() {
        return Collections.unmodifiableSet(academicIds);
    }

    public boolean hasMember(UUID academicId) {
        return academicIds.contains(academicId);
    }
}
