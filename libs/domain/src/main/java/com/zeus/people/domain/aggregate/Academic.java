package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.AccessLevel;
import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/**
 * A faculty member: employee number, name, rank and contract details, plus references to the
 * department, room, extension and chair the academic is associated with.
 *
 * <p>Local invariants: tenure and a contract end date exclude each other; only a professor holds
 * a chair; room, extension and chair references are set once and only cleared by naming them.
 */
public final class Academic implements AggregateRoot<AcademicEvent> {

    private final EventSourcedEntity<AcademicEvent> entity;

    private EmpNr empNr;
    private EmpName empName;
    private Rank rank;
    private boolean tenured;
    private LocalDate contractEndDate;
    private PhoneNr homePhone;
    private UUID departmentId;
    private UUID roomId;
    private UUID extensionId;
    private UUID chairId;
    private final Set<UUID> subjectIds = new LinkedHashSet<>();
    private final Set<UUID> degreeIds = new LinkedHashSet<>();
    private final Set<UUID> auditeeIds = new LinkedHashSet<>();
    private boolean deleted;

    private Academic(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Academic create(EmpNr empNr, EmpName empName, Rank rank, Clock clock) {
        return create(UUID.randomUUID(), empNr, empName, rank, clock);
    }

    public static Academic create(UUID id, EmpNr empNr, EmpName empName, Rank rank, Clock clock) {
        Objects.requireNonNull(empNr, "empNr");
        Objects.requireNonNull(empName, "empName");
        Objects.requireNonNull(rank, "rank");
        Academic academic = new Academic(clock);
        academic.entity.raise((eventId, at, v) ->
                new AcademicEvent.Created(eventId, at, v, requireId(id, "Academic id"), empNr, empName, rank));
        return academic;
    }

    /** Rebuilds an academic from its event stream. */
    public static Academic reconstruct(List<? extends AcademicEvent> events, Clock clock) {
        Academic academic = new Academic(clock);
        academic.entity.replay(events);
        return academic;
    }

    public static Academic reconstruct(List<? extends AcademicEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    // ---- commands ----

    public void changeRank(Rank newRank) {
        Objects.requireNonNull(newRank, "newRank");
        requireNotDeleted(this);
        require(!newRank.equals(rank), BusinessRule.NO_STATE_CHANGE, "Academic already has rank " + rank);
        require(newRank.isProfessor() || chairId == null,
                BusinessRule.CHAIR_REQUIRES_PROFESSOR,
                "Academic holds chair " + chairId + " and cannot leave the professor rank");
        Rank oldRank = rank;
        entity.raise((eventId, at, v) -> new AcademicEvent.RankChanged(eventId, at, v, id(), oldRank, newRank));
    }

    public void assignToDepartment(UUID departmentId) {
        requireId(departmentId, "Department id");
        requireNotDeleted(this);
        require(!departmentId.equals(this.departmentId),
                BusinessRule.NO_STATE_CHANGE,
                "Academic already works for department " + departmentId);
        entity.raise((eventId, at, v) ->
                new AcademicEvent.AssignedToDepartment(eventId, at, v, id(), departmentId));
    }

    public void assignToRoom(UUID roomId) {
        requireId(roomId, "Room id");
        requireNotDeleted(this);
        require(this.roomId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Academic already occupies room " + this.roomId);
        entity.raise((eventId, at, v) -> new AcademicEvent.AssignedToRoom(eventId, at, v, id(), roomId));
    }

    public void removeFromRoom(UUID roomId) {
        requireId(roomId, "Room id");
        requireNotDeleted(this);
        require(roomId.equals(this.roomId),
                BusinessRule.REFERENCE_MISMATCH,
                "Academic does not occupy room " + roomId);
        entity.raise((eventId, at, v) -> new AcademicEvent.RemovedFromRoom(eventId, at, v, id(), roomId));
    }

    public void makeTenured() {
        requireNotDeleted(this);
        require(contractEndDate == null,
                BusinessRule.TENURE_EXCLUDES_CONTRACT_END,
                BusinessRule.TENURE_EXCLUDES_CONTRACT_END.description());
        require(!tenured, BusinessRule.NO_STATE_CHANGE, "Academic is already tenured");
        entity.raise((eventId, at, v) -> new AcademicEvent.Tenured(eventId, at, v, id()));
    }

    public void setContractEndDate(LocalDate contractEndDate) {
        Objects.requireNonNull(contractEndDate, "contractEndDate");
        requireNotDeleted(this);
        require(!tenured,
                BusinessRule.TENURE_EXCLUDES_CONTRACT_END,
                BusinessRule.TENURE_EXCLUDES_CONTRACT_END.description());
        entity.raise((eventId, at, v) ->
                new AcademicEvent.ContractEndDateSet(eventId, at, v, id(), contractEndDate));
    }

    public void setHomePhone(PhoneNr homePhone) {
        Objects.requireNonNull(homePhone, "homePhone");
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new AcademicEvent.HomePhoneSet(eventId, at, v, id(), homePhone));
    }

    public void assignExtension(UUID extensionId) {
        requireId(extensionId, "Extension id");
        requireNotDeleted(this);
        require(this.extensionId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Academic already uses extension " + this.extensionId);
        entity.raise((eventId, at, v) ->
                new AcademicEvent.ExtensionAssigned(eventId, at, v, id(), extensionId));
    }

    public void assignChair(UUID chairId) {
        requireId(chairId, "Chair id");
        requireNotDeleted(this);
        require(isProfessor(), BusinessRule.CHAIR_REQUIRES_PROFESSOR,
                BusinessRule.CHAIR_REQUIRES_PROFESSOR.description());
        require(this.chairId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Academic already holds chair " + this.chairId);
        entity.raise((eventId, at, v) -> new AcademicEvent.ChairAssigned(eventId, at, v, id(), chairId));
    }

    public void removeChair(UUID chairId) {
        requireId(chairId, "Chair id");
        requireNotDeleted(this);
        require(chairId.equals(this.chairId),
                BusinessRule.REFERENCE_MISMATCH,
                "Academic does not hold chair " + chairId);
        entity.raise((eventId, at, v) -> new AcademicEvent.ChairRemoved(eventId, at, v, id(), chairId));
    }

    public void addSubject(UUID subjectId) {
        requireId(subjectId, "Subject id");
        requireNotDeleted(this);
        require(!subjectIds.contains(subjectId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic already teaches subject " + subjectId);
        entity.raise((eventId, at, v) -> new AcademicEvent.SubjectAdded(eventId, at, v, id(), subjectId));
    }

    public void removeSubject(UUID subjectId) {
        requireId(subjectId, "Subject id");
        requireNotDeleted(this);
        require(subjectIds.contains(subjectId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Academic does not teach subject " + subjectId);
        entity.raise((eventId, at, v) -> new AcademicEvent.SubjectRemoved(eventId, at, v, id(), subjectId));
    }

    public void addDegree(UUID degreeId) {
        requireId(degreeId, "Degree id");
        requireNotDeleted(this);
        require(!degreeIds.contains(degreeId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic already holds degree " + degreeId);
        entity.raise((eventId, at, v) -> new AcademicEvent.DegreeAdded(eventId, at, v, id(), degreeId));
    }

    /** Records that this academic audits the teaching of {@code auditeeId}. */
    public void addAuditee(UUID auditeeId) {
        requireId(auditeeId, "Auditee id");
        requireNotDeleted(this);
        require(!auditeeId.equals(id()),
                BusinessRule.AUDIT_ANTI_SYMMETRY,
                "An academic cannot audit their own teaching");
        require(!auditeeIds.contains(auditeeId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic already audits " + auditeeId);
        entity.raise((eventId, at, v) -> new AcademicEvent.AuditeeAdded(eventId, at, v, id(), auditeeId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new AcademicEvent.Deleted(eventId, at, v, id()));
    }

    // ---- event application ----

    private void apply(AcademicEvent event) {
        switch (event.eventType()) {
            case ACADEMIC_CREATED -> {
                var e = (AcademicEvent.Created) event;
                empNr = e.empNr();
                empName = e.empName();
                rank = e.rank();
            }
            case ACADEMIC_RANK_CHANGED -> rank = ((AcademicEvent.RankChanged) event).newRank();
            case ACADEMIC_ASSIGNED_TO_DEPARTMENT ->
                    departmentId = ((AcademicEvent.AssignedToDepartment) event).departmentId();
            case ACADEMIC_ASSIGNED_TO_ROOM -> roomId = ((AcademicEvent.AssignedToRoom) event).roomId();
            case ACADEMIC_REMOVED_FROM_ROOM -> roomId = null;
            case ACADEMIC_TENURED -> tenured = true;
            case ACADEMIC_CONTRACT_END_DATE_SET ->
                    contractEndDate = ((AcademicEvent.ContractEndDateSet) event).contractEndDate();
            case ACADEMIC_HOME_PHONE_SET -> homePhone = ((AcademicEvent.HomePhoneSet) event).homePhone();
            case ACADEMIC_EXTENSION_ASSIGNED ->
                    extensionId = ((AcademicEvent.ExtensionAssigned) event).extensionId();
            case ACADEMIC_CHAIR_ASSIGNED -> chairId = ((AcademicEvent.ChairAssigned) event).chairId();
            case ACADEMIC_CHAIR_REMOVED -> chairId = null;
            case ACADEMIC_SUBJECT_ADDED -> subjectIds.add(((AcademicEvent.SubjectAdded) event).subjectId());
            case ACADEMIC_SUBJECT_REMOVED ->
                    subjectIds.remove(((AcademicEvent.SubjectRemoved) event).subjectId());
            case ACADEMIC_DEGREE_ADDED -> degreeIds.add(((AcademicEvent.DegreeAdded) event).degreeId());
            case ACADEMIC_AUDITEE_ADDED -> auditeeIds.add(((AcademicEvent.AuditeeAdded) event).auditeeId());
            case ACADEMIC_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not an academic event: " + event.eventType());
        }
    }

    // ---- state ----

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.ACADEMIC;
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
    public List<AcademicEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public EmpNr empNr() {
        return empNr;
    }

    public EmpName empName() {
        return empName;
    }

    public Rank rank() {
        return rank;
    }

    public boolean isTenured() {
        return tenured;
    }

    public Optional<LocalDate> contractEndDate() {
        return Optional.ofNullable(contractEndDate);
    }

    public Optional<PhoneNr> homePhone() {
        return Optional.ofNullable(homePhone);
    }

    public Optional<UUID> departmentId() {
        return Optional.ofNullable(departmentId);
    }

    public Optional<UUID> roomId() {
        return Optional.ofNullable(roomId);
    }

    public Optional<UUID> extensionId() {
        return Optional.ofNullable(extensionId);
    }

    public Optional<UUID> chairId() {
        return Optional.ofNullable(chairId);
    }

    public Set<UUID> subjectIds() {
        return Collections.unmodifiableSet(subjectIds);
    }

    public Set<UUID> degreeIds() {
        return Collections.unmodifiableSet(degreeIds);
    }

    public Set<UUID> auditeeIds() {
        return Collections.unmodifiableSet(auditeeIds);
    }

    public boolean isProfessor() {
        return rank.isProfessor();
    }

    /** A teacher is an academic who teaches at least one subject. */
    public boolean isTeacher() {
        return !subjectIds.isEmpty();
    }

    public boolean isTeachingProfessor() {
        return isProfessor() && isTeacher();
    }

    public AccessLevel ensuredAccessLevel() {
        return rank.ensuredAccessLevel();
    }
}
