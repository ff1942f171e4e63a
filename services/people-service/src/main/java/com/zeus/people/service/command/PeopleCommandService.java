package com.zeus.people.service.command;

import com.zeus.people.domain.BusinessRuleViolationException;
import com.zeus.people.domain.ValidationException;
import com.zeus.people.domain.aggregate.Academic;
import com.zeus.people.domain.aggregate.Building;
import com.zeus.people.domain.aggregate.Chair;
import com.zeus.people.domain.aggregate.Committee;
import com.zeus.people.domain.aggregate.Degree;
import com.zeus.people.domain.aggregate.Department;
import com.zeus.people.domain.aggregate.Extension;
import com.zeus.people.domain.aggregate.Room;
import com.zeus.people.domain.aggregate.Subject;
import com.zeus.people.domain.aggregate.University;
import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.rules.AcademicRules;
import com.zeus.people.domain.rules.AuditPair;
import com.zeus.people.domain.rules.RuleResult;
import com.zeus.people.domain.valueobject.BldgName;
import com.zeus.people.domain.valueobject.BldgNr;
import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.ExtNr;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;
import com.zeus.people.domain.valueobject.Rating;
import com.zeus.people.domain.valueobject.RoomNr;
import com.zeus.people.service.projection.AggregateProjection;
import com.zeus.people.service.repository.ErrorKind;
import com.zeus.people.service.repository.PeopleRepositories;
import com.zeus.people.service.repository.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Commands that touch more than one aggregate or need a cross-aggregate rule.
 *
 * <p>Each command loads what it needs, checks the rule against the repositories and the catch-up
 * projections, then appends aggregate by aggregate. There is no transaction across aggregates:
 * when a later append fails, earlier ones stay, except for chair assignment which compensates.
 */
public class PeopleCommandService {

    private static final Logger log = LoggerFactory.getLogger(PeopleCommandService.class);

    private final PeopleRepositories repositories;
    private final AggregateProjection<Academic, AcademicEvent> academics;
    private final AggregateProjection<Chair, ChairEvent> chairs;
    private final AggregateProjection<Room, RoomEvent> rooms;
    private final AcademicRules rules;
    private final Clock clock;

    public PeopleCommandService(
            PeopleRepositories repositories,
            AggregateProjection<Academic, AcademicEvent> academics,
            AggregateProjection<Chair, ChairEvent> chairs,
            AggregateProjection<Room, RoomEvent> rooms,
            AcademicRules rules,
            Clock clock) {
        this.repositories = repositories;
        this.academics = academics;
        this.chairs = chairs;
        this.rooms = rooms;
        this.rules = rules;
        this.clock = clock;
    }

    // ---- registration ----

    public Result<UUID> registerAcademic(String empNr, String empName, String rank) {
        return build(() -> Academic.create(EmpNr.of(empNr), EmpName.of(empName), Rank.of(rank), clock))
                .flatMap(repositories.academics()::add);
    }

    public Result<UUID> registerDepartment(String name) {
        return build(() -> Department.create(name, clock)).flatMap(repositories.departments()::add);
    }

    public Result<UUID> registerBuilding(String bldgNr, String bldgName) {
        return build(() -> Building.create(BldgNr.of(bldgNr), BldgName.of(bldgName), clock))
                .flatMap(repositories.buildings()::add);
    }

    public Result<UUID> registerChair(String name) {
        return build(() -> Chair.create(name, clock)).flatMap(repositories.chairs()::add);
    }

    public Result<UUID> registerCommittee(String name) {
        return build(() -> Committee.create(name, clock)).flatMap(repositories.committees()::add);
    }

    public Result<UUID> registerSubject(String code) {
        return build(() -> Subject.create(code, clock)).flatMap(repositories.subjects()::add);
    }

    public Result<UUID> registerExtension(String extNr) {
        return build(() -> Extension.create(ExtNr.of(extNr), clock)).flatMap(repositories.extensions()::add);
    }

    /** Creates a room in a building; its number must be unused there. */
    public Result<UUID> createRoom(UUID buildingId, String roomNr) {
        Result<Building> building = repositories.buildings().load(buildingId);
        if (building instanceof Result.Failure<Building> failure) {
            return failure.retype();
        }
        Result<Room> candidate = build(() -> Room.create(RoomNr.of(roomNr), buildingId, clock));
        if (candidate instanceof Result.Failure<Room> failure) {
            return failure.retype();
        }
        Room room = candidate.value();
        rooms.refresh();
        Result<Void> unique = check(rules.roomUniqueness(room, rooms.all()));
        if (unique instanceof Result.Failure<Void> failure) {
            return failure.retype();
        }
        return repositories.rooms().add(room)
                .flatMap(roomId -> repositories.buildings()
                        .execute(buildingId, b -> b.addRoom(roomId))
                        .map(b -> roomId));
    }

    // ---- academic placement ----

    /**
     * Moves an academic into a department. Their name must be unique among the department's
     * academics.
     */
    public Result<Void> assignToDepartment(UUID academicId, UUID departmentId) {
        Result<Department> department = repositories.departments().load(departmentId);
        if (department instanceof Result.Failure<Department> failure) {
            return failure.retype();
        }
        Result<Academic> current = repositories.academics().load(academicId);
        if (current instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        Optional<UUID> previous = current.value().departmentId();

        academics.refresh();
        Result<Academic> moved = repositories.academics().execute(academicId, academic -> {
            rules.uniqueNameInDepartment(academic, departmentId, academics.all()).orThrow();
            academic.assignToDepartment(departmentId);
        });
        if (moved instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        if (previous.isPresent()) {
            Result<Department> left = repositories.departments()
                    .execute(previous.get(), d -> d.removeAcademic(academicId));
            if (!left.isSuccess()) {
                log.warn("Academic {} moved to department {} but could not leave {}: {}",
                        academicId, departmentId, previous.get(), left);
            }
        }
        return repositories.departments().execute(departmentId, d -> d.addAcademic(academicId)).map(d -> null);
    }

    /** Makes a professor who works for the department its head. */
    public Result<Void> assignDepartmentHead(UUID departmentId, UUID professorId, String headHomePhone) {
        Result<Academic> professor = repositories.academics().load(professorId);
        if (professor instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        return repositories.departments().execute(departmentId, department -> {
            rules.departmentHeadEligibility(professor.value(), department).orThrow();
            department.assignHead(professorId, PhoneNr.of(headHomePhone));
        }).map(d -> null);
    }

    public Result<Void> assignToRoom(UUID academicId, UUID roomId) {
        Result<Room> room = repositories.rooms().load(roomId);
        if (room instanceof Result.Failure<Room> failure) {
            return failure.retype();
        }
        return repositories.academics().execute(academicId, a -> a.assignToRoom(roomId))
                .flatMap(a -> repositories.rooms().execute(roomId, r -> r.addOccupant(academicId)))
                .map(r -> null);
    }

    public Result<Void> changeRank(UUID academicId, String rank) {
        return repositories.academics().execute(academicId, a -> a.changeRank(Rank.of(rank))).map(a -> null);
    }

    // ---- chairs ----

    /**
     * Gives a chair to a professor who holds no other chair. The chair is written first, so its
     * holder claim decides between racing assignments; if the professor cannot then be updated,
     * the chair is released again.
     */
    public Result<Void> assignChair(UUID chairId, UUID professorId) {
        Result<Academic> professor = repositories.academics().load(professorId);
        if (professor instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        Result<Chair> chair = repositories.chairs().load(chairId);
        if (chair instanceof Result.Failure<Chair> failure) {
            return failure.retype();
        }
        chairs.refresh();
        Result<Void> eligible = check(rules.chairCardinality(professor.value(), chair.value(), chairs.all()));
        if (eligible instanceof Result.Failure<Void> failure) {
            return failure.retype();
        }

        Result<Chair> held = repositories.chairs().execute(chairId, c -> c.assignToProfessor(professorId));
        if (held instanceof Result.Failure<Chair> failure) {
            return failure.retype();
        }
        Result<Academic> assigned = repositories.academics().execute(professorId, p -> {
            rules.chairCardinality(p, held.value(), List.of()).orThrow();
            p.assignChair(chairId);
        });
        if (assigned instanceof Result.Failure<Academic> failure) {
            log.warn("Releasing chair {} again: professor {} could not take it: {}",
                    chairId, professorId, failure.message());
            Result<Chair> released = repositories.chairs().execute(chairId, c -> c.releaseProfessor(professorId));
            if (!released.isSuccess()) {
                log.error("Chair {} remains assigned to {} without a matching academic: {}",
                        chairId, professorId, released);
            }
            return failure.retype();
        }
        return Result.done();
    }

    public Result<Void> releaseChair(UUID chairId, UUID professorId) {
        return repositories.academics().execute(professorId, p -> p.removeChair(chairId))
                .flatMap(p -> repositories.chairs().execute(chairId, c -> c.releaseProfessor(professorId)))
                .map(c -> null);
    }

    // ---- teaching ----

    public Result<Void> assignTeaching(UUID academicId, UUID subjectId) {
        Result<Academic> academic = repositories.academics().load(academicId);
        if (academic instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        return repositories.subjects().execute(subjectId, s -> s.addTeacher(academicId))
                .flatMap(s -> repositories.academics().execute(academicId, a -> a.addSubject(subjectId)))
                .map(a -> null);
    }

    public Result<Void> rateTeaching(UUID subjectId, UUID academicId, int rating) {
        return repositories.subjects().execute(subjectId, s -> s.rateTeaching(academicId, Rating.of(rating)))
                .map(s -> null);
    }

    // ---- qualifications ----

    public Result<UUID> registerDegree(String code) {
        return build(() -> Degree.create(code, clock)).flatMap(repositories.degrees()::add);
    }

    public Result<UUID> registerUniversity(String code) {
        return build(() -> University.create(code, clock)).flatMap(repositories.universities()::add);
    }

    /** Records that the university awards the degree. */
    public Result<Void> offerDegree(UUID universityId, UUID degreeId) {
        Result<Degree> degree = repositories.degrees().load(degreeId);
        if (degree instanceof Result.Failure<Degree> failure) {
            return failure.retype();
        }
        return repositories.universities().execute(universityId, u -> u.addDegree(degreeId)).map(u -> (Void) null);
    }

    /**
     * Records that the academic obtained the degree from the university. The degree's stream is
     * written first and decides the one-university rule; the obtainment is removed again if the
     * academic cannot take the degree.
     */
    public Result<Void> recordDegreeObtained(UUID academicId, UUID degreeId, UUID universityId) {
        Result<Academic> academic = repositories.academics().load(academicId);
        if (academic instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        Result<University> university = repositories.universities().load(universityId);
        if (university instanceof Result.Failure<University> failure) {
            return failure.retype();
        }

        Result<Degree> obtained = repositories.degrees().execute(degreeId, d -> d.addObtainment(academicId, universityId));
        if (obtained instanceof Result.Failure<Degree> failure) {
            return failure.retype();
        }
        Result<Academic> holder = repositories.academics().execute(academicId, a -> a.addDegree(degreeId));
        if (holder instanceof Result.Failure<Academic> failure) {
            log.warn("Removing obtainment of degree {} again: academic {} could not take it: {}",
                    degreeId, academicId, failure.message());
            Result<Degree> removed = repositories.degrees().execute(degreeId, d -> d.removeObtainment(academicId));
            if (!removed.isSuccess()) {
                log.error("Degree {} records academic {} without a matching academic: {}",
                        degreeId, academicId, removed);
            }
            return failure.retype();
        }
        return Result.done();
    }

    /** Records that {@code auditorId} audits {@code auditeeId}; never both ways round. */
    public Result<Void> recordAudit(UUID auditorId, UUID auditeeId) {
        Result<Academic> auditee = repositories.academics().load(auditeeId);
        if (auditee instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        academics.refresh();
        Set<AuditPair> pairs = auditPairs(academics.all());
        pairs.addAll(auditPairs(List.of(auditee.value())));
        return repositories.academics().execute(auditorId, auditor -> {
            rules.auditRelation(auditor, auditee.value(), pairs).orThrow();
            auditor.addAuditee(auditeeId);
        }).map(a -> null);
    }

    // ---- committees ----

    /** Only a professor who teaches may join a committee. */
    public Result<Void> addCommitteeMember(UUID committeeId, UUID professorId) {
        Result<Academic> professor = repositories.academics().load(professorId);
        if (professor instanceof Result.Failure<Academic> failure) {
            return failure.retype();
        }
        return repositories.committees().execute(committeeId, committee -> {
            rules.committeeEligibility(professor.value(), committee).orThrow();
            committee.addMember(professorId);
        }).map(c -> null);
    }

    private static Set<AuditPair> auditPairs(Collection<Academic> academics) {
        Set<AuditPair> pairs = new HashSet<>();
        for (Academic academic : academics) {
            for (UUID auditee : academic.auditeeIds()) {
                pairs.add(new AuditPair(academic.id(), auditee));
            }
        }
        return pairs;
    }

    private static <T> Result<T> build(Supplier<T> factory) {
        try {
            return Result.success(factory.get());
        } catch (ValidationException e) {
            return Result.failure(ErrorKind.VALIDATION, e.getMessage());
        } catch (BusinessRuleViolationException e) {
            return Result.ruleViolation(e.rule(), e.getMessage());
        }
    }

    private static Result<Void> check(RuleResult rule) {
        if (rule instanceof RuleResult.Violated violated) {
            log.warn("Rejected by {}: {}", violated.rule(), violated.message());
            return Result.ruleViolation(violated.rule(), violated.message());
        }
        return Result.done();
    }
}
