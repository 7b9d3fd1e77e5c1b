package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.ManagerRequest;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.ConflictException;
import com.chambua.schoolsports.exception.DuplicateKeys;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.exception.UnauthorizedException;
import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.TeamRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class ManagerService {
    private static final Logger log = LoggerFactory.getLogger(ManagerService.class);

    static final String EMAIL_TAKEN = "Email already exists";

    private final ManagerRepository managerRepository;
    private final TeamRepository teamRepository;

    public ManagerService(ManagerRepository managerRepository, TeamRepository teamRepository) {
        this.managerRepository = managerRepository;
        this.teamRepository = teamRepository;
    }

    public List<Manager> list(Long teamId) {
        if (teamId != null) return managerRepository.findByTeamIdOrderByCreatedAtDescIdDesc(teamId);
        return managerRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    public long count() {
        return managerRepository.count();
    }

    public Manager get(Long id) {
        return managerRepository.findById(id).orElseThrow(NotFoundException::manager);
    }

    public Manager getByEmail(String email) {
        return managerRepository.findByEmail(FieldNormalizer.trim(email)).orElseThrow(NotFoundException::manager);
    }

    @Transactional
    public Manager create(ManagerRequest req) {
        int studentCount = validate(req);
        String email = req.getEmail().trim();
        if (managerRepository.existsByEmail(email)) {
            throw new ConflictException(EMAIL_TAKEN);
        }
        Manager m = new Manager();
        apply(m, req, studentCount);
        m.setTeamId(req.getTeamId());
        Manager saved = persist(m);
        log.info("Created manager {} ({})", saved.getId(), saved.getEmail());
        return saved;
    }

    @Transactional
    public Manager update(Long id, ManagerRequest req) {
        int studentCount = validate(req);
        Manager m = get(id);
        if (managerRepository.existsByEmailAndIdNot(req.getEmail().trim(), id)) {
            throw new ConflictException(EMAIL_TAKEN);
        }
        apply(m, req, studentCount);
        if (req.isTeamIdSet()) m.setTeamId(req.getTeamId());
        return persist(m);
    }

    /** Students, coaches, selections and links go with the manager through the foreign keys. */
    @Transactional
    public void delete(Long id) {
        Manager m = get(id);
        managerRepository.delete(m);
        managerRepository.flush();
        log.info("Deleted manager {}", id);
    }

    /**
     * The contact number doubles as the password and is matched exactly as sent. Failures never say
     * which field was wrong.
     */
    public Manager login(String email, String contact) {
        if (FieldNormalizer.anyBlank(email, contact)) {
            throw new BadRequestException("Email and contact are required");
        }
        return managerRepository.findFirstByEmailAndContact(email.trim(), contact)
                .orElseThrow(() -> new UnauthorizedException("Invalid email or contact number"));
    }

    private int validate(ManagerRequest req) {
        if (FieldNormalizer.anyBlank(req.getName(), req.getDepartment(), req.getSport(), req.getContact(),
                req.getEmail(), req.getStudentCount())) {
            throw new BadRequestException("All fields are required");
        }
        if (!FieldNormalizer.isValidEmail(req.getEmail().trim())) {
            throw new BadRequestException("Invalid email format");
        }
        Integer count = FieldNormalizer.parsePositiveInt(req.getStudentCount());
        if (count == null) {
            throw new BadRequestException("Student count must be a positive number");
        }
        if (req.getTeamId() != null && !teamRepository.existsById(req.getTeamId())) {
            throw NotFoundException.team();
        }
        return count;
    }

    private static void apply(Manager m, ManagerRequest req, int studentCount) {
        m.setName(req.getName().trim());
        m.setDepartment(req.getDepartment().trim());
        m.setSport(req.getSport().trim());
        m.setContact(req.getContact().trim());
        m.setEmail(req.getEmail().trim());
        m.setStudentCount(studentCount);
    }

    private Manager persist(Manager m) {
        try {
            return managerRepository.saveAndFlush(m);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.violates(e, "uk_managers_email")) {
                throw new ConflictException(EMAIL_TAKEN, e);
            }
            throw e;
        }
    }
}
