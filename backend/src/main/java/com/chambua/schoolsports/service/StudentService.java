package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.StudentRequest;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.ConflictException;
import com.chambua.schoolsports.exception.DuplicateKeys;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.StudentRepository;
import com.chambua.schoolsports.util.AgeCalculator;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class StudentService {
    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    static final String PRN_TAKEN = "PRN/UID already exists";

    private final StudentRepository studentRepository;
    private final ManagerRepository managerRepository;
    private final Clock clock;

    public StudentService(StudentRepository studentRepository, ManagerRepository managerRepository, Clock clock) {
        this.studentRepository = studentRepository;
        this.managerRepository = managerRepository;
        this.clock = clock;
    }

    public List<Student> list(Long managerId) {
        if (managerId != null) return studentRepository.findByManagerIdOrderByCreatedAtDescIdDesc(managerId);
        return studentRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    public Student get(Long id) {
        return studentRepository.findById(id).orElseThrow(NotFoundException::student);
    }

    public Student getByPrn(String prnUid) {
        return studentRepository.findByPrnUid(FieldNormalizer.trim(prnUid)).orElseThrow(NotFoundException::student);
    }

    @Transactional
    public Student create(StudentRequest req) {
        if (FieldNormalizer.anyBlank(req.getName(), req.getPrnUid(), req.getContact(), req.getBirthDate())
                || req.getManagerId() == null) {
            throw new BadRequestException("Name, PRN/UID, Contact, Birth Date, and Manager ID are required");
        }
        return register(req, req.getManagerId(), null);
    }

    /**
     * Inserts a student under {@code managerId}. Shared by the manager-facing create and the public
     * link submission, which passes the token the student registered through.
     */
    @Transactional
    public Student register(StudentRequest req, Long managerId, String linkToken) {
        LocalDate birthDate = parseBirthDate(req.getBirthDate());
        if (!managerRepository.existsById(managerId)) throw NotFoundException.manager();
        String prn = req.getPrnUid().trim();
        if (studentRepository.existsByPrnUid(prn)) throw new ConflictException(PRN_TAKEN);

        Student s = new Student();
        s.setManagerId(managerId);
        s.setLinkToken(linkToken);
        apply(s, req, prn, birthDate);
        Student saved = persist(s);
        log.info("Registered student {} under manager {}{}", saved.getId(), managerId,
                linkToken != null ? " via link" : "");
        return saved;
    }

    @Transactional
    public Student update(Long id, StudentRequest req) {
        if (FieldNormalizer.anyBlank(req.getName(), req.getPrnUid(), req.getContact(), req.getBirthDate())) {
            throw new BadRequestException("Name, PRN/UID, Contact, and Birth Date are required");
        }
        LocalDate birthDate = parseBirthDate(req.getBirthDate());
        Student s = get(id);
        String prn = req.getPrnUid().trim();
        if (studentRepository.existsByPrnUidAndIdNot(prn, id)) throw new ConflictException(PRN_TAKEN);
        apply(s, req, prn, birthDate);
        return persist(s);
    }

    @Transactional
    public void delete(Long id) {
        Student s = get(id);
        studentRepository.delete(s);
        studentRepository.flush();
        log.info("Deleted student {}", id);
    }

    private void apply(Student s, StudentRequest req, String prn, LocalDate birthDate) {
        s.setName(req.getName().trim());
        s.setPrnUid(prn);
        s.setContact(req.getContact().trim());
        s.setEmail(FieldNormalizer.trimToNull(req.getEmail()));
        s.setAddress(FieldNormalizer.trimToNull(req.getAddress()));
        s.setBirthDate(birthDate);
        s.setAge(AgeCalculator.ageOn(birthDate, LocalDate.now(clock)));
    }

    private static LocalDate parseBirthDate(String raw) {
        LocalDate date = FieldNormalizer.parseDate(raw);
        if (date == null) throw new BadRequestException("Invalid birth date");
        return date;
    }

    private Student persist(Student s) {
        try {
            return studentRepository.saveAndFlush(s);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.violates(e, "uk_students_prn_uid")) {
                throw new ConflictException(PRN_TAKEN, e);
            }
            throw e;
        }
    }
}
