package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.PublicLinkDTO;
import com.chambua.schoolsports.dto.StudentLinkSubmission;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.model.StudentLink;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.StudentLinkRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Registration links: a manager issues a token, and anyone holding an active token may register a
 * student under that manager without logging in.
 */
@Service
@Transactional(readOnly = true)
public class StudentLinkService {
    private static final Logger log = LoggerFactory.getLogger(StudentLinkService.class);

    private static final String INVALID_LINK = "Invalid or inactive link";

    private final StudentLinkRepository linkRepository;
    private final ManagerRepository managerRepository;
    private final StudentService studentService;
    private final StudentLinkTokenGenerator tokenGenerator;

    public StudentLinkService(StudentLinkRepository linkRepository, ManagerRepository managerRepository,
                              StudentService studentService, StudentLinkTokenGenerator tokenGenerator) {
        this.linkRepository = linkRepository;
        this.managerRepository = managerRepository;
        this.studentService = studentService;
        this.tokenGenerator = tokenGenerator;
    }

    public List<StudentLink> list(Long managerId) {
        if (managerId != null) return linkRepository.findByManagerIdOrderByCreatedAtDescIdDesc(managerId);
        return linkRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional
    public StudentLink issue(Long managerId) {
        if (managerId == null) throw new BadRequestException("Manager ID is required");
        if (!managerRepository.existsById(managerId)) throw NotFoundException.manager();
        StudentLink link = linkRepository.save(new StudentLink(managerId, uniqueToken()));
        log.info("[Links] Issued link {} for manager {}", link.getId(), managerId);
        return link;
    }

    /** Public view of an active link, with the owning manager's details. */
    public PublicLinkDTO resolve(String token) {
        StudentLink link = activeLink(token);
        Manager manager = managerRepository.findById(link.getManagerId())
                .orElseThrow(() -> new NotFoundException(INVALID_LINK));
        return new PublicLinkDTO(link.getId(), link.getToken(), link.isActive(), manager.getId(),
                manager.getName(), manager.getDepartment(), manager.getSport());
    }

    @Transactional
    public StudentLink setActive(Long id, Boolean active) {
        if (active == null) throw new BadRequestException("isActive (boolean) is required");
        StudentLink link = linkRepository.findById(id).orElseThrow(() -> new NotFoundException("Link not found"));
        link.setActive(active);
        StudentLink saved = linkRepository.saveAndFlush(link);
        log.info("[Links] Link {} {}", id, active ? "activated" : "deactivated");
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        StudentLink link = linkRepository.findById(id).orElseThrow(() -> new NotFoundException("Link not found"));
        linkRepository.delete(link);
        log.info("[Links] Deleted link {}", id);
    }

    @Transactional
    public Student submit(StudentLinkSubmission submission) {
        if (submission == null || FieldNormalizer.isBlank(submission.getToken())) {
            throw new BadRequestException("Token is required");
        }
        if (FieldNormalizer.anyBlank(submission.getName(), submission.getPrnUid(), submission.getContact(),
                submission.getBirthDate())) {
            throw new BadRequestException("Name, PRN/UID, Contact, and Birth Date are required");
        }
        StudentLink link = activeLink(submission.getToken());
        return studentService.register(submission, link.getManagerId(), link.getToken());
    }

    private StudentLink activeLink(String token) {
        if (FieldNormalizer.isBlank(token)) throw new NotFoundException(INVALID_LINK);
        return linkRepository.findByToken(token.trim())
                .filter(StudentLink::isActive)
                .orElseThrow(() -> new NotFoundException(INVALID_LINK));
    }

    // Redrawn until no existing link holds it
    private String uniqueToken() {
        String token = tokenGenerator.nextToken();
        while (linkRepository.existsByToken(token)) {
            log.warn("[Links] Token collision, regenerating");
            token = tokenGenerator.nextToken();
        }
        return token;
    }
}
