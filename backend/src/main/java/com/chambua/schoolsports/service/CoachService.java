package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.CoachRequest;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Coach;
import com.chambua.schoolsports.repository.CoachRepository;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class CoachService {
    private static final Logger log = LoggerFactory.getLogger(CoachService.class);

    private final CoachRepository coachRepository;
    private final ManagerRepository managerRepository;

    public CoachService(CoachRepository coachRepository, ManagerRepository managerRepository) {
        this.coachRepository = coachRepository;
        this.managerRepository = managerRepository;
    }

    public List<Coach> list(Long managerId) {
        if (managerId != null) return coachRepository.findByManagerIdOrderByCreatedAtDescIdDesc(managerId);
        return coachRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    public Coach get(Long id) {
        return coachRepository.findById(id).orElseThrow(NotFoundException::coach);
    }

    @Transactional
    public Coach create(CoachRequest req) {
        if (FieldNormalizer.anyBlank(req.name(), req.contact()) || req.managerId() == null) {
            throw new BadRequestException("Name, Contact, and Manager ID are required");
        }
        if (!managerRepository.existsById(req.managerId())) throw NotFoundException.manager();
        Coach c = new Coach();
        c.setManagerId(req.managerId());
        apply(c, req);
        Coach saved = coachRepository.save(c);
        log.info("Created coach {} for manager {}", saved.getId(), saved.getManagerId());
        return saved;
    }

    /** The owning manager is fixed at creation; {@code managerId} in an update body is ignored. */
    @Transactional
    public Coach update(Long id, CoachRequest req) {
        if (FieldNormalizer.anyBlank(req.name(), req.contact())) {
            throw new BadRequestException("Name and Contact are required");
        }
        Coach c = get(id);
        apply(c, req);
        return coachRepository.saveAndFlush(c);
    }

    @Transactional
    public void delete(Long id) {
        coachRepository.delete(get(id));
        log.info("Deleted coach {}", id);
    }

    private static void apply(Coach c, CoachRequest req) {
        c.setName(req.name().trim());
        c.setContact(req.contact().trim());
        c.setEmail(FieldNormalizer.trimToNull(req.email()));
        c.setSpecialization(FieldNormalizer.trimToNull(req.specialization()));
    }
}
