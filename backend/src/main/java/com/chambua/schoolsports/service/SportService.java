package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.SportRequest;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.ConflictException;
import com.chambua.schoolsports.exception.DuplicateKeys;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Sport;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.SportRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class SportService {
    private static final Logger log = LoggerFactory.getLogger(SportService.class);

    private static final String NAME_TAKEN = "Sport name already exists";

    private final SportRepository sportRepository;
    private final ManagerRepository managerRepository;

    public SportService(SportRepository sportRepository, ManagerRepository managerRepository) {
        this.sportRepository = sportRepository;
        this.managerRepository = managerRepository;
    }

    public List<Sport> list() {
        return sportRepository.findAllByOrderByNameAsc();
    }

    public Sport get(Long id) {
        return sportRepository.findById(id).orElseThrow(NotFoundException::sport);
    }

    @Transactional
    public Sport create(SportRequest req) {
        String name = requireName(req);
        if (sportRepository.existsByName(name)) throw new ConflictException(NAME_TAKEN);
        Sport saved = persist(new Sport(name, FieldNormalizer.trimToNull(req.description())));
        log.info("Created sport {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public Sport update(Long id, SportRequest req) {
        String name = requireName(req);
        Sport s = get(id);
        if (sportRepository.existsByNameAndIdNot(name, id)) throw new ConflictException(NAME_TAKEN);
        s.setName(name);
        s.setDescription(FieldNormalizer.trimToNull(req.description()));
        return persist(s);
    }

    @Transactional
    public void delete(Long id) {
        Sport s = get(id);
        if (managerRepository.countBySport(s.getName()) > 0) {
            throw new ConflictException("Cannot delete sport. It is being used by managers.");
        }
        sportRepository.delete(s);
        log.info("Deleted sport {} '{}'", id, s.getName());
    }

    private static String requireName(SportRequest req) {
        if (req == null || FieldNormalizer.isBlank(req.name())) {
            throw new BadRequestException("Sport name is required");
        }
        return req.name().trim();
    }

    private Sport persist(Sport s) {
        try {
            return sportRepository.saveAndFlush(s);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.violates(e, "uk_sports_name")) {
                throw new ConflictException(NAME_TAKEN, e);
            }
            throw e;
        }
    }
}
