package com.chambua.schoolsports.service;

import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.ConflictException;
import com.chambua.schoolsports.exception.DuplicateKeys;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Team;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.TeamRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class TeamService {
    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private static final String NAME_TAKEN = "Team name already exists";

    private final TeamRepository teamRepository;
    private final ManagerRepository managerRepository;
    private final FileStorageService storage;

    public TeamService(TeamRepository teamRepository, ManagerRepository managerRepository, FileStorageService storage) {
        this.teamRepository = teamRepository;
        this.managerRepository = managerRepository;
        this.storage = storage;
    }

    public List<Team> list() {
        return teamRepository.findAllByOrderByNameAsc();
    }

    public Team get(Long id) {
        return teamRepository.findById(id).orElseThrow(NotFoundException::team);
    }

    public List<Manager> managersOf(Long id) {
        get(id);
        return managerRepository.findByTeamIdOrderByCreatedAtDescIdDesc(id);
    }

    @Transactional
    public Team create(String name, String department, String color, MultipartFile logo) {
        requireFields(name, department);
        String trimmedName = name.trim();
        if (teamRepository.existsByName(trimmedName)) throw new ConflictException(NAME_TAKEN);

        Team team = new Team(trimmedName, department.trim());
        team.setColor(FieldNormalizer.trimToNull(color));
        if (FileStorageService.hasContent(logo)) {
            team.setLogoUrl(storage.store(logo, UploadKind.TEAM_LOGO).url());
        }
        Team saved = persist(team);
        log.info("Created team {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * A new logo replaces the current one; {@code removeLogo} without a new file clears it. The
     * replaced file is removed once the update commits.
     */
    @Transactional
    public Team update(Long id, String name, String department, String color, MultipartFile logo, boolean removeLogo) {
        requireFields(name, department);
        Team team = get(id);
        String trimmedName = name.trim();
        if (teamRepository.existsByNameAndIdNot(trimmedName, id)) throw new ConflictException(NAME_TAKEN);

        team.setName(trimmedName);
        team.setDepartment(department.trim());
        team.setColor(FieldNormalizer.trimToNull(color));
        String previousLogo = team.getLogoUrl();
        if (FileStorageService.hasContent(logo)) {
            team.setLogoUrl(storage.store(logo, UploadKind.TEAM_LOGO).url());
            storage.deleteAfterCommit(previousLogo);
        } else if (removeLogo) {
            team.setLogoUrl(null);
            storage.deleteAfterCommit(previousLogo);
        }
        return persist(team);
    }

    /** Managers of the team keep their rows with {@code teamId} cleared by the foreign key. */
    @Transactional
    public void delete(Long id) {
        Team team = get(id);
        teamRepository.delete(team);
        teamRepository.flush();
        storage.deleteAfterCommit(team.getLogoUrl());
        log.info("Deleted team {} '{}'", id, team.getName());
    }

    private static void requireFields(String name, String department) {
        if (FieldNormalizer.anyBlank(name, department)) {
            throw new BadRequestException("Team name and department are required");
        }
    }

    private Team persist(Team team) {
        try {
            return teamRepository.saveAndFlush(team);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.violates(e, "uk_teams_name")) {
                throw new ConflictException(NAME_TAKEN, e);
            }
            throw e;
        }
    }
}
