package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.SelectionRequest;
import com.chambua.schoolsports.dto.StudentSelectionDTO;
import com.chambua.schoolsports.dto.StudentWithSelectionDTO;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.ConflictException;
import com.chambua.schoolsports.exception.DuplicateKeys;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.StudentSelection;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.StudentRepository;
import com.chambua.schoolsports.repository.StudentSelectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Calendar;
import java.util.List;
import java.util.TimeZone;

@Service
@Transactional(readOnly = true)
public class StudentSelectionService {
    private static final Logger log = LoggerFactory.getLogger(StudentSelectionService.class);

    private static final String SELECTIONS_FOR_MANAGER =
            "select ss.id, ss.student_id, ss.manager_id, ss.is_selected, ss.created_at, ss.updated_at,\n" +
            "       s.name as student_name, s.prn_uid, s.contact, s.email\n" +
            "from student_selections ss\n" +
            "join students s on s.id = ss.student_id\n" +
            "where ss.manager_id = :managerId\n" +
            "order by ss.updated_at desc, ss.id desc";

    private static final String STUDENTS_WITH_SELECTION =
            "select s.id, s.name, s.prn_uid, s.contact, s.email, s.address, s.birth_date, s.age, s.manager_id,\n" +
            "       s.link_token, s.created_at, s.updated_at,\n" +
            "       coalesce(ss.is_selected, false) as is_selected, ss.id as selection_id\n" +
            "from students s\n" +
            "left join student_selections ss on ss.student_id = s.id and ss.manager_id = :managerId\n" +
            "where s.manager_id = :managerId\n" +
            "order by s.name asc, s.id asc";

    private final StudentSelectionRepository selectionRepository;
    private final StudentRepository studentRepository;
    private final ManagerRepository managerRepository;
    private final NamedParameterJdbcTemplate jdbc;

    public StudentSelectionService(StudentSelectionRepository selectionRepository, StudentRepository studentRepository,
                                   ManagerRepository managerRepository, NamedParameterJdbcTemplate jdbc) {
        this.selectionRepository = selectionRepository;
        this.studentRepository = studentRepository;
        this.managerRepository = managerRepository;
        this.jdbc = jdbc;
    }

    public List<StudentSelectionDTO> listForManager(Long managerId) {
        requireManagerId(managerId);
        return jdbc.query(SELECTIONS_FOR_MANAGER, new MapSqlParameterSource("managerId", managerId),
                (rs, i) -> toSelectionDto(rs));
    }

    /** Every student of the manager, flagged with that manager's selection (false when never toggled). */
    public List<StudentWithSelectionDTO> studentsWithSelections(Long managerId) {
        requireManagerId(managerId);
        return jdbc.query(STUDENTS_WITH_SELECTION, new MapSqlParameterSource("managerId", managerId),
                (rs, i) -> toStudentDto(rs));
    }

    /** Upsert on (student, manager). Returns whether the student ended up selected. */
    @Transactional
    public boolean toggle(SelectionRequest req) {
        if (req == null || req.studentId() == null || req.managerId() == null || req.isSelected() == null) {
            throw new BadRequestException("Student ID, Manager ID, and isSelected (boolean) are required");
        }
        requireParties(req.studentId(), req.managerId());
        StudentSelection selection = selectionRepository.findByStudentIdAndManagerId(req.studentId(), req.managerId())
                .orElseGet(() -> new StudentSelection(req.studentId(), req.managerId(), false));
        selection.setSelected(req.isSelected());
        persist(selection);
        log.debug("Student {} {} by manager {}", req.studentId(), req.isSelected() ? "selected" : "deselected", req.managerId());
        return req.isSelected();
    }

    @Transactional
    public StudentSelection create(SelectionRequest req) {
        if (req == null || req.studentId() == null || req.managerId() == null) {
            throw new BadRequestException("Student ID and Manager ID are required");
        }
        requireParties(req.studentId(), req.managerId());
        if (selectionRepository.existsByStudentIdAndManagerId(req.studentId(), req.managerId())) {
            throw new ConflictException("Selection already exists");
        }
        boolean selected = req.isSelected() != null && req.isSelected();
        return persist(new StudentSelection(req.studentId(), req.managerId(), selected));
    }

    @Transactional
    public void delete(Long id) {
        StudentSelection selection = selectionRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Selection not found"));
        selectionRepository.delete(selection);
    }

    private static void requireManagerId(Long managerId) {
        if (managerId == null) throw new BadRequestException("Manager ID is required");
    }

    private void requireParties(Long studentId, Long managerId) {
        if (!studentRepository.existsById(studentId)) throw NotFoundException.student();
        if (!managerRepository.existsById(managerId)) throw NotFoundException.manager();
    }

    private StudentSelection persist(StudentSelection selection) {
        try {
            return selectionRepository.saveAndFlush(selection);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.violates(e, "uk_selection_student_manager")) {
                throw new ConflictException("Selection already exists", e);
            }
            throw e;
        }
    }

    private static StudentSelectionDTO toSelectionDto(ResultSet rs) throws SQLException {
        StudentSelectionDTO dto = new StudentSelectionDTO();
        dto.setId(rs.getLong("id"));
        dto.setStudentId(rs.getLong("student_id"));
        dto.setManagerId(rs.getLong("manager_id"));
        dto.setSelected(rs.getBoolean("is_selected"));
        dto.setCreatedAt(instant(rs, "created_at"));
        dto.setUpdatedAt(instant(rs, "updated_at"));
        dto.setStudentName(rs.getString("student_name"));
        dto.setPrnUid(rs.getString("prn_uid"));
        dto.setContact(rs.getString("contact"));
        dto.setEmail(rs.getString("email"));
        return dto;
    }

    private static StudentWithSelectionDTO toStudentDto(ResultSet rs) throws SQLException {
        StudentWithSelectionDTO dto = new StudentWithSelectionDTO();
        dto.setId(rs.getLong("id"));
        dto.setName(rs.getString("name"));
        dto.setPrnUid(rs.getString("prn_uid"));
        dto.setContact(rs.getString("contact"));
        dto.setEmail(rs.getString("email"));
        dto.setAddress(rs.getString("address"));
        dto.setBirthDate(rs.getObject("birth_date", LocalDate.class));
        dto.setAge(rs.getObject("age", Integer.class));
        dto.setManagerId(rs.getLong("manager_id"));
        dto.setLinkToken(rs.getString("link_token"));
        dto.setCreatedAt(instant(rs, "created_at"));
        dto.setUpdatedAt(instant(rs, "updated_at"));
        dto.setSelected(rs.getBoolean("is_selected"));
        dto.setSelectionId(rs.getObject("selection_id", Long.class));
        return dto;
    }

    // Hibernate writes instants as UTC wall-clock time (hibernate.jdbc.time_zone=UTC)
    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column, Calendar.getInstance(TimeZone.getTimeZone("UTC")));
        return ts == null ? null : ts.toInstant();
    }
}
