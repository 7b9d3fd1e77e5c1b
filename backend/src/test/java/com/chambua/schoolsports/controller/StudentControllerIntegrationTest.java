package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.model.StudentSelection;
import com.chambua.schoolsports.util.AgeCalculator;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class StudentControllerIntegrationTest extends ApiIntegrationTestSupport {

    private static Map<String, Object> studentBody(Long managerId, String prn) {
        Map<String, Object> body = new HashMap<>();
        body.put("name", " Meera Joshi ");
        body.put("prn_uid", prn);
        body.put("contact", "9123456780");
        body.put("email", "  ");
        body.put("address", " Hostel B ");
        body.put("birthDate", "2003-11-20");
        body.put("managerId", managerId);
        return body;
    }

    @Test
    void createComputesAgeAndNormalizesOptionalFields() throws Exception {
        Manager m = saveManager("Coach Manager", "cm@school.edu");
        int expectedAge = AgeCalculator.ageOn(LocalDate.of(2003, 11, 20), LocalDate.now());

        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(studentBody(m.getId(), "PRN-100"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.student.name").value("Meera Joshi"))
                .andExpect(jsonPath("$.student.prn_uid").value("PRN-100"))
                .andExpect(jsonPath("$.student.email").value(nullValue()))
                .andExpect(jsonPath("$.student.address").value("Hostel B"))
                .andExpect(jsonPath("$.student.birthDate").value("2003-11-20"))
                .andExpect(jsonPath("$.student.age").value(expectedAge))
                .andExpect(jsonPath("$.student.managerId").value(m.getId()));

        mvc.perform(get("/api/students/prn/PRN-100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Meera Joshi"));
    }

    @Test
    void createValidation() throws Exception {
        Manager m = saveManager("V", "v@school.edu");

        Map<String, Object> missing = studentBody(m.getId(), "PRN-1");
        missing.remove("birthDate");
        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(missing)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Name, PRN/UID, Contact, Birth Date, and Manager ID are required"));

        Map<String, Object> badDate = studentBody(m.getId(), "PRN-1");
        badDate.put("birthDate", "20/11/2003");
        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(badDate)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid birth date"));

        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(studentBody(999_999L, "PRN-1"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Manager not found"));

        assertThat(studentRepository.count()).isZero();
    }

    @Test
    void duplicatePrnLeavesOneRow() throws Exception {
        Manager m = saveManager("D", "d@school.edu");
        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(studentBody(m.getId(), "PRN-7"))))
                .andExpect(status().isCreated());
        mvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON).content(json(studentBody(m.getId(), " PRN-7 "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PRN/UID already exists"));
        assertThat(studentRepository.count()).isEqualTo(1);
    }

    @Test
    void updateRecomputesAgeAndChecksPrnAgainstOthers() throws Exception {
        Manager m = saveManager("U", "u@school.edu");
        Student a = saveStudent(m, "A", "PRN-A");
        saveStudent(m, "B", "PRN-B");

        Map<String, Object> clash = studentBody(null, "PRN-B");
        mvc.perform(put("/api/students/" + a.getId()).contentType(MediaType.APPLICATION_JSON).content(json(clash)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PRN/UID already exists"));

        Map<String, Object> ok = studentBody(null, "PRN-A");
        ok.put("birthDate", "2010-01-01");
        int expectedAge = AgeCalculator.ageOn(LocalDate.of(2010, 1, 1), LocalDate.now());
        mvc.perform(put("/api/students/" + a.getId()).contentType(MediaType.APPLICATION_JSON).content(json(ok)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.student.age").value(expectedAge))
                .andExpect(jsonPath("$.student.managerId").value(m.getId()));

        Map<String, Object> missing = studentBody(null, "PRN-A");
        missing.put("contact", "");
        mvc.perform(put("/api/students/" + a.getId()).contentType(MediaType.APPLICATION_JSON).content(json(missing)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Name, PRN/UID, Contact, and Birth Date are required"));
    }

    @Test
    void listFiltersByManagerNewestFirst() throws Exception {
        Manager m1 = saveManager("M1", "m1@school.edu");
        Manager m2 = saveManager("M2", "m2@school.edu");
        Student first = saveStudent(m1, "First", "P1");
        Student second = saveStudent(m1, "Second", "P2");
        saveStudent(m2, "Other", "P3");

        mvc.perform(get("/api/students").param("managerId", m1.getId().toString()))
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(second.getId()))
                .andExpect(jsonPath("$[1].id").value(first.getId()));

        mvc.perform(get("/api/students"))
                .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    void deleteCascadesSelections() throws Exception {
        Manager m = saveManager("S", "s@school.edu");
        Student s = saveStudent(m, "Sel", "P-SEL");
        selectionRepository.save(new StudentSelection(s.getId(), m.getId(), true));

        mvc.perform(delete("/api/students/" + s.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Student deleted successfully"));
        assertThat(selectionRepository.count()).isZero();

        mvc.perform(get("/api/students/" + s.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Student not found"));
    }

    @Test
    void studentsWithSelectionsFlagsEachStudent() throws Exception {
        Manager m = saveManager("W", "w@school.edu");
        Student zed = saveStudent(m, "Zed", "PZ");
        saveStudent(m, "Amy", "PA");
        StudentSelection sel = selectionRepository.save(new StudentSelection(zed.getId(), m.getId(), true));

        mvc.perform(get("/api/students-with-selections").param("managerId", m.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Amy"))
                .andExpect(jsonPath("$[0].isSelected").value(false))
                .andExpect(jsonPath("$[0].selectionId").value(nullValue()))
                .andExpect(jsonPath("$[0].prn_uid").value("PA"))
                .andExpect(jsonPath("$[1].name").value("Zed"))
                .andExpect(jsonPath("$[1].isSelected").value(true))
                .andExpect(jsonPath("$[1].selectionId").value(sel.getId()));

        mvc.perform(get("/api/students-with-selections"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Manager ID is required"));
    }
}
