package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.model.StudentLink;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class StudentLinkControllerIntegrationTest extends ApiIntegrationTestSupport {

    private static Map<String, Object> submission(String token, String prn) {
        Map<String, Object> body = new HashMap<>();
        body.put("token", token);
        body.put("name", "Link Student");
        body.put("prn_uid", prn);
        body.put("contact", "9333333333");
        body.put("birthDate", "2005-02-10");
        return body;
    }

    @Test
    void issuedTokenIs64HexCharsAndResolvesPublicly() throws Exception {
        Manager m = saveManager("Issuer", "issuer@school.edu");

        String body = mvc.perform(post("/api/student-links").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("managerId", m.getId()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.link.isActive").value(true))
                .andReturn().getResponse().getContentAsString();
        String token = JsonPath.read(body, "$.link.token");
        assertThat(token).matches("[0-9a-f]{64}");

        mvc.perform(get("/api/student-links/token/" + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value(token))
                .andExpect(jsonPath("$.isActive").value(true))
                .andExpect(jsonPath("$.managerId").value(m.getId()))
                .andExpect(jsonPath("$.managerName").value("Issuer"))
                .andExpect(jsonPath("$.department").value("Computer Science"))
                .andExpect(jsonPath("$.sport").value("Football"));
    }

    @Test
    void issueRequiresExistingManager() throws Exception {
        mvc.perform(post("/api/student-links").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("managerId", 999_999))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Manager not found"));
    }

    @Test
    void submitCreatesStudentUnderLinkManager() throws Exception {
        Manager m = saveManager("Owner", "owner@school.edu");
        StudentLink link = linkRepository.save(new StudentLink(m.getId(), "b".repeat(64)));

        mvc.perform(post("/api/student-links/submit").contentType(MediaType.APPLICATION_JSON)
                        .content(json(submission(link.getToken(), "LNK-1"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.student.managerId").value(m.getId()))
                .andExpect(jsonPath("$.student.linkToken").value(link.getToken()));

        Student saved = studentRepository.findByPrnUid("LNK-1").orElseThrow();
        assertThat(saved.getAge()).isNotNull();

        mvc.perform(post("/api/student-links/submit").contentType(MediaType.APPLICATION_JSON)
                        .content(json(submission(link.getToken(), "LNK-1"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PRN/UID already exists"));
    }

    @Test
    void inactiveLinkBehavesLikeUnknown() throws Exception {
        Manager m = saveManager("Closed", "closed@school.edu");
        StudentLink link = new StudentLink(m.getId(), "c".repeat(64));
        link.setActive(false);
        linkRepository.save(link);

        mvc.perform(get("/api/student-links/token/" + link.getToken()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid or inactive link"));
        mvc.perform(get("/api/student-links/token/" + "d".repeat(64)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid or inactive link"));

        mvc.perform(post("/api/student-links/submit").contentType(MediaType.APPLICATION_JSON)
                        .content(json(submission(link.getToken(), "LNK-2"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid or inactive link"));
        assertThat(studentRepository.count()).isZero();
    }

    @Test
    void submitWithoutTokenIsBadRequest() throws Exception {
        mvc.perform(post("/api/student-links/submit").contentType(MediaType.APPLICATION_JSON)
                        .content(json(submission(null, "LNK-3"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Token is required"));
    }

    @Test
    void statusToggleAndDelete() throws Exception {
        Manager m = saveManager("Toggle", "toggle@school.edu");
        StudentLink link = linkRepository.save(new StudentLink(m.getId(), "e".repeat(64)));

        mvc.perform(patch("/api/student-links/" + link.getId() + "/status").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("isActive", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.link.isActive").value(false));
        mvc.perform(get("/api/student-links/token/" + link.getToken()))
                .andExpect(status().isNotFound());

        mvc.perform(patch("/api/student-links/" + link.getId() + "/status").contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("isActive", true))))
                .andExpect(jsonPath("$.link.isActive").value(true));
        mvc.perform(get("/api/student-links/token/" + link.getToken()))
                .andExpect(status().isOk());

        mvc.perform(get("/api/student-links").param("managerId", m.getId().toString()))
                .andExpect(jsonPath("$.length()").value(1));

        mvc.perform(delete("/api/student-links/" + link.getId()))
                .andExpect(status().isOk());
        assertThat(linkRepository.count()).isZero();
    }
}
