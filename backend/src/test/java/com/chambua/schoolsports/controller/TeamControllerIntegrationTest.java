package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Team;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TeamControllerIntegrationTest extends ApiIntegrationTestSupport {

    private static MockMultipartFile logo(String name) {
        return new MockMultipartFile("logo", name, "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'});
    }

    @Test
    void createWithLogoStoresFileAndUrl() throws Exception {
        String body = mvc.perform(multipart("/api/teams")
                        .file(logo("crest.PNG"))
                        .param("name", " Falcons ")
                        .param("department", "Electrical")
                        .param("color", "#ff0000"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.team.name").value("Falcons"))
                .andExpect(jsonPath("$.team.color").value("#ff0000"))
                .andExpect(jsonPath("$.team.logoUrl").value(startsWith("http://localhost:4002/uploads/team-logo-")))
                .andReturn().getResponse().getContentAsString();

        String url = JsonPath.read(body, "$.team.logoUrl");
        assertThat(url).endsWith(".png");
        assertThat(uploadExists(url)).isTrue();
    }

    @Test
    void requiredFieldsAndUniqueName() throws Exception {
        mvc.perform(multipart("/api/teams").param("name", "Only Name"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Team name and department are required"));

        teamRepository.save(new Team("Falcons", "Electrical"));
        long before = uploadCount("team-logo-");
        mvc.perform(multipart("/api/teams").file(logo("x.png")).param("name", "Falcons").param("department", "Civil"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Team name already exists"));
        assertThat(uploadCount("team-logo-")).isEqualTo(before);
        assertThat(teamRepository.count()).isEqualTo(1);
    }

    @Test
    void rejectedLogoTypeLeavesNoFileAndNoRow() throws Exception {
        long before = uploadCount("team-logo-");
        MockMultipartFile text = new MockMultipartFile("logo", "notes.txt", "text/plain", "hello".getBytes());

        mvc.perform(multipart("/api/teams").file(text).param("name", "Owls").param("department", "Civil"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Only image files are allowed!"));

        assertThat(teamRepository.count()).isZero();
        assertThat(uploadCount("team-logo-")).isEqualTo(before);
    }

    @Test
    void updateReplacesLogoAndRemovesTheOldFile() throws Exception {
        String created = mvc.perform(multipart("/api/teams").file(logo("a.png"))
                        .param("name", "Hawks").param("department", "IT"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        Number id = JsonPath.read(created, "$.team.id");
        String oldUrl = JsonPath.read(created, "$.team.logoUrl");

        String updated = mvc.perform(multipart(HttpMethod.PUT, "/api/teams/" + id).file(logo("b.png"))
                        .param("name", "Hawks").param("department", "IT").param("color", "blue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.team.color").value("blue"))
                .andReturn().getResponse().getContentAsString();
        String newUrl = JsonPath.read(updated, "$.team.logoUrl");

        assertThat(newUrl).isNotEqualTo(oldUrl);
        assertThat(uploadExists(newUrl)).isTrue();
        assertThat(uploadExists(oldUrl)).isFalse();

        mvc.perform(multipart(HttpMethod.PUT, "/api/teams/" + id)
                        .param("name", "Hawks").param("department", "IT").param("removeLogo", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.team.logoUrl").value(nullValue()));
        assertThat(uploadExists(newUrl)).isFalse();
    }

    @Test
    void deleteClearsManagersTeamId() throws Exception {
        Team team = teamRepository.save(new Team("Lions", "Mechanical"));
        Manager m = saveManager("Member", "member@school.edu");
        m.setTeamId(team.getId());
        managerRepository.save(m);

        mvc.perform(get("/api/teams/" + team.getId() + "/managers"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].email").value("member@school.edu"));

        mvc.perform(delete("/api/teams/" + team.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Team deleted successfully"));

        assertThat(managerRepository.findById(m.getId())).get()
                .extracting(Manager::getTeamId).isNull();
        mvc.perform(get("/api/teams/" + team.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Team not found"));
    }

    @Test
    void listIsAlphabetical() throws Exception {
        teamRepository.save(new Team("Zebras", "A"));
        teamRepository.save(new Team("Ants", "B"));
        mvc.perform(get("/api/teams"))
                .andExpect(jsonPath("$[0].name").value("Ants"))
                .andExpect(jsonPath("$[1].name").value("Zebras"));
    }
}
