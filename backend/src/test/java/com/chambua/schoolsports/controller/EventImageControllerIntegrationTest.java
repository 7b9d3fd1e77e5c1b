package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.EventImage;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class EventImageControllerIntegrationTest extends ApiIntegrationTestSupport {

    private static MockMultipartFile image(String name) {
        return new MockMultipartFile("image", name, "image/jpeg", new byte[]{1, 2, 3});
    }

    private static EventImage row(String title, int order) {
        EventImage e = new EventImage();
        e.setTitle(title);
        e.setDisplayOrder(order);
        e.setImageUrl("http://localhost:4002/uploads/event-" + title + ".jpg");
        return e;
    }

    @Test
    void createStoresImageWithDefaults() throws Exception {
        String body = mvc.perform(multipart("/api/event-images").file(image("sports-day.jpg")).param("title", " Sports Day "))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventImage.title").value("Sports Day"))
                .andExpect(jsonPath("$.eventImage.displayOrder").value(0))
                .andExpect(jsonPath("$.eventImage.imageUrl").value(startsWith("http://localhost:4002/uploads/event-")))
                .andReturn().getResponse().getContentAsString();
        assertThat(uploadExists(JsonPath.read(body, "$.eventImage.imageUrl"))).isTrue();
    }

    @Test
    void validation() throws Exception {
        mvc.perform(multipart("/api/event-images").param("title", "No image"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Image file is required"));

        long before = uploadCount("event-");
        mvc.perform(multipart("/api/event-images").file(image("a.jpg")).param("displayOrder", "first"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Display order must be a number"));
        assertThat(uploadCount("event-")).isEqualTo(before);

        MockMultipartFile pdf = new MockMultipartFile("image", "a.pdf", "application/pdf", new byte[]{1});
        mvc.perform(multipart("/api/event-images").file(pdf))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Only image files are allowed!"));
        assertThat(eventImageRepository.count()).isZero();
        assertThat(uploadCount("event-")).isEqualTo(before);
    }

    @Test
    void listIsByDisplayOrderThenNewest() throws Exception {
        EventImage late = eventImageRepository.save(row("late", 5));
        EventImage olderFirst = eventImageRepository.save(row("olderFirst", 1));
        EventImage newerFirst = eventImageRepository.save(row("newerFirst", 1));

        mvc.perform(get("/api/event-images"))
                .andExpect(jsonPath("$[0].id").value(newerFirst.getId()))
                .andExpect(jsonPath("$[1].id").value(olderFirst.getId()))
                .andExpect(jsonPath("$[2].id").value(late.getId()));
    }

    @Test
    void updateAndDeleteManageTheFile() throws Exception {
        String created = mvc.perform(multipart("/api/event-images").file(image("one.jpg")).param("displayOrder", "3"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        Number id = JsonPath.read(created, "$.eventImage.id");
        String firstUrl = JsonPath.read(created, "$.eventImage.imageUrl");

        String updated = mvc.perform(multipart(HttpMethod.PUT, "/api/event-images/" + id).file(image("two.webp"))
                        .param("description", "Finals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventImage.displayOrder").value(3))
                .andExpect(jsonPath("$.eventImage.description").value("Finals"))
                .andReturn().getResponse().getContentAsString();
        String secondUrl = JsonPath.read(updated, "$.eventImage.imageUrl");
        assertThat(uploadExists(firstUrl)).isFalse();
        assertThat(uploadExists(secondUrl)).isTrue();

        mvc.perform(delete("/api/event-images/" + id))
                .andExpect(status().isOk());
        assertThat(uploadExists(secondUrl)).isFalse();
        assertThat(eventImageRepository.count()).isZero();
    }
}
