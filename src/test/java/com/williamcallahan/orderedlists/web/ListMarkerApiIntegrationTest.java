package com.williamcallahan.orderedlists.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs edits through the full application context, feeding each result into the next request.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ListMarkerApiIntegrationTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Autowired
    MockMvc mvc;

    @Test
    void typing_session_keeps_markers_in_sequence() throws Exception {
        List<String> lines = List.of("Shopping:", "a. apples", "b. pears");

        lines = edit("/api/lists/continue", Map.of("lines", lines, "line", 1));
        assertEquals(List.of("Shopping:", "a. apples", "b. ", "c. pears"), lines);

        lines = edit("/api/lists/indent", Map.of("lines", lines, "line", 2));
        assertEquals(List.of("Shopping:", "a. apples", "\ta. ", "b. pears"), lines);

        lines = edit("/api/lists/edit", Map.of("lines", lines, "line", 2, "content", "green"));
        assertEquals(List.of("Shopping:", "a. apples", "\ta. green", "b. pears"), lines);

        lines = edit("/api/lists/remove", Map.of("lines", lines, "line", 2));
        assertEquals(List.of("Shopping:", "a. apples", "b. pears"), lines);
    }

    @Test
    void parse_uses_configured_defaults() throws Exception {
        String payload = JSON.writeValueAsString(Map.of("lines", List.of("i. x", "ii. y", "\ta. z")));

        mvc.perform(post("/api/lists/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lists", hasSize(1)))
                .andExpect(jsonPath("$.lists[0].lines[*].type", contains("ROMAN", "ROMAN", "ALPHABETICAL")))
                .andExpect(jsonPath("$.lists[0].lines[*].value", contains(1, 2, 1)));
    }

    private List<String> edit(String path, Map<String, Object> request) throws Exception {
        String response = mvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(JSON.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("applied")))
                .andReturn().getResponse().getContentAsString();
        List<String> lines = new ArrayList<>();
        for (JsonNode line : JSON.readTree(response).get("lines")) {
            lines.add(line.asText());
        }
        return lines;
    }
}
