package com.example.playout.template;

import com.example.playout.common.error.ErrorLogBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TemplateFillControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @BeforeEach
    void setUp() {
        errorLogBuffer.clear();
    }

    @Test
    void fill_placesContentAroundMeeting() throws Exception {
        String payload = """
            {
              "template": {
                "type": "daily",
                "items": [
                  {"title": "City council", "start_time": "5:00:00 pm", "duration_seconds": 1800, "is_fixed_time": true}
                ]
              },
              "available_content": [
                {"id": "101", "content_title": "Station ID", "file_path": "/media/id.mp4", "duration_seconds": 10, "duration_category": "id"},
                {"id": "102", "file_name": "spot.mp4", "file_duration": 30, "duration_category": "spots"}
              ],
              "rotation_order": ["id", "spots"],
              "max_iterations": 5
            }
            """;

        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.report.items_added").value(5))
            .andExpect(jsonPath("$.data.report.iteration_limit_reached").value(true))
            .andExpect(jsonPath("$.data.report.status").value("PARTIAL_FILL"))
            .andExpect(jsonPath("$.data.template.items", hasSize(6)))
            .andExpect(jsonPath("$.data.template.items[0].title").value("Station ID"))
            .andExpect(jsonPath("$.data.template.items[0].start_time").value("12:00:00.000 am"))
            .andExpect(jsonPath("$.data.template.items[1].title").value("spot.mp4"))
            .andExpect(jsonPath("$.data.template.items[5].title").value("City council"))
            .andExpect(jsonPath("$.data.template.items[5].start_offset").value(61200.0))
            .andExpect(jsonPath("$.meta.items_added").value(5));
    }

    @Test
    void fill_emptyCatalogReportsWholeOpenTime() throws Exception {
        String payload = """
            {
              "template": {"type": "daily", "items": []},
              "available_content": []
            }
            """;

        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.report.items_added").value(0))
            .andExpect(jsonPath("$.data.report.remaining_gaps", hasSize(1)))
            .andExpect(jsonPath("$.data.report.remaining_gaps[0].start").value(0.0))
            .andExpect(jsonPath("$.data.report.remaining_gaps[0].end").value(86400.0))
            .andExpect(jsonPath("$.data.report.remaining_gaps[0].end_time").value("11:59:59.999 pm"));
    }

    @Test
    void fill_malformedTimeIsBadRequest() throws Exception {
        String payload = """
            {
              "template": {
                "type": "daily",
                "items": [{"title": "Broken", "start_time": "25:99", "duration_seconds": 60, "is_fixed_time": true}]
              },
              "available_content": []
            }
            """;

        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_TIME"))
            .andExpect(jsonPath("$.details.input").value("25:99"));
    }

    @Test
    void fill_overlappingAnchorsIsConflictAndLogged() throws Exception {
        String payload = """
            {
              "template": {
                "type": "weekly",
                "items": [
                  {"title": "Morning show", "start_time": "mon 8:00:00 am", "duration_seconds": 3600, "is_fixed_time": true},
                  {"title": "Press conference", "start_time": "mon 8:30:00 am", "duration_seconds": 1800, "is_live_input": true}
                ]
              },
              "available_content": [
                {"id": "1", "title": "Spot", "duration_seconds": 30, "duration_category": "spots"}
              ]
            }
            """;

        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("OVERLAP_DETECTED"))
            .andExpect(jsonPath("$.details.offending_title").value("Press conference"));

        assertThat(errorLogBuffer.recent()).hasSize(1);
        assertThat(errorLogBuffer.recent().get(0).errorCode()).isEqualTo("OVERLAP_DETECTED");

        mockMvc.perform(get("/api/templates/fill/errors"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(1)))
            .andExpect(jsonPath("$.data[0].context").value("fill weekly"));
    }

    @Test
    void fill_missingTemplateIsValidationError() throws Exception {
        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"available_content\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.template").exists());
    }

    @Test
    void fill_unknownRotationCategoryIsBadRequest() throws Exception {
        String payload = """
            {
              "template": {"type": "daily"},
              "available_content": [],
              "rotation_order": ["promos"]
            }
            """;

        mockMvc.perform(post("/api/templates/fill")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void gaps_weeklyMeetingSplitsAtItsOffset() throws Exception {
        String payload = """
            {
              "template": {
                "type": "weekly",
                "items": [
                  {"title": "Planning board", "start_time": "wed 10:00:00 am", "duration_seconds": 3600, "is_fixed_time": true}
                ]
              }
            }
            """;

        mockMvc.perform(post("/api/templates/gaps")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.type").value("weekly"))
            .andExpect(jsonPath("$.data.gaps", hasSize(2)))
            .andExpect(jsonPath("$.data.gaps[0].end").value(295200.0))
            .andExpect(jsonPath("$.data.gaps[0].end_time").value("wed 10:00:00.000 am"))
            .andExpect(jsonPath("$.data.gaps[1].start", closeTo(298800.0334, 0.0001)));
    }

    @Test
    void gaps_twentyFourHourTemplateClosesDayAtMidnight() throws Exception {
        String payload = """
            {
              "template": {
                "type": "daily",
                "items": [
                  {"title": "City council", "start_time": "17:00:00", "duration_seconds": 1800, "is_fixed_time": true}
                ]
              }
            }
            """;

        mockMvc.perform(post("/api/templates/gaps")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.gaps", hasSize(2)))
            .andExpect(jsonPath("$.data.gaps[0].end_time").value("17:00:00.000"))
            .andExpect(jsonPath("$.data.gaps[1].start_time").value("17:30:00.033"))
            .andExpect(jsonPath("$.data.gaps[1].end_time").value("24:00:00.000"));
    }

    @Test
    void gaps_perDaySplitsMonthlyTemplate() throws Exception {
        String payload = """
            {
              "template": {"type": "monthly", "days": 30, "items": []},
              "per_day_gaps": true
            }
            """;

        mockMvc.perform(post("/api/templates/gaps")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.gaps", hasSize(30)))
            .andExpect(jsonPath("$.data.total_seconds").value(2592000.0))
            .andExpect(jsonPath("$.data.gaps[29].start_time").value("day 30 12:00:00.000 am"))
            .andExpect(jsonPath("$.data.gaps[29].end_time").value("day 30 11:59:59.999 pm"));
    }
}
