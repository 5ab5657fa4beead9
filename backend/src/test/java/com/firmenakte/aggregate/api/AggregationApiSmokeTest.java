package com.firmenakte.aggregate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class AggregationApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void aggregateRejectsIdentityWithoutFields() throws Exception {
        mockMvc.perform(post("/api/companies/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_name\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_identity"));
    }

    @Test
    void unreachableSourcesStillProduceStoredRecord() throws Exception {
        String name = "Smoke Co " + UUID.randomUUID();
        String body = mockMvc.perform(post("/api/companies/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"companyName\":\"" + name + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.persisted").value(true))
            .andExpect(jsonPath("$.report.sources.*.status", hasSize(4)))
            .andExpect(jsonPath("$.report.sources.*.status", everyItem(is("FAILED"))))
            .andExpect(jsonPath("$.record.data_sources", hasSize(0)))
            .andReturn()
            .getResponse()
            .getContentAsString();

        JsonNode result = objectMapper.readTree(body);
        String fingerprint = result.path("report").path("fingerprint").asText();
        long runId = result.path("report").path("runId").asLong();

        mockMvc.perform(get("/api/companies/" + fingerprint))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.companyName").value(name))
            .andExpect(jsonPath("$.aggregationCount").value(1));
        mockMvc.perform(get("/api/aggregation-runs/" + runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void unknownRecordsAreNotFound() throws Exception {
        mockMvc.perform(get("/api/companies/" + "0".repeat(64)))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/aggregation-runs/987654321"))
            .andExpect(status().isNotFound());
    }

    @Test
    void sessionCanBeRefreshedAndInspected() throws Exception {
        mockMvc.perform(put("/api/sessions/linkedin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"credential_blob\":\"li_at=smoke\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(get("/api/sessions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.linkedin.present").value(true));

        mockMvc.perform(put("/api/sessions/xing")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"credential_blob\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void statusReportsDatabaseCounts() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.db_connected").value(true))
            .andExpect(jsonPath("$.counts.company_records").isNumber());
    }
}
