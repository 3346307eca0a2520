package com.assessval.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("REST API Tests")
class ValuationApiControllerTest {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("Creates a property with defaults")
        void createsProperty() throws Exception {
            String propertyId = nextId();

            mockMvc.perform(post("/api/properties")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(propertyJson(propertyId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.propertyId").value(propertyId))
                .andExpect(jsonPath("$.propertyType").value("Commercial"))
                .andExpect(jsonPath("$.status").value("active"));
        }

        @Test
        @DisplayName("Duplicate identifiers are rejected")
        void rejectsDuplicate() throws Exception {
            String propertyId = createProperty();

            mockMvc.perform(post("/api/properties")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(propertyJson(propertyId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("Missing required fields fail validation")
        void validatesBody() throws Exception {
            mockMvc.perform(post("/api/properties")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"propertyId\":\"" + nextId() + "\",\"propertyType\":\"Commercial\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        }

        @Test
        @DisplayName("Unknown property is a 404")
        void unknownProperty() throws Exception {
            mockMvc.perform(get("/api/properties/NO-SUCH-PROPERTY"))
                .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Patch records lineage readable through the ledger endpoints")
        void patchRecordsLineage() throws Exception {
            String propertyId = createProperty();

            mockMvc.perform(patch("/api/properties/" + propertyId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"changes\":{\"status\":\"exempt\"},\"userId\":21}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("exempt"));

            mockMvc.perform(get("/api/data-lineage/property/" + propertyId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].fieldName").value("status"))
                .andExpect(jsonPath("$[0].oldValue").value("active"))
                .andExpect(jsonPath("$[0].newValue").value("exempt"))
                .andExpect(jsonPath("$[0].newValueKind").value("string"))
                .andExpect(jsonPath("$[0].source").value("manual"))
                .andExpect(jsonPath("$[0].userId").value(21))
                .andExpect(jsonPath("$[0].sourceDetails.updateOperation").value("updateProperty"));

            mockMvc.perform(get("/api/data-lineage/property/" + propertyId + "/grouped"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", hasSize(1)));
        }

        @Test
        @DisplayName("Provenance shows the current value, origin and oldest-first change chain")
        void provenance() throws Exception {
            String propertyId = createProperty();

            mockMvc.perform(get("/api/data-lineage/property/" + propertyId + "/field/status/provenance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentValue").value("active"))
                .andExpect(jsonPath("$.origin.source").value("unknown"))
                .andExpect(jsonPath("$.changeChain", hasSize(0)));

            mockMvc.perform(patch("/api/properties/" + propertyId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"changes\":{\"acres\":\"2.25\"},\"source\":\"import\"}"))
                .andExpect(status().isOk());
            mockMvc.perform(patch("/api/properties/" + propertyId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"changes\":{\"acres\":3},\"userId\":8}"))
                .andExpect(status().isOk());

            mockMvc.perform(get("/api/data-lineage/property/" + propertyId + "/field/acres/provenance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentValue").value("3"))
                .andExpect(jsonPath("$.currentValueKind").value("json"))
                .andExpect(jsonPath("$.origin.source").value("import"))
                .andExpect(jsonPath("$.changeChain", hasSize(2)))
                .andExpect(jsonPath("$.changeChain[0].oldValue").value("1.5"))
                .andExpect(jsonPath("$.changeChain[0].newValue").value("2.25"))
                .andExpect(jsonPath("$.changeChain[1].newValue").value("3"))
                .andExpect(jsonPath("$.changeChain[1].userId").value(8));
        }

        @Test
        @DisplayName("Acres beyond the stored scale are a 400 and leave no lineage")
        void acresBeyondStoredScale() throws Exception {
            String propertyId = createProperty();

            mockMvc.perform(patch("/api/properties/" + propertyId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"changes\":{\"acres\":\"1.234567\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

            mockMvc.perform(get("/api/data-lineage/property/" + propertyId))
                .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("Patch with an unknown field is a 400")
        void patchUnknownField() throws Exception {
            String propertyId = createProperty();

            mockMvc.perform(patch("/api/properties/" + propertyId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"changes\":{\"ownerName\":\"X\"}}"))
                .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Valuation")
    class Valuation {

        @Test
        @DisplayName("Discovery on an unknown subject is an empty, flagged result")
        void discoveryUnknownSubject() throws Exception {
            mockMvc.perform(get("/api/properties/NO-SUCH-PROPERTY/comparables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subjectFound").value(false))
                .andExpect(jsonPath("$.candidates", hasSize(0)));
        }

        @Test
        @DisplayName("Reconciling an analysis without entries is a 422")
        void reconcileWithoutEntries() throws Exception {
            String propertyId = createProperty();
            String analysisId = "CA-" + propertyId;

            mockMvc.perform(post("/api/comparable-analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"analysisId\":\"" + analysisId + "\",\"propertyId\":\"" + propertyId
                        + "\",\"title\":\"Empty analysis\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("draft"))
                .andExpect(jsonPath("$.methodology").value("sales_comparison"))
                .andExpect(jsonPath("$.confidenceLevel").value("medium"));

            mockMvc.perform(post("/api/comparable-analyses/" + analysisId + "/reconcile"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NO_PARTICIPATING_ENTRIES"));
        }

        @Test
        @DisplayName("Finalizing without a conclusion is a conflict")
        void finalizeWithoutConclusion() throws Exception {
            String propertyId = createProperty();
            String analysisId = "CA-" + propertyId;
            mockMvc.perform(post("/api/comparable-analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"analysisId\":\"" + analysisId + "\",\"propertyId\":\"" + propertyId
                        + "\",\"title\":\"Draft\"}"))
                .andExpect(status().isCreated());

            mockMvc.perform(post("/api/comparable-analyses/" + analysisId + "/finalize")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"reviewerId\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));
        }

        @Test
        @DisplayName("Unknown analysis is a 404")
        void unknownAnalysis() throws Exception {
            mockMvc.perform(get("/api/comparable-analyses/NO-SUCH-ANALYSIS"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }
    }

    private String createProperty() throws Exception {
        String propertyId = nextId();
        mockMvc.perform(post("/api/properties")
                .contentType(MediaType.APPLICATION_JSON)
                .content(propertyJson(propertyId)))
            .andExpect(status().isCreated());
        return propertyId;
    }

    private static String nextId() {
        return "MV" + String.format("%04d", SEQUENCE.incrementAndGet());
    }

    private static String propertyJson(String propertyId) {
        return "{\"propertyId\":\"" + propertyId + "\",\"address\":\"" + propertyId + " Market St\","
            + "\"propertyType\":\"Commercial\",\"acres\":1.5}";
    }
}
