package com.legacy.cobol.docs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legacy.cobol.docs.dto.api.ParseRequest;
import com.legacy.cobol.docs.dto.api.RepositoryAnalysisRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end requests against the full application context.
 */
@SpringBootTest
@AutoConfigureMockMvc
class CobolDocsApplicationTest {

    private static final String MAIN_PROGRAM = String.join("\n",
            "       IDENTIFICATION DIVISION.",
            "       PROGRAM-ID. ORDERS.",
            "       DATA DIVISION.",
            "       WORKING-STORAGE SECTION.",
            "       01  WS-ORDER.",
            "           05  WS-ORDER-ID   PIC 9(8).",
            "       PROCEDURE DIVISION.",
            "       MAIN-PARA.",
            "           CALL 'PRICING' USING WS-ORDER",
            "           STOP RUN.");

    private static final String SUBROUTINE = String.join("\n",
            "       IDENTIFICATION DIVISION.",
            "       PROGRAM-ID. PRICING.",
            "       DATA DIVISION.",
            "       LINKAGE SECTION.",
            "       01  LS-ORDER          PIC X(8).",
            "       PROCEDURE DIVISION USING LS-ORDER.",
            "       MAIN-PARA.",
            "           CALL 'ORDERS'",
            "           GOBACK.");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void parse_nestsDataItemsThroughWholeStack() throws Exception {
        mockMvc.perform(post("/api/cobol/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                ParseRequest.builder().source(MAIN_PROGRAM).nestDataItems(true).build())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.divisions.identification.programId").value("ORDERS"))
                .andExpect(jsonPath("$.divisions.data.workingStorageSection[0].children[0].name").value("WS-ORDER-ID"))
                .andExpect(jsonPath("$.dependencies[0].target").value("PRICING"))
                .andExpect(jsonPath("$.dependencies[0].parameters[0]").value("WS-ORDER"));
    }

    @Test
    void analyzeRepository_reportsMutualCallAsCycle() throws Exception {
        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(RepositoryAnalysisRequest.builder()
                                .sources(Map.of("orders.cbl", MAIN_PROGRAM, "pricing.cbl", SUBROUTINE))
                                .build())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.programs[0].name").value("ORDERS"))
                .andExpect(jsonPath("$.programs[1].programType").value("subroutine"))
                .andExpect(jsonPath("$.graph.cycles.length()").value(1))
                .andExpect(jsonPath("$.graph.cycles[0].nodes[0]").value("program-1"))
                .andExpect(jsonPath("$.graph.cycles[0].severity").value("medium"))
                .andExpect(jsonPath("$.graph.nodes[0].isCircular").value(true))
                .andExpect(jsonPath("$.graph.metrics.totalEdges").value(2));
    }

    @Test
    void analyzeGraph_enforcesRequestLimits() throws Exception {
        String body = """
                {
                  "programs": [
                    {"id": 1, "name": "A", "programType": "main"},
                    {"id": 2, "name": "B", "programType": "subroutine"}
                  ],
                  "dependencies": [],
                  "options": {"maxNodes": 1}
                }
                """;

        mockMvc.perform(post("/api/dependency-graph/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Graph node limit exceeded: 2 > 1"));
    }

    @Test
    void analyzeGraph_rejectsDuplicateDependencyIds() throws Exception {
        String body = """
                {
                  "programs": [
                    {"id": 1, "name": "A", "programType": "main"},
                    {"id": 2, "name": "B", "programType": "subroutine"},
                    {"id": 3, "name": "C", "programType": "subroutine"}
                  ],
                  "dependencies": [
                    {"id": 7, "fromProgramId": 1, "toProgramId": 2, "dependencyType": "call"},
                    {"id": 7, "fromProgramId": 2, "toProgramId": 3, "dependencyType": "call"}
                  ]
                }
                """;

        mockMvc.perform(post("/api/dependency-graph/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("duplicate dependency id: 7"));
    }
}
