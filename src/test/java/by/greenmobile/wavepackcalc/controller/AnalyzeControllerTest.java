package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.config.RequestIdFilter;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.exception.DomainException;
import by.greenmobile.wavepackcalc.exception.InvalidInputException;
import by.greenmobile.wavepackcalc.exception.UnknownLookupException;
import by.greenmobile.wavepackcalc.service.WavepackFacade;
import by.greenmobile.wavepackcalc.service.WavepackFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalyzeController.class)
class AnalyzeControllerTest {

    private static final String BODY = """
            {"a_in": 2, "b_in": 1, "t_in": 0.05, "L_in": 6,
             "shape": "Rectangular", "material": "Stainless Steel", "fluid": "Air",
             "vel_target_fts": 50, "dp_limit_psi": 5, "T_min_F": 32, "T_max_F": 212}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WavepackFacade wavepackFacade;

    @Test
    @DisplayName("200 with the public field names")
    void ok() throws Exception {
        // Arrange
        SolveResult golden = WavepackFixtures.facade().solve(WavepackFixtures.reference());
        given(wavepackFacade.solve(any(WavepackParameters.class))).willReturn(golden);

        // Act + Assert
        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.array_dims[0]").value(38))
                .andExpect(jsonPath("$.array_dims[1]").value(38))
                .andExpect(jsonPath("$.deltaP_psi", closeTo(0.001923345007174379, 1e-12)))
                .andExpect(jsonPath("$.fc_GHz", closeTo(6.439146013065995, 1e-9)))
                .andExpect(jsonPath("$.SE_db.length()").value(6))
                .andExpect(jsonPath("$.freqs[5]").value(1.0e10))
                .andExpect(jsonPath("$.total_weight_lbm", closeTo(776.2560843999261, 1e-6)))
                .andExpect(jsonPath("$.L_ft", closeTo(0.5, 1e-12)))
                .andExpect(jsonPath("$.temperature_sweep.length()").value(10))
                .andExpect(jsonPath("$.rows").doesNotExist());
    }

    @Test
    @DisplayName("INVALID_INPUT -> 400 with kind and field")
    void invalidInput() throws Exception {
        given(wavepackFacade.solve(any())).willThrow(new InvalidInputException("a_in", null, "Required numeric field 'a_in' is missing"));

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.field").value("a_in"));
    }

    @Test
    @DisplayName("UNKNOWN_LOOKUP -> 400")
    void unknownLookup() throws Exception {
        given(wavepackFacade.solve(any())).willThrow(new UnknownLookupException("material", "Unobtainium", "Unknown material"));

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_LOOKUP"))
                .andExpect(jsonPath("$.value").value("Unobtainium"));
    }

    @Test
    @DisplayName("DOMAIN -> 422")
    void domain() throws Exception {
        given(wavepackFacade.solve(any())).willThrow(new DomainException("vel_target_fts", 0.0, "must be positive"));

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("DOMAIN"))
                .andExpect(jsonPath("$.field").value("vel_target_fts"));
    }

    @Test
    @DisplayName("Non-numeric value -> 400 INVALID_INPUT naming the field")
    void notANumber() throws Exception {
        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content("{\"a_in\": \"wide\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.field").value("a_in"))
                .andExpect(jsonPath("$.value").value("wide"));
    }

    @Test
    @DisplayName("Unexpected failure -> 500 without internals")
    void unexpected() throws Exception {
        given(wavepackFacade.solve(any())).willThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.kind").doesNotExist());
    }

    @Test
    @DisplayName("Request id is echoed back")
    void requestId() throws Exception {
        given(wavepackFacade.solve(any())).willThrow(new DomainException("t_in", 0.0, "must be positive"));

        mockMvc.perform(post("/analyze").header(RequestIdFilter.HEADER, "abc123")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(header().string(RequestIdFilter.HEADER, "abc123"));
    }
}
