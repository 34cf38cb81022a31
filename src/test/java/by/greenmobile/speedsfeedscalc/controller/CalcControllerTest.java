package by.greenmobile.speedsfeedscalc.controller;

import by.greenmobile.speedsfeedscalc.entity.CalculationRequest;
import by.greenmobile.speedsfeedscalc.entity.CalculationResult;
import by.greenmobile.speedsfeedscalc.service.CalculationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.model;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

@SpringBootTest
@AutoConfigureMockMvc
class CalcControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CalculationService calculationService;

    /** Form post of a 6 mm aluminum cut; {@code overrides} are name/value pairs replacing fields. */
    private static MockHttpServletRequestBuilder form(String path, String... overrides) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("unitSystem", "METRIC");
        fields.put("diameter", "6");
        fields.put("fluteNum", "3");
        fields.put("doc", "6");
        fields.put("woc", "1.2");
        fields.put("materialKey", "aluminum-6061");
        fields.put("rigidityLevel", "prosumer");
        fields.put("hsmEnabled", "true");
        fields.put("chipThinningEnabled", "true");
        fields.put("spindlePowerKw", "2.2");
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            fields.put(overrides[i], overrides[i + 1]);
        }

        MockHttpServletRequestBuilder builder = post(path).contentType(MediaType.APPLICATION_FORM_URLENCODED);
        fields.forEach(builder::param);
        return builder;
    }

    @Test
    void indexShowsDefaultsAndTables() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attributeExists("form", "materials", "rigidityLevels", "coatings"))
                .andExpect(content().string(containsString("Aluminum 6061-T6")));
    }

    @Test
    void calculateRendersResultAndKeepsItInSession() throws Exception {
        MockHttpSession session = new MockHttpSession();

        mockMvc.perform(form("/calculate").session(session))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attributeExists("result"))
                .andExpect(content().string(containsString("RPM")));

        assertThat(session.getAttribute(CalcController.SESSION_LAST_RESULT)).isInstanceOf(CalculationResult.class);

        mockMvc.perform(get("/result").session(session))
                .andExpect(status().isOk())
                .andExpect(model().attributeExists("result"));
    }

    @Test
    void invalidInputGoesBackToForm() throws Exception {
        mockMvc.perform(form("/calculate", "diameter", "0"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attribute("error", containsString("diameter")));
    }

    @Test
    void resultWithoutCalculation() throws Exception {
        mockMvc.perform(get("/result"))
                .andExpect(status().isOk())
                .andExpect(model().attributeExists("error"))
                .andExpect(model().attributeDoesNotExist("result"));
    }

    @Test
    void exportPdfFromSession() throws Exception {
        CalculationResult result = calculationService.calculate(CalculationRequest.builder()
                .diameter(6.0).fluteNum(3).doc(6.0).woc(1.2)
                .materialKey("aluminum-6061").rigidityLevel("prosumer")
                .build());
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(CalcController.SESSION_LAST_RESULT, result);

        byte[] pdf = mockMvc.perform(get("/export/pdf").session(session))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", containsString("speeds_feeds_")))
                .andReturn().getResponse().getContentAsByteArray();

        assertThat(new String(pdf, 0, 4)).isEqualTo("%PDF");
    }

    @Test
    void exportWithoutResultIsNotFound() throws Exception {
        mockMvc.perform(get("/export/pdf"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reportPdfFromForm() throws Exception {
        mockMvc.perform(form("/report/pdf"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF));

        mockMvc.perform(form("/report/pdf", "woc", "7"))
                .andExpect(status().isBadRequest());
    }
}
