package com.pshcalculator.controller;

import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.service.RateTableManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.doReturn;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CalculationApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @SpyBean
    private RateTableManager rateTableManager;

    @AfterEach
    void restoreDefaults() {
        rateTableManager.resetToDefault();
    }

    private static String body(String rent, String utility, String ttp, int eligible, int ineligible,
                               int voucher, int unit) {
        return """
            {
              "household": {"headOfHouseholdName": "Maria Lopez", "voucherBedroomSize": %d, "unitBedrooms": %d},
              "financial": {"rentToOwner": %s, "utilityAllowance": %s, "totalTenantPayment": %s},
              "family": {"eligibleMembers": %d, "ineligibleMembers": %d}
            }
            """.formatted(voucher, unit, rent, utility, ttp, eligible, ineligible);
    }

    @Nested
    @DisplayName("POST /api/calculations")
    class Calculate {

        @Test
        void returnsDetermination() throws Exception {
            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("1500", "100", "300", 1, 1, 1, 1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.grossRent").value(1600.00))
                .andExpect(jsonPath("$.hapToOwner").value(1300.00))
                .andExpect(jsonPath("$.tenantRent").value(300.00))
                .andExpect(jsonPath("$.proratedHap").value(650.00))
                .andExpect(jsonPath("$.mixedFamily").value(true))
                .andExpect(jsonPath("$.exceedsFmr").value(false))
                .andExpect(jsonPath("$.rateTableEffectiveDate").value("2025-01-01"))
                .andExpect(jsonPath("$.warnings", hasSize(1)))
                .andExpect(jsonPath("$.warnings[0].severity").value("CAUTION"));
        }

        @Test
        void echoesSignOffBlock() throws Exception {
            String request = """
                {
                  "household": {"headOfHouseholdName": "Maria Lopez", "voucherBedroomSize": 3, "unitBedrooms": 3},
                  "financial": {"rentToOwner": 5000, "utilityAllowance": 0, "totalTenantPayment": 300},
                  "family": {"eligibleMembers": 1, "ineligibleMembers": 0},
                  "audit": {"haStaff": "J. Rivera", "calculationDate": "2025-03-14",
                            "supervisorName": "Dana Brooks", "supervisorDate": "2025-03-15"}
                }
                """;

            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiresSupervisorApproval").value(true))
                .andExpect(jsonPath("$.audit.haStaff").value("J. Rivera"))
                .andExpect(jsonPath("$.audit.calculationDate").value("2025-03-14"))
                .andExpect(jsonPath("$.audit.supervisorName").value("Dana Brooks"))
                .andExpect(jsonPath("$.audit.supervisorDate").value("2025-03-15"));
        }

        @Test
        void flagsFmrViolationWithoutBlockingTheResult() throws Exception {
            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("5000", "0", "300", 1, 0, 3, 3)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exceedsFmr").value(true))
                .andExpect(jsonPath("$.hapToOwner").value(4700.00))
                .andExpect(jsonPath("$.warnings[0].severity").value("BLOCKING"))
                .andExpect(jsonPath("$.warnings[0].message", containsString("Supervisor approval required")));
        }

        @Test
        void listsEveryInvalidField() throws Exception {
            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("0", "-1", "-1", 0, 0, 7, 1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors", hasSize(5)))
                .andExpect(jsonPath("$.errors[0].field").value("household.voucherBedroomSize"))
                .andExpect(jsonPath("$.errors[0].code").value("OUT_OF_RANGE"));
        }

        @Test
        void reportsRateTableProblemAsConfigError() throws Exception {
            FmrRateTable partial = new FmrRateTable(LocalDate.of(2025, 1, 1), Map.of(0, FmrRate.of(2734, 2485)));
            doReturn(partial).when(rateTableManager).current();

            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("1500", "100", "300", 1, 0, 1, 1)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFIG_ERROR"))
                .andExpect(jsonPath("$.configCode").value("MISSING_RATE"));
        }

        @Test
        void rejectsUnreadableBody() throws Exception {
            mockMvc.perform(post("/api/calculations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"financial\": {\"rentToOwner\": \"lots\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
        }
    }

    @Nested
    @DisplayName("POST /api/calculations/validate")
    class Validate {

        @Test
        void reportsValidInput() throws Exception {
            mockMvc.perform(post("/api/calculations/validate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("1500", "100", "0", 2, 0, 1, 1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.errors", hasSize(0)));
        }

        @Test
        void reportsErrorsWithoutFailingTheRequest() throws Exception {
            mockMvc.perform(post("/api/calculations/validate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body("0", "100", "300", 2, 0, 1, 1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0].field").value("financial.rentToOwner"))
                .andExpect(jsonPath("$.errors[0].code").value("INVALID_AMOUNT"));
        }
    }
}
