package com.assessval.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "security.auth.enabled=true",
    "cors.allowed-origins=https://assessor.example.gov, http://localhost:5173,"
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("SecurityConfig Tests")
class SecurityConfigTest {

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Authorization")
    class Authorization {

        @Test
        @DisplayName("Valuation API is open without credentials")
        void apiIsOpen() throws Exception {
            mockMvc.perform(get("/api/properties"))
                .andExpect(status().isOk());
        }

        @Test
        @DisplayName("Routes outside the API need credentials")
        void otherRoutesNeedCredentials() throws Exception {
            mockMvc.perform(get("/h2-console"))
                .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("CORS")
    class Cors {

        @Test
        @DisplayName("Configured assessor origin may patch")
        void configuredOriginPreflight() throws Exception {
            mockMvc.perform(options("/api/properties/P1")
                    .header(HttpHeaders.ORIGIN, "https://assessor.example.gov")
                    .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "PATCH"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://assessor.example.gov"));
        }

        @Test
        @DisplayName("Unlisted origins are refused")
        void unlistedOriginPreflight() throws Exception {
            mockMvc.perform(options("/api/properties/P1")
                    .header(HttpHeaders.ORIGIN, "https://elsewhere.example.com")
                    .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "PATCH"))
                .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Origin list is trimmed and blanks dropped")
        void parsesOrigins() {
            assertThat(SecurityConfig.parseOrigins(" https://a.example.gov ,, http://localhost:5173 ,"))
                .containsExactly("https://a.example.gov", "http://localhost:5173");
            assertThat(SecurityConfig.parseOrigins(null)).isEmpty();
        }
    }
}
