package com.launchpad.integration;

import com.launchpad.dto.response.QueueStatsResponse;
import com.launchpad.entity.VerificationEntity;
import com.launchpad.exception.ResourceNotFoundException;
import com.launchpad.exception.VerificationException;
import com.launchpad.monitoring.ErrorMonitor;
import com.launchpad.security.AuthCookieService;
import com.launchpad.security.SessionTokenProvider;
import com.launchpad.service.JobBoardService;
import com.launchpad.service.VerificationService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the HTTP surface of a main process.
 *
 * Runs the full web stack (prefixing, versioning, validation, security headers,
 * CORS and dashboard authentication) through MockMvc. Services that talk to
 * RabbitMQ or Redis are mocked, so no broker is needed.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("HTTP Surface Integration Tests")
class HttpSurfaceIntegrationTest {

    private static final String VERIFICATIONS = "/api/v1/verifications";
    private static final String QUEUES = "/api/queues";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionTokenProvider sessionTokenProvider;

    @MockBean
    private VerificationService verificationService;

    @MockBean
    private JobBoardService jobBoardService;

    @MockBean
    private ErrorMonitor errorMonitor;

    @Nested
    @DisplayName("Request validation")
    class RequestValidation {

        @Test
        @DisplayName("an unknown property should be rejected with 422")
        void testUnknownProperty_Returns422() throws Exception {
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"role\":\"admin\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.status").value(422))
                    .andExpect(jsonPath("$.type", endsWith("/validation-failed")))
                    .andExpect(jsonPath("$.errors[0].property").value("role"));

            verifyNoInteractions(verificationService);
        }

        @Test
        @DisplayName("an invalid property value should be rejected with 422")
        void testInvalidProperty_Returns422() throws Exception {
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"not-an-email\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.errors[0].property").value("identifier"))
                    .andExpect(jsonPath("$.errors[0].constraints[0]").value("identifier must be a valid email address"));

            verifyNoInteractions(verificationService);
        }

        @Test
        @DisplayName("a property of the wrong type should be rejected with 422")
        void testWrongType_Returns422() throws Exception {
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":[\"user@example.com\"]}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.errors[0].property").value("identifier"));
        }

        @Test
        @DisplayName("malformed JSON should be rejected with 400")
        void testMalformedJson_Returns400() throws Exception {
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type", endsWith("/invalid-request-body")));
        }
    }

    @Nested
    @DisplayName("Verification endpoints")
    class VerificationEndpoints {

        @Test
        @DisplayName("issuing should return 202 without exposing the code")
        void testIssue_Accepted() throws Exception {
            // Arrange
            VerificationEntity issued = new VerificationEntity("user@example.com", "123456",
                    LocalDateTime.of(2024, 5, 1, 10, 10));
            issued.setId(UUID.randomUUID());
            when(verificationService.issue("user@example.com")).thenReturn(issued);

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.identifier").value("user@example.com"))
                    .andExpect(jsonPath("$.expiresAt").value("2024-05-01T10:10:00"))
                    .andExpect(jsonPath("$.pending").value(true))
                    .andExpect(jsonPath("$.value").doesNotExist());
        }

        @Test
        @DisplayName("confirming an expired code should return 410")
        void testConfirm_Expired() throws Exception {
            // Arrange
            when(verificationService.confirm("user@example.com", "123456"))
                    .thenThrow(VerificationException.expired("user@example.com"));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS + "/confirm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"value\":\"123456\"}"))
                    .andExpect(status().isGone())
                    .andExpect(jsonPath("$.type", endsWith("/verification-expired")));
        }

        @Test
        @DisplayName("confirming a wrong code should return 400")
        void testConfirm_Mismatch() throws Exception {
            // Arrange
            when(verificationService.confirm("user@example.com", "000000"))
                    .thenThrow(VerificationException.invalid("user@example.com"));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS + "/confirm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"value\":\"000000\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type", endsWith("/invalid-verification")));
        }

        @Test
        @DisplayName("issuing over the limit should return 429")
        void testIssue_RateLimited() throws Exception {
            // Arrange
            when(verificationService.issue(anyString()))
                    .thenThrow(VerificationException.rateLimited("user@example.com", Duration.ofHours(1)));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\"}"))
                    .andExpect(status().isTooManyRequests());
        }

        @Test
        @DisplayName("there should be no unauthenticated lookup of an identifier's code")
        void testLookupByIdentifier_NotExposed() throws Exception {
            mockMvc.perform(get(VERIFICATIONS + "/user@example.com"))
                    .andExpect(status().isNotFound());

            verifyNoInteractions(verificationService);
        }

        @Test
        @DisplayName("confirming after too many wrong codes should return 429")
        void testConfirm_AttemptsExceeded() throws Exception {
            // Arrange
            when(verificationService.confirm("user@example.com", "123456"))
                    .thenThrow(VerificationException.attemptsExceeded("user@example.com", Duration.ofMinutes(10)));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS + "/confirm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"value\":\"123456\"}"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.type", endsWith("/verification-attempts-exceeded")));
        }

        @Test
        @DisplayName("a 10-digit code should be rejected as invalid input")
        void testConfirm_CodeTooLong() throws Exception {
            mockMvc.perform(post(VERIFICATIONS + "/confirm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"value\":\"1234567890\"}"))
                    .andExpect(status().isUnprocessableEntity());

            verifyNoInteractions(verificationService);
        }

        @Test
        @DisplayName("versioned controllers should not answer without the version segment")
        void testUnversionedPath_NotFound() throws Exception {
            mockMvc.perform(get("/api/verifications/user@example.com"))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("Job board access")
    class JobBoardAccess {

        @Test
        @DisplayName("the dashboard should reject requests without credentials")
        void testNoCredentials_Returns401() throws Exception {
            mockMvc.perform(get(QUEUES))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, containsString("Basic")))
                    .andExpect(jsonPath("$.status").value(401));

            verifyNoInteractions(jobBoardService);
        }

        @Test
        @DisplayName("the dashboard should reject a wrong password")
        void testWrongPassword_Returns401() throws Exception {
            mockMvc.perform(get(QUEUES).with(httpBasic("operator", "wrong")))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
        }

        @Test
        @DisplayName("valid Basic credentials should open a session cookie")
        void testBasicCredentials_IssuesCookie() throws Exception {
            // Arrange
            when(jobBoardService.listQueues()).thenReturn(List.of(QueueStatsResponse.builder()
                    .name("verification.dispatch.queue")
                    .kind("dispatch")
                    .declared(true)
                    .messageCount(3)
                    .build()));

            // Act & Assert
            mockMvc.perform(get(QUEUES).with(httpBasic("operator", "board-secret")))
                    .andExpect(status().isOk())
                    .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString(AuthCookieService.JOB_BOARD_COOKIE + "=")))
                    .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")))
                    .andExpect(jsonPath("$[0].name").value("verification.dispatch.queue"))
                    .andExpect(jsonPath("$[0].messageCount").value(3));
        }

        @Test
        @DisplayName("a valid session cookie should be accepted without Basic credentials")
        void testSessionCookie_Accepted() throws Exception {
            // Arrange
            String token = sessionTokenProvider.generateToken("operator", SessionTokenProvider.JOB_BOARD_SCOPE);
            when(jobBoardService.listQueues()).thenReturn(List.of());

            // Act & Assert
            mockMvc.perform(get(QUEUES).cookie(new Cookie(AuthCookieService.JOB_BOARD_COOKIE, token)))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("a cookie issued for another scope should be rejected")
        void testForeignScopeCookie_Returns401() throws Exception {
            String token = sessionTokenProvider.generateToken("operator", "another-surface");

            mockMvc.perform(get(QUEUES).cookie(new Cookie(AuthCookieService.JOB_BOARD_COOKIE, token)))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("an unmanaged queue should return 404")
        void testUnknownQueue_Returns404() throws Exception {
            // Arrange
            when(jobBoardService.getQueue("other"))
                    .thenThrow(ResourceNotFoundException.queue("other"));

            // Act & Assert
            mockMvc.perform(get(QUEUES + "/other").with(httpBasic("operator", "board-secret")))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("Unexpected errors")
    class UnexpectedErrors {

        @Test
        @DisplayName("an unexpected failure should return 500 with the monitor's event id")
        void testUnexpectedError_ReportedToMonitor() throws Exception {
            // Arrange
            RuntimeException failure = new RuntimeException("database unavailable");
            when(verificationService.issue("user@example.com")).thenThrow(failure);
            when(errorMonitor.capture(failure)).thenReturn(Optional.of("4f1d0c3a9b8e4d2f8a6b1c0d9e8f7a6b"));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.type", endsWith("/internal-error")))
                    .andExpect(jsonPath("$.errorId").value("4f1d0c3a9b8e4d2f8a6b1c0d9e8f7a6b"))
                    .andExpect(jsonPath("$.detail", not(containsString("database unavailable"))));

            verify(errorMonitor).capture(failure);
        }

        @Test
        @DisplayName("without a monitor event id the 500 should carry a generated errorId")
        void testUnexpectedError_GeneratedErrorId() throws Exception {
            // Arrange
            when(verificationService.issue("user@example.com")).thenThrow(new RuntimeException("boom"));
            when(errorMonitor.capture(any())).thenReturn(Optional.empty());

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.errorId", startsWith("ERR-")));
        }

        @Test
        @DisplayName("a framework 4xx should keep its status and not be reported")
        void testFrameworkClientError_NotReported() throws Exception {
            mockMvc.perform(post(VERIFICATIONS)
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("user@example.com"))
                    .andExpect(status().isUnsupportedMediaType())
                    .andExpect(jsonPath("$.errorId").doesNotExist());

            verify(errorMonitor, never()).capture(any());
        }

        @Test
        @DisplayName("a rejected verification should not be reported")
        void testVerificationFailure_NotReported() throws Exception {
            // Arrange
            when(verificationService.confirm("user@example.com", "000000"))
                    .thenThrow(VerificationException.invalid("user@example.com"));

            // Act & Assert
            mockMvc.perform(post(VERIFICATIONS + "/confirm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"user@example.com\",\"value\":\"000000\"}"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(errorMonitor);
        }
    }

    @Nested
    @DisplayName("Cross-cutting HTTP behavior")
    class CrossCutting {

        @Test
        @DisplayName("health should report the process role and environment")
        void testHealth() throws Exception {
            mockMvc.perform(get("/api/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("UP"))
                    .andExpect(jsonPath("$.role").value("main"))
                    .andExpect(jsonPath("$.environment").value("test"));
        }

        @Test
        @DisplayName("responses should carry the security headers")
        void testSecurityHeaders() throws Exception {
            mockMvc.perform(get("/api/health"))
                    .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                    .andExpect(header().string("X-Frame-Options", "SAMEORIGIN"))
                    .andExpect(header().string("Content-Security-Policy", containsString("default-src 'self'")))
                    .andExpect(header().string("Cross-Origin-Opener-Policy", "same-origin"))
                    .andExpect(header().string("Cross-Origin-Resource-Policy", "same-origin"))
                    .andExpect(header().string("Strict-Transport-Security", containsString("max-age=31536000")))
                    .andExpect(header().string("Referrer-Policy", "no-referrer"))
                    .andExpect(header().string("X-XSS-Protection", "0"))
                    .andExpect(header().string("Origin-Agent-Cluster", "?1"))
                    .andExpect(header().string("X-DNS-Prefetch-Control", "off"));
        }

        @Test
        @DisplayName("a preflight from the configured origin should be allowed with credentials")
        void testCorsPreflight_AllowedOrigin() throws Exception {
            mockMvc.perform(options(VERIFICATIONS)
                            .header(HttpHeaders.ORIGIN, "http://localhost:5173")
                            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Content-Type"))
                    .andExpect(status().isOk())
                    .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:5173"))
                    .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
        }

        @Test
        @DisplayName("a preflight from any other origin should be refused")
        void testCorsPreflight_OtherOrigin() throws Exception {
            mockMvc.perform(options(VERIFICATIONS)
                            .header(HttpHeaders.ORIGIN, "https://evil.example")
                            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("API docs should be served under the API prefix")
        void testApiDocs() throws Exception {
            mockMvc.perform(get("/api/docs-json"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.info.title").value("Launchpad API"));
        }
    }
}
