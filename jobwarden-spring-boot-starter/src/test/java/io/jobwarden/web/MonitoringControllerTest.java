package io.jobwarden.web;

import io.jobwarden.Jobwarden;
import io.jobwarden.monitor.AmountChecker;
import io.jobwarden.monitor.BackgroundJobQueue;
import io.jobwarden.monitor.HealthReport;
import io.jobwarden.monitor.MonitoringTokenStore;
import io.jobwarden.monitor.SystemStatus;
import io.jobwarden.monitor.SystemStatusSource;
import io.jobwarden.monitor.TransientCollaboratorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MonitoringControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-07T10:23:00Z");
    private static final String TOKEN = "valid-token";

    @Mock
    private Jobwarden jobwarden;

    @Mock
    private SystemStatusSource statusSource;

    @Mock
    private MonitoringTokenStore tokenStore;

    @Mock
    private BackgroundJobQueue jobQueue;

    private long createdInWindow = 0;

    private MockMvc mockMvc(MonitoringAuthenticator authenticator) {
        AmountChecker amountChecker = new AmountChecker((from, to) -> createdInWindow);
        MonitoringController controller = new MonitoringController(jobwarden, statusSource, tokenStore, jobQueue,
                amountChecker, authenticator, 0, Clock.fixed(NOW, ZoneOffset.UTC));
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new MonitoringExceptionHandler())
                .build();
    }

    private MockMvc anonymous() {
        return mockMvc(MonitoringAuthenticator.none());
    }

    private MockMvc as(String login, boolean monitoringPermitted) {
        return mockMvc(request -> Optional.of(new MonitoringCaller(login, monitoringPermitted)));
    }

    @Test
    @DisplayName("health_check without token or session is rejected with healthy=false")
    void healthCheckWithoutCredentials() throws Exception {
        anonymous().perform(get("/api/v1/monitoring/health_check"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.error").value("Not authorized"));
    }

    @Test
    @DisplayName("health_check with a wrong token and no session is rejected")
    void healthCheckWithWrongToken() throws Exception {
        when(tokenStore.matches("wrong")).thenReturn(false);

        anonymous().perform(get("/api/v1/monitoring/health_check").param("token", "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Not authorized"));
    }

    @Test
    @DisplayName("health_check with a valid token reports success")
    void healthCheckWithToken() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(jobwarden.checkHealth()).thenReturn(HealthReport.of(List.of(), Set.of(), List.of()));

        anonymous().perform(get("/api/v1/monitoring/health_check").param("token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true))
                .andExpect(jsonPath("$.message").value("success"))
                .andExpect(jsonPath("$.issues").doesNotExist())
                .andExpect(jsonPath("$.unknown").doesNotExist());
    }

    @Test
    @DisplayName("health_check lists issues, actions and unknown checks when unhealthy")
    void healthCheckUnhealthy() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(jobwarden.checkHealth()).thenReturn(HealthReport.of(
                List.of("unprocessable mails: 2", "13 failing background jobs"),
                Set.of(HealthReport.ACTION_RESTART_FAILED_JOBS),
                List.of("channels")));

        anonymous().perform(get("/api/v1/monitoring/health_check").param("token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.message").value("unprocessable mails: 2;13 failing background jobs"))
                .andExpect(jsonPath("$.issues.length()").value(2))
                .andExpect(jsonPath("$.actions", contains("restart_failed_jobs")))
                .andExpect(jsonPath("$.unknown", contains("channels")));
    }

    @Test
    @DisplayName("a session without the monitoring capability is rejected")
    void healthCheckWithUnprivilegedSession() throws Exception {
        as("agent1", false).perform(get("/api/v1/monitoring/health_check"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Not authorized (user)!"));
    }

    @Test
    @DisplayName("a session with the monitoring capability needs no token")
    void healthCheckWithPrivilegedSession() throws Exception {
        when(jobwarden.checkHealth()).thenReturn(HealthReport.of(List.of(), Set.of(), List.of()));

        as("admin", true).perform(get("/api/v1/monitoring/health_check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true));
    }

    @Test
    @DisplayName("token rotation requires an authenticated caller even when a valid token is sent")
    void tokenRotationRequiresCaller() throws Exception {
        anonymous().perform(post("/api/v1/monitoring/token").param("token", TOKEN))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("authentication failed"));

        verify(tokenStore, never()).rotate();
    }

    @Test
    @DisplayName("token rotation is refused for callers without the monitoring capability")
    void tokenRotationRequiresCapability() throws Exception {
        as("agent1", false).perform(post("/api/v1/monitoring/token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Not authorized (user)!"));

        verify(tokenStore, never()).rotate();
    }

    @Test
    @DisplayName("token rotation returns the new token with 201")
    void tokenRotation() throws Exception {
        when(tokenStore.rotate()).thenReturn("fresh-token");

        as("admin", true).perform(post("/api/v1/monitoring/token"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value("fresh-token"));
    }

    @Test
    @DisplayName("restart_failed_jobs requeues entries above the retry ceiling")
    void restartFailedJobs() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(jobQueue.requeueFailing(0)).thenReturn(4L);

        anonymous().perform(post("/api/v1/monitoring/restart_failed_jobs").param("token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(jobQueue).requeueFailing(0);
    }

    @Test
    @DisplayName("status reports usage figures and storage in kB, MB and GB")
    void statusReport() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(statusSource.current()).thenReturn(new SystemStatus(
                7,
                Instant.parse("2026-01-07T09:00:00Z"),
                Map.of("tickets", 120L),
                Map.of("tickets", Instant.parse("2026-01-07T10:00:00Z")),
                3L * 1024 * 1024 * 1024));

        anonymous().perform(get("/api/v1/monitoring/status").param("token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents").value(7))
                .andExpect(jsonPath("$.last_login").value("2026-01-07T09:00:00Z"))
                .andExpect(jsonPath("$.counts.tickets").value(120))
                .andExpect(jsonPath("$.last_created_at.tickets").value("2026-01-07T10:00:00Z"))
                .andExpect(jsonPath("$.storage.kB").value(3 * 1024 * 1024))
                .andExpect(jsonPath("$.storage.MB").value(3 * 1024))
                .andExpect(jsonPath("$.storage.GB").value(3));
    }

    @Test
    @DisplayName("status omits storage when the store cannot report it")
    void statusWithoutStorage() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(statusSource.current()).thenReturn(new SystemStatus(0, null, Map.of(), Map.of(), null));

        anonymous().perform(get("/api/v1/monitoring/status").param("token", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents").value(0))
                .andExpect(jsonPath("$.storage").doesNotExist());
    }

    @Test
    @DisplayName("amount_check classifies an undercut minimum as critical")
    void amountCheckCritical() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        createdInWindow = 6;

        anonymous().perform(get("/api/v1/monitoring/amount_check")
                        .param("token", TOKEN)
                        .param("periode", "1h")
                        .param("min_warning", "20")
                        .param("min_critical", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("critical"))
                .andExpect(jsonPath("$.message").value("The minimum of 10 was undercut by 6 in the last 1h"))
                .andExpect(jsonPath("$.count").value(6));
    }

    @Test
    @DisplayName("amount_check without thresholds is ok")
    void amountCheckOk() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        createdInWindow = 42;

        anonymous().perform(get("/api/v1/monitoring/amount_check").param("token", TOKEN).param("periode", "15m"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ok"))
                .andExpect(jsonPath("$.message").value(""))
                .andExpect(jsonPath("$.count").value(42));
    }

    @Test
    @DisplayName("amount_check without periode is rejected with 422")
    void amountCheckMissingPeriode() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);

        anonymous().perform(get("/api/v1/monitoring/amount_check").param("token", TOKEN))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("periode is missing!"));
    }

    @Test
    @DisplayName("amount_check with a bad unit is rejected with 422")
    void amountCheckBadUnit() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);

        anonymous().perform(get("/api/v1/monitoring/amount_check").param("token", TOKEN).param("periode", "2w"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("periode need to have s, m, h or d as last!"));
    }

    @Test
    @DisplayName("an unreachable store yields 503")
    void unavailableStore() throws Exception {
        when(tokenStore.matches(TOKEN)).thenReturn(true);
        when(statusSource.current()).thenThrow(new TransientCollaboratorException("status unavailable"));

        anonymous().perform(get("/api/v1/monitoring/status").param("token", TOKEN))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("status unavailable"));
    }
}
