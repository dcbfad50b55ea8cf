package io.jobwarden.web;

import io.jobwarden.Jobwarden;
import io.jobwarden.monitor.AmountCheckRequest;
import io.jobwarden.monitor.AmountCheckResult;
import io.jobwarden.monitor.AmountChecker;
import io.jobwarden.monitor.BackgroundJobQueue;
import io.jobwarden.monitor.HealthReport;
import io.jobwarden.monitor.MonitoringTokenStore;
import io.jobwarden.monitor.SystemStatus;
import io.jobwarden.monitor.SystemStatusSource;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Monitoring endpoints for external probes (Nagios, Icinga, uptime checks).
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/v1/monitoring/health_check -- aggregated health verdict and message</li>
 *   <li>GET /api/v1/monitoring/status -- usage figures</li>
 *   <li>POST /api/v1/monitoring/token -- rotate the monitoring token</li>
 *   <li>POST /api/v1/monitoring/restart_failed_jobs -- requeue failing background jobs</li>
 *   <li>GET /api/v1/monitoring/amount_check -- records created in a trailing window vs. thresholds</li>
 * </ul>
 *
 * <p>A valid {@code token} parameter grants access to everything except token rotation; without
 * it, the caller resolved by {@link MonitoringAuthenticator} needs the monitoring capability.
 * Rotation always requires such a caller.
 */
@RestController
@RequestMapping("/api/v1/monitoring")
public class MonitoringController {
    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private final Jobwarden jobwarden;
    private final SystemStatusSource statusSource;
    private final MonitoringTokenStore tokenStore;
    private final BackgroundJobQueue jobQueue;
    private final AmountChecker amountChecker;
    private final MonitoringAuthenticator authenticator;
    private final int retryCeiling;
    private final Clock clock;

    public MonitoringController(Jobwarden jobwarden,
                                SystemStatusSource statusSource,
                                MonitoringTokenStore tokenStore,
                                BackgroundJobQueue jobQueue,
                                AmountChecker amountChecker,
                                MonitoringAuthenticator authenticator,
                                int retryCeiling,
                                Clock clock) {
        this.jobwarden = Objects.requireNonNull(jobwarden, "jobwarden must not be null");
        this.statusSource = Objects.requireNonNull(statusSource, "statusSource must not be null");
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore must not be null");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue must not be null");
        this.amountChecker = Objects.requireNonNull(amountChecker, "amountChecker must not be null");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
        this.retryCeiling = retryCeiling;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @GetMapping("/health_check")
    public ResponseEntity<Map<String, Object>> healthCheck(@RequestParam(required = false) String token,
                                                           HttpServletRequest request) {
        authorize(token, request);

        HealthReport report = jobwarden.checkHealth();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", report.healthy());
        body.put("message", report.message());
        if (!report.healthy()) {
            body.put("issues", report.issues());
            body.put("actions", report.actions());
        }
        if (!report.unknown().isEmpty()) {
            body.put("unknown", report.unknown());
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(@RequestParam(required = false) String token,
                                                      HttpServletRequest request) {
        authorize(token, request);

        SystemStatus status = statusSource.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agents", status.agents());
        body.put("last_login", iso(status.lastLogin()));
        body.put("counts", status.counts());
        Map<String, Object> lastCreated = new LinkedHashMap<>();
        status.lastCreatedAt().forEach((collection, at) -> lastCreated.put(collection, iso(at)));
        body.put("last_created_at", lastCreated);
        if (status.storageBytes() != null) {
            long kb = status.storageBytes() / 1024;
            Map<String, Object> storage = new LinkedHashMap<>();
            storage.put("kB", kb);
            storage.put("MB", kb / 1024);
            storage.put("GB", kb / 1024 / 1024);
            body.put("storage", storage);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/token")
    public ResponseEntity<Map<String, Object>> token(HttpServletRequest request) {
        MonitoringCaller caller = authenticator.authenticate(request)
                .orElseThrow(MonitoringAccessDeniedException::authenticationFailed);
        if (!caller.monitoringPermitted()) {
            throw MonitoringAccessDeniedException.notAuthorizedUser();
        }

        String token = tokenStore.rotate();
        log.info("jobwarden monitoring token rotated by={}", caller.login());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("token", token));
    }

    @PostMapping("/restart_failed_jobs")
    public ResponseEntity<Map<String, Object>> restartFailedJobs(@RequestParam(required = false) String token,
                                                                 HttpServletRequest request) {
        authorize(token, request);

        jobQueue.requeueFailing(retryCeiling);
        return ResponseEntity.ok(Map.of());
    }

    @GetMapping("/amount_check")
    public ResponseEntity<Map<String, Object>> amountCheck(@RequestParam(required = false) String token,
                                                           @RequestParam(required = false) String periode,
                                                           @RequestParam(name = "min_warning", required = false) Long minWarning,
                                                           @RequestParam(name = "min_critical", required = false) Long minCritical,
                                                           @RequestParam(name = "max_warning", required = false) Long maxWarning,
                                                           @RequestParam(name = "max_critical", required = false) Long maxCritical,
                                                           HttpServletRequest request) {
        authorize(token, request);

        AmountCheckRequest check = AmountCheckRequest.parse(periode, minWarning, minCritical, maxWarning, maxCritical);
        AmountCheckResult result = amountChecker.check(check, clock.instant());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", result.state().value());
        body.put("message", result.message());
        body.put("count", result.count());
        return ResponseEntity.ok(body);
    }

    private void authorize(String token, HttpServletRequest request) {
        if (tokenStore.matches(token)) {
            return;
        }
        Optional<MonitoringCaller> caller = authenticator.authenticate(request);
        if (caller.isEmpty()) {
            throw MonitoringAccessDeniedException.notAuthorized();
        }
        if (!caller.get().monitoringPermitted()) {
            throw MonitoringAccessDeniedException.notAuthorizedUser();
        }
    }

    private static String iso(Instant at) {
        return at == null ? null : at.toString();
    }
}
