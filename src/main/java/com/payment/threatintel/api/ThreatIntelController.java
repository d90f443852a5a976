package com.payment.threatintel.api;

import com.payment.threatintel.alerting.ThreatAlert;
import com.payment.threatintel.alerting.ThreatAlertEvaluator;
import com.payment.threatintel.domain.ClusterMatch;
import com.payment.threatintel.domain.ClusterSummary;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.intel.RealTimeMatcher;
import com.payment.threatintel.intel.RebuildSummary;
import com.payment.threatintel.intel.ThreatIntelService;
import com.payment.threatintel.intel.ThreatLookupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * REST API of the threat intelligence hub: payee lookups, trending payees, scam clusters, scam reports
 * and pre-transaction checks.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/threat-intel")
@RequiredArgsConstructor
@Tag(name = "Threat Intel", description = "Crowd-sourced payee threat scores and scam campaign clusters")
public class ThreatIntelController {

    private static final int MAX_LIMIT = 100;

    private final ThreatIntelService threatIntelService;
    private final ThreatLookupService lookupService;
    private final RealTimeMatcher matcher;
    private final ThreatAlertEvaluator alertEvaluator;

    @GetMapping("/receivers/{receiver}")
    @Operation(summary = "Payee threat profile", description = "Current threat score, snapshot and most recent reports for a payee")
    public ResponseEntity<ReceiverIntelDto> getReceiver(
            @PathVariable String receiver,
            @RequestParam(defaultValue = "25") int historyLimit) {
        Optional<ThreatSnapshot> snapshot = threatIntelService.getSnapshot(receiver);
        return ResponseEntity.ok(ReceiverIntelDto.builder()
                .receiver(receiver)
                .threatScore(snapshot.map(ThreatSnapshot::getThreatScore).orElse(0.0))
                .snapshot(snapshot.orElse(null))
                .history(threatIntelService.getHistory(receiver, clamp(historyLimit)))
                .build());
    }

    @GetMapping("/global")
    @Operation(summary = "Global threat picture", description = "Trending payees (at least 5 reports) and the most severe active clusters")
    public ResponseEntity<GlobalIntelDto> getGlobal(
            @RequestParam(defaultValue = "5") int trendingLimit,
            @RequestParam(defaultValue = "5") int clusterLimit) {
        return ResponseEntity.ok(GlobalIntelDto.builder()
                .trending(threatIntelService.getTrending(clamp(trendingLimit)))
                .clusters(lookupService.getClusters(false, clamp(clusterLimit)))
                .build());
    }

    @GetMapping("/clusters")
    @Operation(summary = "List scam clusters", description = "Current clusters by average threat score; an empty list may mean a rebuild is in progress")
    public ResponseEntity<List<ClusterSummary>> getClusters(
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(lookupService.getClusters(includeInactive, clamp(limit)));
    }

    @PostMapping("/reports")
    @Operation(summary = "Report a scam", description = "Records a confirmed scam report and returns the payee's refreshed snapshot")
    public ResponseEntity<ThreatSnapshot> report(@Valid @RequestBody TransactionAnalysisDto request) {
        Optional<ThreatSnapshot> snapshot = threatIntelService.report(request.toTransaction(), request.toAgentOutputs());
        return snapshot
                .map(s -> ResponseEntity.status(HttpStatus.CREATED).body(s))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @PostMapping("/match")
    @Operation(summary = "Match against clusters", description = "Read-only check of a pending transaction against active clusters; 204 when nothing matches")
    public ResponseEntity<ClusterMatch> match(
            @Valid @RequestBody TransactionAnalysisDto request,
            @RequestParam(required = false) Double threshold) {
        if (threshold != null && (threshold < 0.0 || threshold > 1.0)) {
            throw new IllegalArgumentException("threshold must be between 0 and 1");
        }
        Optional<ClusterMatch> match = threshold != null
                ? matcher.match(request.toTransaction(), request.toAgentOutputs(), threshold)
                : matcher.match(request.toTransaction(), request.toAgentOutputs());
        return match.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/alerts/evaluate")
    @Operation(summary = "Evaluate threat alert", description = "Combines trending, cluster membership and pattern match into an alert and publishes it; 204 when there is no signal")
    public ResponseEntity<ThreatAlert> evaluateAlert(@Valid @RequestBody TransactionAnalysisDto request) {
        Optional<ThreatAlert> alert = alertEvaluator.evaluateAndPublish(request.toTransaction(), request.toAgentOutputs());
        return alert.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/clusters/rebuild")
    @Operation(summary = "Force cluster rebuild", description = "Re-clusters the recent report window now; skipped when another rebuild holds the lock")
    public ResponseEntity<RebuildSummary> rebuild() {
        RebuildSummary summary = threatIntelService.forceRebuild();
        log.info("Forced rebuild via API: status={}", summary.getStatus());
        if (summary.getStatus() == RebuildSummary.Status.FAILED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(summary);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary);
    }

    private static int clamp(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
