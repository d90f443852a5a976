package com.payment.threatintel.messaging;

import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.intel.ThreatIntelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Consumes confirmed scam reports and runs them through the same snapshot update and event recording
 * path as the REST report endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "threat-intel.kafka.reports.enabled", havingValue = "true", matchIfMissing = true)
public class ScamReportConsumer {

    private final ThreatIntelService threatIntelService;

    @KafkaListener(
            topics = "${threat-intel.kafka.topic.scam-reports:scam-reports}",
            groupId = "${threat-intel.kafka.consumer-group:scam-threat-intel}",
            containerFactory = "scamReportListenerContainerFactory"
    )
    public void onScamReport(
            @Payload(required = false) ScamReport report,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        try {
            if (report == null) {
                log.warn("Received null scam report (deserialization failed). Key={}, partition={}, offset={}", key, partition, offset);
                return;
            }
            if (report.getTransaction() == null || report.getTransaction().getReceiver() == null
                    || report.getTransaction().getReceiver().isBlank()) {
                log.warn("Skipping scam report without receiver: reportId={}, key={}, offset={}", report.getReportId(), key, offset);
                return;
            }
            Optional<ThreatSnapshot> snapshot = threatIntelService.report(report.getTransaction(), report.getAgentOutputs());
            log.info("Processed scam report: reportId={}, receiver={}, threatScore={}, totalReports={}",
                    report.getReportId(), report.getTransaction().getReceiver(),
                    snapshot.map(ThreatSnapshot::getThreatScore).orElse(null),
                    snapshot.map(ThreatSnapshot::getTotalReports).orElse(null));
        } catch (Exception e) {
            log.error("Error processing scam report key={} reportId={}", key, report != null ? report.getReportId() : null, e);
        }
    }
}
