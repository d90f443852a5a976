package com.payment.threatintel.persistence.entity;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.persistence.converter.AgentOutputListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Append-only scam report log. Replayed by cluster rebuilds; never updated or deleted.
 */
@Entity
@Table(name = "threat_events", indexes = {
    @Index(name = "idx_threat_event_receiver", columnList = "receiver, event_time"),
    @Index(name = "idx_threat_event_time", columnList = "event_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "receiver", nullable = false)
    private String receiver;

    @Convert(converter = AgentOutputListConverter.class)
    @Column(name = "agent_outputs", length = 65535)
    private List<AgentOutput> agentOutputs;

    @Column(name = "amount", precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "event_time", nullable = false, updatable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
