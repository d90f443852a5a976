package com.payment.threatintel.api;

import com.payment.threatintel.domain.ThreatEvent;
import com.payment.threatintel.domain.ThreatSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReceiverIntelDto {

    String receiver;
    double threatScore;
    /** Null for a payee nobody has reported. */
    ThreatSnapshot snapshot;
    List<ThreatEvent> history;
}
