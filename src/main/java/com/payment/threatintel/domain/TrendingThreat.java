package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TrendingThreat {

    String receiver;
    double threatScore;
    long totalReports;
    List<String> patternFlags;
}
