package com.payment.threatintel.api;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.TransactionContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A transaction together with the agent outputs computed for it. Body of the report, match and
 * alert-evaluation endpoints.
 */
@Data
public class TransactionAnalysisDto {

    /** Payee identifier, e.g. a UPI handle. */
    @NotBlank(message = "receiver is required")
    private String receiver;

    @DecimalMin("0.00")
    private BigDecimal amount;

    private String reason;
    private String userId;

    /** Local time of the transfer, "HH:mm". */
    @Pattern(regexp = "^\\d{1,2}:\\d{2}$", message = "time must be HH:mm")
    private String time;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double geoAnomalyScore;

    @NotNull(message = "agentOutputs is required")
    @Valid
    private List<AgentOutputDto> agentOutputs;

    public TransactionContext toTransaction() {
        return TransactionContext.builder()
                .receiver(receiver.trim())
                .amount(amount)
                .reason(reason)
                .userId(userId)
                .time(time)
                .geoAnomalyScore(geoAnomalyScore)
                .build();
    }

    public List<AgentOutput> toAgentOutputs() {
        return agentOutputs.stream().map(AgentOutputDto::toDomain).collect(Collectors.toList());
    }
}
