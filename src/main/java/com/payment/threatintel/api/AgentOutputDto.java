package com.payment.threatintel.api;

import com.payment.threatintel.domain.AgentOutput;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * One agent's result as sent by the analysis layer.
 */
@Data
public class AgentOutputDto {

    @NotBlank(message = "agentName is required")
    private String agentName;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double riskScore;

    private String message;
    private List<String> evidence;

    public AgentOutput toDomain() {
        return AgentOutput.builder()
                .agentName(agentName)
                .riskScore(riskScore)
                .message(message)
                .evidence(evidence != null ? List.copyOf(evidence) : List.of())
                .build();
    }
}
