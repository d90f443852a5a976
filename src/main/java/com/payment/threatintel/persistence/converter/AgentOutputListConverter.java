package com.payment.threatintel.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.payment.threatintel.domain.AgentOutput;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class AgentOutputListConverter extends JsonAttributeConverter<List<AgentOutput>> {

    public AgentOutputListConverter() {
        super(new TypeReference<List<AgentOutput>>() {
        });
    }

    @Override
    protected List<AgentOutput> emptyValue() {
        return new ArrayList<>();
    }
}
