package com.payment.threatintel.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/**
 * Cluster centroids as a JSON number array.
 */
@Converter
public class VectorConverter extends JsonAttributeConverter<double[]> {

    public VectorConverter() {
        super(new TypeReference<double[]>() {
        });
    }

    @Override
    protected double[] emptyValue() {
        return new double[0];
    }
}
