package com.newsverdict.service.scoring;

import java.util.Map;
import java.util.Objects;

public final class TfidfLogisticModel implements FabricationModel {
    private final TfidfVectorizer vectorizer;
    private final double[] coefficients;
    private final double intercept;

    public TfidfLogisticModel(TfidfVectorizer vectorizer, double[] coefficients, double intercept) {
        this.vectorizer = Objects.requireNonNull(vectorizer, "vectorizer is required");
        this.coefficients = Objects.requireNonNull(coefficients, "coefficients is required").clone();
        if (coefficients.length != vectorizer.dimension()) {
            throw new IllegalArgumentException("Expected " + vectorizer.dimension() + " coefficients, got " + coefficients.length);
        }
        this.intercept = intercept;
    }

    @Override
    public double probabilityFake(String cleanedText) {
        double z = intercept;
        for (Map.Entry<Integer, Double> feature : vectorizer.transform(cleanedText).entrySet()) {
            z += coefficients[feature.getKey()] * feature.getValue();
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
