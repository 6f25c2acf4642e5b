package com.newsverdict.service.scoring;

import java.util.Map;

public record ModelDefinition(
        String name,
        Map<String, Integer> vocabulary,
        double[] idf,
        int maxNgram,
        boolean sublinearTf,
        double[] coefficients,
        double intercept
) {
    public TfidfLogisticModel toModel() {
        if (vocabulary == null || idf == null || coefficients == null) {
            throw new IllegalArgumentException("Model " + name + " is missing vocabulary, idf or coefficients");
        }
        TfidfVectorizer vectorizer = new TfidfVectorizer(vocabulary, idf, maxNgram == 0 ? 1 : maxNgram, sublinearTf);
        return new TfidfLogisticModel(vectorizer, coefficients, intercept);
    }
}
