package com.newsverdict.service.scoring;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class TfidfVectorizer {
    private final Map<String, Integer> vocabulary;
    private final double[] idf;
    private final int maxNgram;
    private final boolean sublinearTf;

    public TfidfVectorizer(Map<String, Integer> vocabulary, double[] idf, int maxNgram, boolean sublinearTf) {
        this.vocabulary = Map.copyOf(Objects.requireNonNull(vocabulary, "vocabulary is required"));
        this.idf = Objects.requireNonNull(idf, "idf is required").clone();
        if (maxNgram < 1 || maxNgram > 2) {
            throw new IllegalArgumentException("maxNgram must be 1 or 2");
        }
        for (Integer index : this.vocabulary.values()) {
            if (index < 0 || index >= idf.length) {
                throw new IllegalArgumentException("Vocabulary index " + index + " outside idf range " + idf.length);
            }
        }
        this.maxNgram = maxNgram;
        this.sublinearTf = sublinearTf;
    }

    public int dimension() {
        return idf.length;
    }

    public Map<Integer, Double> transform(String cleanedText) {
        Map<Integer, Double> counts = new TreeMap<>();
        if (cleanedText == null || cleanedText.isBlank()) {
            return counts;
        }
        String[] tokens = cleanedText.trim().split(" ");
        for (int i = 0; i < tokens.length; i++) {
            count(tokens[i], counts);
            if (maxNgram == 2 && i + 1 < tokens.length) {
                count(tokens[i] + " " + tokens[i + 1], counts);
            }
        }

        double norm = 0.0;
        for (Map.Entry<Integer, Double> entry : counts.entrySet()) {
            double tf = sublinearTf ? 1.0 + Math.log(entry.getValue()) : entry.getValue();
            double weight = tf * idf[entry.getKey()];
            entry.setValue(weight);
            norm += weight * weight;
        }
        if (norm > 0.0) {
            double length = Math.sqrt(norm);
            counts.replaceAll((index, weight) -> weight / length);
        }
        return counts;
    }

    private void count(String term, Map<Integer, Double> counts) {
        Integer index = vocabulary.get(term);
        if (index != null) {
            counts.merge(index, 1.0, Double::sum);
        }
    }
}
