package com.newsverdict.service.scoring;

import java.util.logging.Logger;

public class FeatureScorer {
    private static final Logger LOGGER = Logger.getLogger(FeatureScorer.class.getName());

    static final int MIN_INPUT_CHARS = 10;
    static final int HEADLINE_MAX_CHARS = 300;

    private final FabricationModel articleModel;
    private final FabricationModel headlineModel;

    public FeatureScorer(FabricationModel articleModel, FabricationModel headlineModel) {
        if (articleModel == null && headlineModel == null) {
            throw new IllegalArgumentException("At least one model is required");
        }
        this.articleModel = articleModel;
        this.headlineModel = headlineModel;
    }

    public FeatureScorer(FabricationModel model) {
        this(model, null);
    }

    public double score(String workingText) {
        String trimmed = workingText == null ? "" : workingText.trim();
        if (trimmed.length() < MIN_INPUT_CHARS) {
            throw new InsufficientInputException("Text too short to score (" + trimmed.length() + " chars)");
        }
        String cleaned = TextCleaner.clean(trimmed);
        FabricationModel model = select(cleaned);
        double probability = model.probabilityFake(cleaned);
        if (Double.isNaN(probability)) {
            LOGGER.warning("Model returned NaN; treating as undecided");
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }

    private FabricationModel select(String cleaned) {
        if (cleaned.length() < HEADLINE_MAX_CHARS && headlineModel != null) {
            return headlineModel;
        }
        return articleModel != null ? articleModel : headlineModel;
    }
}
