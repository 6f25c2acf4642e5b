package com.newsverdict.service.scoring;

import com.newsverdict.service.support.FixedModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FeatureScorerTest {
    private static final String HEADLINE = "Government announces new education policy for schools";

    @Test
    void shortTextGoesToHeadlineModel() {
        FixedModel article = new FixedModel(0.9);
        FixedModel headline = new FixedModel(0.2);

        assertEquals(0.2, new FeatureScorer(article, headline).score(HEADLINE), 1e-9);
        assertEquals(0, article.calls());
    }

    @Test
    void longTextGoesToArticleModel() {
        FixedModel article = new FixedModel(0.9);
        FixedModel headline = new FixedModel(0.2);

        assertEquals(0.9, new FeatureScorer(article, headline).score(HEADLINE.repeat(10)), 1e-9);
        assertEquals(0, headline.calls());
    }

    @Test
    void singleModelServesAllLengths() {
        FeatureScorer scorer = new FeatureScorer(new FixedModel(0.7));

        assertEquals(0.7, scorer.score(HEADLINE), 1e-9);
        assertEquals(0.7, scorer.score(HEADLINE.repeat(10)), 1e-9);
    }

    @Test
    void tooShortTextIsRejected() {
        FeatureScorer scorer = new FeatureScorer(FixedModel.neutral());

        assertThrows(InsufficientInputException.class, () -> scorer.score("  tiny   "));
        assertThrows(InsufficientInputException.class, () -> scorer.score(null));
    }

    @Test
    void outOfRangeProbabilitiesAreClamped() {
        assertEquals(1.0, new FeatureScorer(new FixedModel(1.7)).score(HEADLINE), 1e-9);
        assertEquals(0.5, new FeatureScorer(new FixedModel(Double.NaN)).score(HEADLINE), 1e-9);
    }

    @Test
    void requiresAtLeastOneModel() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureScorer(null, null));
    }
}
