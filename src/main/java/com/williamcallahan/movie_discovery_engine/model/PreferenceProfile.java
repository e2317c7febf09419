package com.williamcallahan.movie_discovery_engine.model;

import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of learned preferences
 * - genreWeights maps genre id to accumulated weight, possibly negative
 * - preferredRating is the smoothed rating of liked items
 */
@Value
public class PreferenceProfile {
    Map<Integer, Double> genreWeights;
    double preferredRating;

    public PreferenceProfile(Map<Integer, Double> genreWeights, double preferredRating) {
        this.genreWeights = Map.copyOf(genreWeights);
        this.preferredRating = preferredRating;
    }

    public double weightFor(int genreId) {
        return genreWeights.getOrDefault(genreId, 0.0);
    }
}
