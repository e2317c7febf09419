package com.williamcallahan.movie_discovery_engine.types;

/**
 * User judgment attached to a swipe, with the genre weight delta it contributes
 */
public enum Judgment {
    LIKED(1.0),
    SUPER_LIKED(2.0),
    SKIPPED(-0.5);

    private final double genreWeight;

    Judgment(double genreWeight) {
        this.genreWeight = genreWeight;
    }

    public double getGenreWeight() {
        return genreWeight;
    }

    /**
     * Only positive judgments move the preferred rating
     */
    public boolean isPositive() {
        return this != SKIPPED;
    }
}
