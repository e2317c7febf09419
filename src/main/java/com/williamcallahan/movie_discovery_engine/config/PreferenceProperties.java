/**
 * Preference learning and scoring configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.preferences")
public class PreferenceProperties {
    private String journalFile = "data/swipe-signals.json";
    private boolean journalEnabled = true;
    private Duration retention = Duration.ofDays(30);
    private double initialPreferredRating = 7.0;
    private double ratingSmoothing = 0.1;

    @NestedConfigurationProperty
    private Weights weights = new Weights();

    public String getJournalFile() { return journalFile; }
    public void setJournalFile(String journalFile) { this.journalFile = journalFile; }

    public boolean isJournalEnabled() { return journalEnabled; }
    public void setJournalEnabled(boolean journalEnabled) { this.journalEnabled = journalEnabled; }

    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }

    public double getInitialPreferredRating() { return initialPreferredRating; }
    public void setInitialPreferredRating(double initialPreferredRating) { this.initialPreferredRating = initialPreferredRating; }

    public double getRatingSmoothing() { return ratingSmoothing; }
    public void setRatingSmoothing(double ratingSmoothing) { this.ratingSmoothing = ratingSmoothing; }

    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }

    /**
     * Linear coefficients of the scoring heuristic
     */
    public static class Weights {
        private double genre = 1.0;
        private double ratingProximity = 0.3;
        private double highRating = 0.1;
        private double recentRelease = 0.1;
        private double highRatingThreshold = 8.0;
        private Duration recentWindow = Duration.ofDays(365);

        public double getGenre() { return genre; }
        public void setGenre(double genre) { this.genre = genre; }

        public double getRatingProximity() { return ratingProximity; }
        public void setRatingProximity(double ratingProximity) { this.ratingProximity = ratingProximity; }

        public double getHighRating() { return highRating; }
        public void setHighRating(double highRating) { this.highRating = highRating; }

        public double getRecentRelease() { return recentRelease; }
        public void setRecentRelease(double recentRelease) { this.recentRelease = recentRelease; }

        public double getHighRatingThreshold() { return highRatingThreshold; }
        public void setHighRatingThreshold(double highRatingThreshold) { this.highRatingThreshold = highRatingThreshold; }

        public Duration getRecentWindow() { return recentWindow; }
        public void setRecentWindow(Duration recentWindow) { this.recentWindow = recentWindow; }
    }
}
