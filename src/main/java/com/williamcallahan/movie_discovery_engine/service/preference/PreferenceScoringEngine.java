/**
 * Learns genre and rating preferences from swipe signals and ranks catalog items with them
 *
 * @author William Callahan
 *
 * Features:
 * - Additive genre affinity per judgment (super like, like, skip)
 * - Exponentially smoothed preferred rating from positive judgments
 * - Transparent linear score with configurable coefficients
 * - Stable descending ranking so equal scores keep their input order
 * - Rolling retention window; stale signals are dropped on the next record and
 *   the profile is rebuilt by replaying what remains
 * - Optional journal so the signal window survives restarts
 */
package com.williamcallahan.movie_discovery_engine.service.preference;

import com.williamcallahan.movie_discovery_engine.config.PreferenceProperties;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.PreferenceProfile;
import com.williamcallahan.movie_discovery_engine.model.SwipeSignal;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class PreferenceScoringEngine {

    private static final double MIN_RATING = 0.0;
    private static final double MAX_RATING = 10.0;

    private final PreferenceProperties properties;
    private final Clock clock;
    private final SignalJournal journal;

    private final Object lock = new Object();
    private final List<SwipeSignal> signals = new ArrayList<>();
    private final Map<Integer, Double> genreWeights = new HashMap<>();
    private double preferredRating;

    /**
     * @param properties coefficients, smoothing and retention settings
     * @param clock time source for retention and recency
     * @param journal signal persistence, or null to keep signals in memory only
     */
    public PreferenceScoringEngine(PreferenceProperties properties, Clock clock, SignalJournal journal) {
        this.properties = properties;
        this.clock = clock;
        this.journal = journal;
        this.preferredRating = properties.getInitialPreferredRating();
        if (journal != null) {
            synchronized (lock) {
                Instant cutoff = retentionCutoff();
                journal.load().stream()
                    .filter(signal -> !signal.getTimestamp().isBefore(cutoff))
                    .forEach(signals::add);
                rebuildProfile();
                log.info("Restored preference profile from {} swipe signal(s)", signals.size());
            }
        }
    }

    /**
     * Record a judgment
     * - Signals older than the retention window are pruned first, rebuilding the profile when any go
     * - A signal already outside the window is ignored
     *
     * @param signal the judgment to learn from
     */
    public void record(SwipeSignal signal) {
        synchronized (lock) {
            Instant cutoff = retentionCutoff();
            boolean pruned = signals.removeIf(existing -> existing.getTimestamp().isBefore(cutoff));
            if (pruned) {
                rebuildProfile();
            }
            if (signal.getTimestamp().isBefore(cutoff)) {
                log.debug("Ignoring swipe on {} older than the retention window", signal.getItemId());
                if (pruned) {
                    saveJournal();
                }
                return;
            }
            signals.add(signal);
            apply(signal);
            saveJournal();
        }
        log.debug("Recorded {} on item {}", signal.getJudgment(), signal.getItemId());
    }

    /**
     * Score an item against the current profile. Higher is better.
     */
    public double score(CatalogItem item) {
        synchronized (lock) {
            return scoreUnlocked(item, LocalDate.now(clock));
        }
    }

    /**
     * Sort by descending score; equal scores keep their input order
     *
     * @param items items to rank
     * @return new ranked list
     */
    public List<CatalogItem> rank(List<CatalogItem> items) {
        Map<CatalogItem, Double> scores = new IdentityHashMap<>();
        synchronized (lock) {
            LocalDate today = LocalDate.now(clock);
            for (CatalogItem item : items) {
                scores.put(item, scoreUnlocked(item, today));
            }
        }
        List<CatalogItem> ranked = new ArrayList<>(items);
        ranked.sort(Comparator.comparingDouble((CatalogItem item) -> scores.get(item)).reversed());
        return ranked;
    }

    /**
     * Remove items the user already judged inside the retention window
     */
    public List<CatalogItem> filterJudged(List<CatalogItem> items) {
        Set<Integer> judged = new HashSet<>();
        synchronized (lock) {
            signals.forEach(signal -> judged.add(signal.getItemId()));
        }
        return items.stream()
            .filter(item -> !judged.contains(item.getId()))
            .toList();
    }

    /**
     * Genres with the highest positive affinity, strongest first
     *
     * @param limit maximum number of genres
     * @return genre ids
     */
    public List<Integer> topGenres(int limit) {
        synchronized (lock) {
            return genreWeights.entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .toList();
        }
    }

    /**
     * Rating band worth suggesting: two below to one above the preferred rating, clamped to 0..10
     *
     * @return two-element array {min, max}
     */
    public double[] preferredRatingRange() {
        synchronized (lock) {
            double min = Math.max(MIN_RATING, preferredRating - 2.0);
            double max = Math.min(MAX_RATING, preferredRating + 1.0);
            return new double[] {min, max};
        }
    }

    public PreferenceProfile profile() {
        synchronized (lock) {
            return new PreferenceProfile(genreWeights, preferredRating);
        }
    }

    public int signalCount() {
        synchronized (lock) {
            return signals.size();
        }
    }

    /**
     * Forget every signal and return to the initial profile
     */
    public void reset() {
        synchronized (lock) {
            signals.clear();
            rebuildProfile();
            saveJournal();
        }
        log.info("Preference profile reset");
    }

    private double scoreUnlocked(CatalogItem item, LocalDate today) {
        PreferenceProperties.Weights weights = properties.getWeights();

        double genreAffinity = 0.0;
        if (!item.getGenreIds().isEmpty()) {
            double sum = 0.0;
            for (Integer genreId : item.getGenreIds()) {
                sum += genreWeights.getOrDefault(genreId, 0.0);
            }
            genreAffinity = sum / item.getGenreIds().size();
        }

        double ratingProximity = Math.max(0.0, MAX_RATING - Math.abs(item.getRating() - preferredRating)) / MAX_RATING;
        double highRating = item.getRating() >= weights.getHighRatingThreshold() ? 1.0 : 0.0;
        double recent = isRecent(item, today, weights) ? 1.0 : 0.0;

        return weights.getGenre() * genreAffinity
            + weights.getRatingProximity() * ratingProximity
            + weights.getHighRating() * highRating
            + weights.getRecentRelease() * recent;
    }

    private boolean isRecent(CatalogItem item, LocalDate today, PreferenceProperties.Weights weights) {
        LocalDate released = item.getReleaseDate();
        if (released == null || released.isAfter(today)) {
            return false;
        }
        return !released.isBefore(today.minusDays(weights.getRecentWindow().toDays()));
    }

    private void apply(SwipeSignal signal) {
        double delta = signal.getJudgment().getGenreWeight();
        for (Integer genreId : signal.getGenreIds()) {
            genreWeights.merge(genreId, delta, Double::sum);
        }
        if (signal.getJudgment().isPositive()) {
            double alpha = properties.getRatingSmoothing();
            preferredRating = preferredRating * (1.0 - alpha) + signal.getRating() * alpha;
        }
    }

    private void rebuildProfile() {
        genreWeights.clear();
        preferredRating = properties.getInitialPreferredRating();
        signals.forEach(this::apply);
    }

    private void saveJournal() {
        if (journal != null && !journal.save(signals)) {
            log.warn("Swipe signals kept in memory only; journal write failed");
        }
    }

    private Instant retentionCutoff() {
        return clock.instant().minus(properties.getRetention());
    }
}
