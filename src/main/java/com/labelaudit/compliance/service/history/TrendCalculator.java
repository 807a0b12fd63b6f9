package com.labelaudit.compliance.service.history;

import com.labelaudit.compliance.model.ManufacturerHistoryEntry;
import com.labelaudit.compliance.model.ManufacturerProfile;
import com.labelaudit.compliance.model.TrendDirection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives a {@link ManufacturerProfile} from a manufacturer's entry sequence.
 *
 * <p>Trend compares the mean score of the last {@code window} entries with the mean
 * of the {@code window} entries before them. A difference larger than
 * {@code epsilon} is a change of direction; fewer than {@code 2 * window} entries
 * is {@link TrendDirection#INSUFFICIENT_DATA}. Entries are ordered by timestamp,
 * keeping append order for equal timestamps.
 */
public class TrendCalculator {
    private final int window;
    private final double epsilon;

    public TrendCalculator(int window, double epsilon) {
        if (window < 1) throw new IllegalArgumentException("Trend window must be at least 1, got " + window);
        if (epsilon < 0 || Double.isNaN(epsilon)) throw new IllegalArgumentException("Trend epsilon must be >= 0");
        this.window = window;
        this.epsilon = epsilon;
    }

    public int getWindow() { return window; }
    public double getEpsilon() { return epsilon; }

    public TrendDirection direction(List<ManufacturerHistoryEntry> entries) {
        if (entries.size() < 2 * window) return TrendDirection.INSUFFICIENT_DATA;
        List<ManufacturerHistoryEntry> ordered = chronological(entries);
        int n = ordered.size();
        double recent = mean(ordered.subList(n - window, n));
        double previous = mean(ordered.subList(n - 2 * window, n - window));
        double delta = recent - previous;
        if (delta > epsilon) return TrendDirection.IMPROVING;
        if (delta < -epsilon) return TrendDirection.DECLINING;
        return TrendDirection.STABLE;
    }

    public ManufacturerProfile profileOf(String manufacturerKey, List<ManufacturerHistoryEntry> entries) {
        if (entries.isEmpty()) return ManufacturerProfile.unknown(manufacturerKey);
        List<ManufacturerHistoryEntry> ordered = chronological(entries);
        ManufacturerHistoryEntry first = ordered.get(0);
        ManufacturerHistoryEntry last = ordered.get(ordered.size() - 1);
        return new ManufacturerProfile(manufacturerKey, ordered.size(), mean(ordered), direction(ordered),
                last.getScore(), first.getTimestamp(), last.getTimestamp());
    }

    static List<ManufacturerHistoryEntry> chronological(List<ManufacturerHistoryEntry> entries) {
        List<ManufacturerHistoryEntry> ordered = new ArrayList<>(entries);
        // List.sort is stable
        ordered.sort(Comparator.comparing(ManufacturerHistoryEntry::getTimestamp));
        return ordered;
    }

    private static double mean(List<ManufacturerHistoryEntry> entries) {
        double sum = 0;
        for (ManufacturerHistoryEntry e : entries) sum += e.getScore();
        return entries.isEmpty() ? 0.0 : sum / entries.size();
    }
}
