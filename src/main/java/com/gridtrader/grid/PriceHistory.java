package com.gridtrader.grid;

import com.gridtrader.domain.model.PricePoint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded window of sampled mark prices. Once {@code maxPoints} is reached the oldest sample
 * is evicted on every insert.
 *
 * <p>Written by whichever loop fetches the price and read by the recenter policy and the
 * volatility estimate, so all access is synchronized and reads return copies.
 */
public class PriceHistory {

    private final int maxPoints;
    private final Deque<PricePoint> points = new ArrayDeque<>();

    public PriceHistory(int maxPoints) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be positive: " + maxPoints);
        }
        this.maxPoints = maxPoints;
    }

    public synchronized void add(BigDecimal price, LocalDateTime timestamp) {
        points.addLast(new PricePoint(price, timestamp));
        while (points.size() > maxPoints) {
            points.removeFirst();
        }
    }

    public synchronized int size() {
        return points.size();
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    /** All samples, oldest first. */
    public synchronized List<PricePoint> snapshot() {
        return new ArrayList<>(points);
    }

    /** The most recent {@code count} samples, oldest first. */
    public synchronized List<PricePoint> latest(int count) {
        List<PricePoint> all = new ArrayList<>(points);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    /** Samples taken at or after {@code cutoff}, oldest first. */
    public synchronized List<PricePoint> since(LocalDateTime cutoff) {
        List<PricePoint> result = new ArrayList<>();
        for (PricePoint point : points) {
            if (!point.timestamp().isBefore(cutoff)) {
                result.add(point);
            }
        }
        return result;
    }

    public synchronized void clear() {
        points.clear();
    }
}
