package com.phillippitts.sessioncore.service.queue;

import com.phillippitts.sessioncore.domain.QueueEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Fractional order keys for drag-reordering without renumbering the whole queue.
 *
 * <p>A move writes a single key: the midpoint of its new neighbors. Repeated midpoints halve the
 * gap each time, so after roughly fifty moves into the same slot two keys can no longer be told
 * apart. {@link #needsRenormalization(List)} detects that before it happens and
 * {@link #renormalize(List)} respaces every bucket to whole numbers.
 *
 * <p>Stateless; all methods are pure.
 */
public final class OrderKeySequencer {

    /** Distance between a new head/tail entry and its only neighbor. */
    public static final double UNIT_STEP = 1.0;

    /** Key of the first entry in an empty bucket. */
    public static final double ORIGIN_KEY = 1.0;

    /** Smallest same-bucket gap tolerated before respacing. */
    public static final double MIN_GAP = 1e-6;

    private OrderKeySequencer() {
    }

    /**
     * Key for an entry placed between {@code above} and {@code below}.
     *
     * @param above key of the entry that will sort immediately before, or null at the head
     * @param below key of the entry that will sort immediately after, or null at the tail
     * @return midpoint, {@code below - UNIT_STEP}, {@code above + UNIT_STEP} or {@link #ORIGIN_KEY}
     */
    public static double computeInsertionKey(Double above, Double below) {
        if (above != null && below != null) {
            return above + (below - above) / 2.0;
        }
        if (below != null) {
            return below - UNIT_STEP;
        }
        if (above != null) {
            return above + UNIT_STEP;
        }
        return ORIGIN_KEY;
    }

    /**
     * Key for the tail of a bucket whose largest key is {@code currentMax}.
     *
     * @param currentMax largest key in the bucket, or null if the bucket is empty
     */
    public static double appendKey(Double currentMax) {
        return currentMax == null ? ORIGIN_KEY : currentMax + UNIT_STEP;
    }

    /**
     * Checks adjacent entries of the same bucket for a gap that is too small to split again.
     *
     * @param sorted entries in {@link QueueEntry#ORDER}
     * @return true if the queue should be renormalized
     */
    public static boolean needsRenormalization(List<QueueEntry> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            QueueEntry prev = sorted.get(i - 1);
            QueueEntry next = sorted.get(i);
            if (!prev.sameBucket(next)) {
                continue;
            }
            double gap = next.orderKey() - prev.orderKey();
            if (gap < MIN_GAP) {
                return true;
            }
            double mid = computeInsertionKey(prev.orderKey(), next.orderKey());
            if (mid <= prev.orderKey() || mid >= next.orderKey()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Respaces keys to {@code 1.0, 2.0, ...} within each bucket, keeping the given order.
     *
     * @param sorted entries in {@link QueueEntry#ORDER}
     * @return new entries, same order, same size
     */
    public static List<QueueEntry> renormalize(List<QueueEntry> sorted) {
        List<QueueEntry> result = new ArrayList<>(sorted.size());
        Integer bucket = null;
        double key = ORIGIN_KEY;
        for (QueueEntry entry : sorted) {
            if (bucket == null || bucket != entry.priority()) {
                bucket = entry.priority();
                key = ORIGIN_KEY;
            }
            result.add(entry.withOrderKey(key));
            key += UNIT_STEP;
        }
        return result;
    }
}
