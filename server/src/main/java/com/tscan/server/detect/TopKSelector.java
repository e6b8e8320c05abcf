package com.tscan.server.detect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the candidates worth sending to the classifier.
 * <p>
 * In union mode the result is the union of the top-K by cheap score, by rise
 * and by contrast, so one heuristic alone cannot discard a real signal.
 * Duplicates are removed by (x, y) keeping the first occurrence.
 */
public class TopKSelector {

    private final ProcessingConfig config;

    public TopKSelector(ProcessingConfig config) {
        this.config = config;
    }

    public List<Candidate> select(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }
        List<Candidate> byCheap = topK(candidates, Comparator.comparingDouble(Candidate::getCheapScore), config.topkCheap);
        if (!config.topkUnion) {
            return byCheap;
        }
        List<Candidate> byRise = topK(candidates, Comparator.comparingDouble(Candidate::getRise), config.topkRise);
        List<Candidate> byContrast = topK(candidates, Comparator.comparingDouble(Candidate::getContrast),
                config.topkContrast);

        Map<Long, Candidate> unique = new LinkedHashMap<>();
        for (List<Candidate> ranking : List.of(byCheap, byRise, byContrast)) {
            for (Candidate c : ranking) {
                unique.putIfAbsent(positionKey(c), c);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static List<Candidate> topK(List<Candidate> candidates, Comparator<Candidate> ascending, int k) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        // Stable sort keeps detection order among ties
        sorted.sort(ascending.reversed());
        return new ArrayList<>(sorted.subList(0, Math.min(Math.max(0, k), sorted.size())));
    }

    private static long positionKey(Candidate c) {
        return ((long) c.getX() << 32) | (c.getY() & 0xffffffffL);
    }
}
