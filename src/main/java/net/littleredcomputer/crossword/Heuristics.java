package net.littleredcomputer.crossword;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable and value ordering for the backtracking search.
 */
class Heuristics {
    private final Crossword crossword;
    private final Domains domains;

    Heuristics(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * Chooses the unassigned slot with the fewest remaining candidates (MRV). Ties go
     * to the slot with the most neighbors, and then to the earlier declared slot.
     * @return the chosen slot, or empty if every slot is assigned
     */
    Optional<Slot> selectUnassignedSlot(Map<Slot, String> assignment) {
        Slot best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        for (Slot s : crossword.slots()) {
            if (assignment.containsKey(s)) continue;
            int size = domains.size(s);
            int degree = crossword.neighbors(s).size();
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = s;
                bestSize = size;
                bestDegree = degree;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @return the number of candidates of s's unassigned neighbors that word would rule out
     */
    int ruledOut(Slot s, String word, Map<Slot, String> assignment) {
        int count = 0;
        for (Slot n : crossword.neighbors(s)) {
            if (assignment.containsKey(n)) continue;
            Overlap o = crossword.overlap(s, n).get();
            for (String nw : domains.words(n)) {
                if (!o.agrees(word, nw)) ++count;
            }
        }
        return count;
    }

    /**
     * Orders the candidates of s least-constraining first: by how many candidates of
     * s's unassigned neighbors each would rule out. Equal counts keep vocabulary order.
     */
    List<String> orderDomainValues(Slot s, Map<Slot, String> assignment) {
        List<String> values = domains.words(s);
        Map<String, Integer> cost = new HashMap<>();
        for (String w : values) cost.put(w, ruledOut(s, w, assignment));
        values.sort(Comparator.comparingInt(cost::get));
        return values;
    }
}
