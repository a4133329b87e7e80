package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Optional;
import java.util.Queue;

/**
 * Algorithm AC-3: prunes domain values that have no support in a crossing slot's
 * domain, until every arc is consistent or some domain runs dry. All removals go
 * through the {@link Domains} trail, so a caller can undo them.
 */
class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger();
    private final Crossword crossword;
    private final Domains domains;
    boolean tracing = false;
    long revisions;  // count of revise() calls that removed something

    /** An ordered pair of crossing slots: x is to be made consistent with y. */
    static final class Arc {
        final Slot x;
        final Slot y;

        Arc(Slot x, Slot y) { this.x = x; this.y = y; }

        @Override
        public String toString() { return x + " -> " + y; }
    }

    ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * Makes x arc consistent with y: removes each candidate of x that agrees with no
     * candidate of y where the two slots cross. Slots that don't cross are left alone.
     * @return true if any candidate of x was removed
     */
    boolean revise(Slot x, Slot y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final Overlap overlap = o.get();
        // The letters y can still put at the crossing; x needs one of them.
        BitSet supported = new BitSet();
        for (String yw : domains.words(y)) supported.set(yw.charAt(overlap.second()));
        int removed = domains.removeIf(x, xw -> !supported.get(xw.charAt(overlap.first())));
        if (removed > 0) {
            ++revisions;
            if (tracing) log.trace("revise %s against %s removed %d", x, y, removed);
        }
        return removed > 0;
    }

    /** Runs AC-3 starting from every arc of the puzzle. */
    @CheckReturnValue
    boolean propagate() {
        Queue<Arc> queue = new ArrayDeque<>();
        for (Slot x : crossword.slots()) {
            for (Slot y : crossword.neighbors(x)) queue.add(new Arc(x, y));
        }
        return propagate(queue);
    }

    /**
     * Runs AC-3 starting from the given arcs. Whenever a slot loses candidates, the arcs
     * pointing at it from its other neighbors are queued again.
     * @param arcs initial work list; consumed
     * @return false if some slot has no candidates left, true if all domains are
     * nonempty and every arc is consistent
     */
    @CheckReturnValue
    boolean propagate(Collection<Arc> arcs) {
        Queue<Arc> queue = arcs instanceof Queue ? (Queue<Arc>) arcs : new ArrayDeque<>(arcs);
        while (!queue.isEmpty()) {
            Arc a = queue.remove();
            if (revise(a.x, a.y)) {
                if (tracing && domains.isEmpty(a.x)) log.trace("domain of %s is empty", a.x);
                for (Slot z : crossword.neighbors(a.x)) {
                    if (!z.equals(a.y)) queue.add(new Arc(z, a.x));
                }
            }
        }
        // An emptied domain empties its neighbors in turn, so this runs to the fixed point
        // before looking. Slots with no neighbors are never revised; they are checked here too.
        for (Slot s : crossword.slots()) {
            if (domains.isEmpty(s)) return false;
        }
        return true;
    }

    /** @return the arcs (z, s) for every neighbor z of s */
    Queue<Arc> arcsInto(Slot s) {
        Queue<Arc> arcs = new ArrayDeque<>();
        for (Slot z : crossword.neighbors(s)) arcs.add(new Arc(z, s));
        return arcs;
    }
}
