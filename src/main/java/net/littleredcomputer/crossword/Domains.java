package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * The words still available to each slot. Every slot starts with the whole
 * vocabulary; words are only ever removed, and each removal is recorded on a
 * trail so that a search can return the store to any earlier state with
 * {@link #mark()} and {@link #rollback(int)}.
 */
public class Domains {
    private final Crossword crossword;
    private final ImmutableList<String> words;
    private final BitSet[] live;  // live[s] has bit w set iff word w is still a candidate for slot s
    // The trail: parallel lists of (slot index, word index) removals, oldest first.
    private final TIntArrayList trailSlots = new TIntArrayList();
    private final TIntArrayList trailWords = new TIntArrayList();

    public Domains(Crossword crossword) {
        this.crossword = crossword;
        this.words = crossword.words();
        this.live = new BitSet[crossword.slots().size()];
        for (int s = 0; s < live.length; ++s) {
            live[s] = new BitSet(words.size());
            live[s].set(0, words.size());
        }
    }

    public int size(Slot s) { return live[crossword.indexOf(s)].cardinality(); }

    public boolean isEmpty(Slot s) { return live[crossword.indexOf(s)].isEmpty(); }

    public boolean contains(Slot s, String word) {
        int w = words.indexOf(word);
        return w >= 0 && live[crossword.indexOf(s)].get(w);
    }

    /** @return the remaining candidates for s, in vocabulary order */
    public List<String> words(Slot s) {
        BitSet b = live[crossword.indexOf(s)];
        List<String> result = new ArrayList<>(b.cardinality());
        for (int w = b.nextSetBit(0); w >= 0; w = b.nextSetBit(w + 1)) result.add(words.get(w));
        return result;
    }

    /**
     * Removes every candidate of s satisfying p.
     * @return the number of words removed
     */
    public int removeIf(Slot s, Predicate<String> p) {
        final int si = crossword.indexOf(s);
        BitSet b = live[si];
        int removed = 0;
        for (int w = b.nextSetBit(0); w >= 0; w = b.nextSetBit(w + 1)) {
            if (p.test(words.get(w))) {
                b.clear(w);
                trailSlots.add(si);
                trailWords.add(w);
                ++removed;
            }
        }
        return removed;
    }

    /** Reduces the candidates of s to the single word given (or to nothing, if it isn't a candidate). */
    public int retainOnly(Slot s, String word) {
        return removeIf(s, w -> !w.equals(word));
    }

    /** @return a position on the trail to which the store can later be rolled back */
    public int mark() { return trailSlots.size(); }

    /** Restores every word removed since the given mark was taken. */
    public void rollback(int mark) {
        if (mark < 0 || mark > trailSlots.size()) throw new IllegalArgumentException("bad trail mark: " + mark);
        final int n = trailSlots.size() - mark;
        if (n == 0) return;
        for (int t = trailSlots.size() - 1; t >= mark; --t) {
            live[trailSlots.get(t)].set(trailWords.get(t));
        }
        trailSlots.remove(mark, n);
        trailWords.remove(mark, n);
    }

    /** @return an immutable copy of every slot's candidates */
    public ImmutableMap<Slot, ImmutableSet<String>> snapshot() {
        ImmutableMap.Builder<Slot, ImmutableSet<String>> b = ImmutableMap.builder();
        for (Slot s : crossword.slots()) b.put(s, ImmutableSet.copyOf(words(s)));
        return b.build();
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
