// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fills a crossword by constraint satisfaction: node consistency, then AC-3, then a
 * backtracking search that chooses slots by MRV (ties to higher degree) and tries
 * words least-constraining first, maintaining arc consistency after each choice.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);
    final int logCheckSteps = 1000;
    private final Crossword crossword;
    private Domains domains;
    private ArcConsistency ac3;
    private Heuristics heuristics;
    long stepCount;
    long backtrackCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    enum Trace {SEARCH, PROPAGATION}
    EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);

    public CrosswordSolver(Crossword crossword) {
        this.crossword = crossword;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * Searches for a complete, consistent assignment of words to slots.
     * @return the assignment found, or empty if the puzzle has no solution
     */
    public Optional<Map<Slot, String>> solve() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        stepCount = lastStepCount = backtrackCount = 0;
        if (!prepare()) {
            stopwatch.stop();
            log.debug("no solution: a domain is empty before search");
            return Optional.empty();
        }
        Optional<Map<Slot, String>> result = backtrack(new LinkedHashMap<>());
        stopwatch.stop();
        log.debug("%s after %d steps, %d backtracks, %s",
                result.isPresent() ? "solved" : "no solution", stepCount, backtrackCount, stopwatch);
        return result;
    }

    /**
     * Creates fresh domains holding the whole vocabulary and makes them node and arc
     * consistent.
     * @return false if some slot is left without candidates
     */
    boolean prepare() {
        resetDomains();
        enforceNodeConsistency();
        return ac3.propagate();
    }

    /** Gives every slot the whole vocabulary again. */
    void resetDomains() {
        domains = new Domains(crossword);
        ac3 = new ArcConsistency(crossword, domains);
        ac3.tracing = tracing.contains(Trace.PROPAGATION);
        heuristics = new Heuristics(crossword, domains);
    }

    Domains domains() { return domains; }

    /** Removes from every slot's domain the words whose length differs from the slot's. */
    void enforceNodeConsistency() {
        for (Slot s : crossword.slots()) {
            final int length = s.length();
            domains.removeIf(s, w -> w.length() != length);
        }
    }

    /**
     * Extends a partial assignment to a complete one, if possible. Each tentative word
     * narrows its slot's domain and is propagated by AC-3; a branch that fails leaves the
     * domains and the assignment as it found them.
     * @param assignment consistent partial assignment; extended in place
     * @return an immutable complete assignment, or empty if none extends this one
     */
    Optional<Map<Slot, String>> backtrack(Map<Slot, String> assignment) {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> "depth " + assignment.size());
        Optional<Slot> next = heuristics.selectUnassignedSlot(assignment);
        if (!next.isPresent()) return Optional.of(ImmutableMap.copyOf(assignment));
        final Slot slot = next.get();
        for (String word : heuristics.orderDomainValues(slot, assignment)) {
            assignment.put(slot, word);
            if (crossword.isConsistent(assignment)) {
                if (tracing.contains(Trace.SEARCH)) log.trace("d=%d trying %s = %s", assignment.size(), slot, word);
                int mark = domains.mark();
                domains.retainOnly(slot, word);
                if (ac3.propagate(ac3.arcsInto(slot))) {
                    Optional<Map<Slot, String>> result = backtrack(assignment);
                    if (result.isPresent()) return result;
                }
                domains.rollback(mark);
                ++backtrackCount;
            }
            assignment.remove(slot);
        }
        return Optional.empty();
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %s", stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
