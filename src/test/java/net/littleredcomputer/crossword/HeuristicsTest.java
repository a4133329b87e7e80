package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class HeuristicsTest {
    @Test
    public void fewestValuesThenHighestDegree() {
        Crossword c = CrosswordTest.fromResources("structure0.txt", "words0.txt");
        Slot down1 = c.slots().get(0);
        Slot across0 = c.slots().get(1);
        Slot down4 = c.slots().get(2);
        Slot across4 = c.slots().get(3);
        Domains d = new Domains(c);
        Heuristics h = new Heuristics(c, d);
        Map<Slot, String> assignment = new HashMap<>();
        // All domains are the same size; down1 and across4 both have two neighbors,
        // and down1 is declared first.
        assertThat(h.selectUnassignedSlot(assignment), isPresentAndIs(down1));
        assignment.put(down1, "SEVEN");
        assertThat(h.selectUnassignedSlot(assignment), isPresentAndIs(across4));
        d.retainOnly(down4, "FIVE");
        assertThat(h.selectUnassignedSlot(assignment), isPresentAndIs(down4));
        assignment.put(down4, "FIVE");
        assignment.put(across4, "NINE");
        assertThat(h.selectUnassignedSlot(assignment), isPresentAndIs(across0));
        assignment.put(across0, "SIX");
        assertThat(h.selectUnassignedSlot(assignment), isEmpty());
    }

    @Test
    public void leastConstrainingValueFirst() {
        Crossword c = Crossword.parseFrom("___\n#_#\n#_#", Arrays.asList("CAT", "DOG", "ACT"));
        Slot a = c.slots().get(0);
        Slot b = c.slots().get(1);
        Heuristics h = new Heuristics(c, new Domains(c));
        // b must start with a's middle letter: CAT and ACT each rule out two of b's
        // words, DOG rules out all three.
        assertThat(h.ruledOut(a, "CAT", ImmutableMap.of()), is(2));
        assertThat(h.ruledOut(a, "DOG", ImmutableMap.of()), is(3));
        assertThat(h.orderDomainValues(a, ImmutableMap.of()), contains("CAT", "ACT", "DOG"));
    }

    @Test
    public void assignedNeighborsDoNotCount() {
        Crossword c = Crossword.parseFrom("___\n#_#\n#_#", Arrays.asList("CAT", "DOG", "ACT"));
        Slot a = c.slots().get(0);
        Slot b = c.slots().get(1);
        Heuristics h = new Heuristics(c, new Domains(c));
        assertThat(h.ruledOut(a, "DOG", ImmutableMap.of(b, "ACT")), is(0));
        assertThat(h.orderDomainValues(a, ImmutableMap.of(b, "ACT")), contains("CAT", "DOG", "ACT"));
    }
}
