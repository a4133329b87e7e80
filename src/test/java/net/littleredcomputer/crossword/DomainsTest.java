package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class DomainsTest {
    private final Crossword c = Crossword.parseFrom("___\n#_#\n#_#", Arrays.asList("cat", "dog", "act", "at"));
    private final Slot a = c.slots().get(0);
    private final Slot b = c.slots().get(1);

    @Test
    public void startsWithWholeVocabulary() {
        Domains d = new Domains(c);
        assertThat(d.words(a), contains("CAT", "DOG", "ACT", "AT"));
        assertThat(d.size(b), is(4));
        assertThat(d.contains(b, "AT"), is(true));
        assertThat(d.contains(b, "XYZ"), is(false));
    }

    @Test
    public void removeIf() {
        Domains d = new Domains(c);
        assertThat(d.removeIf(a, w -> w.startsWith("C")), is(1));
        assertThat(d.words(a), contains("DOG", "ACT", "AT"));
        assertThat(d.words(b), contains("CAT", "DOG", "ACT", "AT"));
        assertThat(d.removeIf(a, w -> w.startsWith("C")), is(0));
    }

    @Test
    public void retainOnly() {
        Domains d = new Domains(c);
        assertThat(d.retainOnly(a, "ACT"), is(3));
        assertThat(d.words(a), contains("ACT"));
        d.retainOnly(b, "NOPE");
        assertThat(d.isEmpty(b), is(true));
    }

    @Test
    public void rollbackRestoresExactly() {
        Domains d = new Domains(c);
        d.removeIf(a, w -> w.length() != 3);
        ImmutableMap<Slot, ImmutableSet<String>> before = d.snapshot();
        int mark = d.mark();
        d.retainOnly(a, "DOG");
        int inner = d.mark();
        d.removeIf(b, w -> w.charAt(0) != 'O');
        assertThat(d.isEmpty(b), is(true));
        d.rollback(inner);
        assertThat(d.words(b), contains("CAT", "DOG", "ACT", "AT"));
        assertThat(d.words(a), contains("DOG"));
        d.rollback(mark);
        assertThat(d.snapshot(), is(before));
        assertThat(d.words(a), contains("CAT", "DOG", "ACT"));
        // Rolling back to the current position changes nothing.
        d.rollback(d.mark());
        assertThat(d.snapshot(), is(before));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rollbackPastEndThrows() {
        Domains d = new Domains(c);
        d.rollback(1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSlotThrows() {
        new Domains(c).size(new Slot(5, 5, Slot.Direction.ACROSS, 2));
    }
}
