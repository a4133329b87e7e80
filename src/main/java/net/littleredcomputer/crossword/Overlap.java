package net.littleredcomputer.crossword;

/**
 * Where two crossing slots meet: the index into the first slot's word and the
 * index into the second slot's word that must hold the same letter.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    /** @return true if the two words agree at this overlap */
    boolean agrees(String a, String b) { return a.charAt(first) == b.charAt(second); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap v = (Overlap) o;
        return first == v.first && second == v.second;
    }

    @Override
    public int hashCode() { return 31 * first + second; }

    @Override
    public String toString() { return "(" + first + ", " + second + ")"; }
}
