package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * A run of open grid cells that receives one word. Slots are identified by
 * their starting cell, their direction and their length.
 */
public final class Slot {
    public enum Direction {
        ACROSS,
        DOWN;

        @Override
        public String toString() { return name().toLowerCase(); }
    }

    private final int i;
    private final int j;
    private final Direction direction;
    private final int length;
    private final ImmutableList<Cell> cells;

    /** A (row, column) grid position. */
    public static final class Cell {
        final int i;
        final int j;

        Cell(int i, int j) { this.i = i; this.j = j; }

        public int row() { return i; }
        public int column() { return j; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cell)) return false;
            Cell c = (Cell) o;
            return i == c.i && j == c.j;
        }

        @Override
        public int hashCode() { return 31 * i + j; }

        @Override
        public String toString() { return i + "," + j; }
    }

    public Slot(int i, int j, Direction direction, int length) {
        Preconditions.checkArgument(i >= 0 && j >= 0, "negative start cell %s,%s", i, j);
        Preconditions.checkArgument(length > 0, "slot length must be positive: %s", length);
        this.i = i;
        this.j = j;
        this.direction = Preconditions.checkNotNull(direction);
        this.length = length;
        ImmutableList.Builder<Cell> b = ImmutableList.builderWithExpectedSize(length);
        for (int k = 0; k < length; ++k) {
            b.add(direction == Direction.DOWN ? new Cell(i + k, j) : new Cell(i, j + k));
        }
        this.cells = b.build();
    }

    public int row() { return i; }
    public int column() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return the cells covered by this slot, in the order the letters of its word occupy them */
    public ImmutableList<Cell> cells() { return cells; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot s = (Slot) o;
        return i == s.i && j == s.j && direction == s.direction && length == s.length;
    }

    @Override
    public int hashCode() { return Objects.hash(i, j, direction, length); }

    @Override
    public String toString() { return String.format("(%d, %d) %s : %d", i, j, direction, length); }
}
