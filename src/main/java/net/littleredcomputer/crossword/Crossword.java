// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Sets;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The structure of a crossword puzzle: which cells are open, the slots formed by
 * runs of open cells, where slots cross, and the vocabulary the slots are filled from.
 * Instances are immutable.
 */
public class Crossword {
    private static final char OPEN = '_';
    private static final char BLOCKED = '█';
    private static final int CELL_SIZE = 100;
    private static final int CELL_BORDER = 2;
    private static final int FONT_SIZE = 80;

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableList<String> words;
    private final ImmutableList<Slot> slots;
    private final ImmutableMap<Slot, Integer> slotIndex;  // inverse of the above
    private final ImmutableTable<Slot, Slot, Overlap> overlaps;
    private final ImmutableListMultimap<Slot, Slot> neighbors;

    private Crossword(List<String> rows, Iterable<String> vocabulary) {
        if (rows.isEmpty()) throw new IllegalArgumentException("structure has no rows");
        height = rows.size();
        width = rows.stream().mapToInt(String::length).max().orElse(0);
        structure = new boolean[height][width];
        for (int i = 0; i < height; ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) {
                structure[i][j] = row.charAt(j) == OPEN;
            }
        }

        Set<String> ws = Sets.newLinkedHashSet();
        for (String w : vocabulary) {
            String word = w.trim().toUpperCase();
            if (word.isEmpty()) continue;
            if (CharMatcher.whitespace().matchesAnyOf(word)) {
                throw new IllegalArgumentException("word contains whitespace: " + word);
            }
            ws.add(word);
        }
        words = ImmutableList.copyOf(ws);

        ImmutableList.Builder<Slot> sb = ImmutableList.builder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) ++length;
                    if (length > 1) sb.add(new Slot(i, j, Slot.Direction.DOWN, length));
                }
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) ++length;
                    if (length > 1) sb.add(new Slot(i, j, Slot.Direction.ACROSS, length));
                }
            }
        }
        slots = sb.build();
        ImmutableMap.Builder<Slot, Integer> ib = ImmutableMap.builder();
        for (int k = 0; k < slots.size(); ++k) ib.put(slots.get(k), k);
        slotIndex = ib.build();

        ImmutableTable.Builder<Slot, Slot, Overlap> ob = ImmutableTable.builder();
        ImmutableListMultimap.Builder<Slot, Slot> nb = ImmutableListMultimap.builder();
        for (Slot a : slots) {
            for (Slot b : slots) {
                if (a.equals(b)) continue;
                List<Slot.Cell> cellsB = b.cells();
                List<Slot.Cell> cellsA = a.cells();
                for (int k = 0; k < cellsA.size(); ++k) {
                    int l = cellsB.indexOf(cellsA.get(k));
                    if (l >= 0) {
                        ob.put(a, b, new Overlap(k, l));
                        nb.put(a, b);
                        break;
                    }
                }
            }
        }
        overlaps = ob.build();
        neighbors = nb.build();
    }

    public int height() { return height; }
    public int width() { return width; }
    public boolean isOpen(int i, int j) { return structure[i][j]; }

    /** @return the vocabulary in first-seen order, upper-cased and without duplicates */
    public ImmutableList<String> words() { return words; }

    /** @return the slots in declaration order (row-major by start cell, DOWN before ACROSS) */
    public ImmutableList<Slot> slots() { return slots; }

    int indexOf(Slot s) {
        Integer ix = slotIndex.get(s);
        if (ix == null) throw new IllegalArgumentException("unknown slot: " + s);
        return ix;
    }

    /** @return where a and b cross, with a's index first, if they do */
    public Optional<Overlap> overlap(Slot a, Slot b) {
        return Optional.ofNullable(overlaps.get(a, b));
    }

    /** @return the slots crossing s, in declaration order */
    public ImmutableList<Slot> neighbors(Slot s) { return neighbors.get(s); }

    /**
     * @param assignment a partial or complete assignment
     * @return true if every slot of the puzzle has a word
     */
    public boolean isComplete(Map<Slot, String> assignment) {
        return assignment.keySet().equals(slotIndex.keySet());
    }

    /**
     * Checks every assigned word against its slot's length and against every other
     * assigned word it crosses. Nothing is remembered between calls.
     * @param assignment a partial or complete assignment
     * @return true if the words fit their slots and agree wherever they cross
     */
    public boolean isConsistent(Map<Slot, String> assignment) {
        for (Map.Entry<Slot, String> e : assignment.entrySet()) {
            if (e.getKey().length() != e.getValue().length()) return false;
        }
        for (Map.Entry<Slot, String> e : assignment.entrySet()) {
            for (Slot n : neighbors(e.getKey())) {
                String other = assignment.get(n);
                if (other != null && !overlaps.get(e.getKey(), n).agrees(e.getValue(), other)) return false;
            }
        }
        return true;
    }

    /**
     * @return a height x width array holding the letter assigned to each cell, or null
     * where no assigned word covers the cell
     */
    public Character[][] letterGrid(Map<Slot, String> assignment) {
        Character[][] letters = new Character[height][width];
        assignment.forEach((slot, word) -> {
            List<Slot.Cell> cells = slot.cells();
            for (int k = 0; k < word.length() && k < cells.size(); ++k) {
                Slot.Cell c = cells.get(k);
                letters[c.i][c.j] = word.charAt(k);
            }
        });
        return letters;
    }

    /**
     * Renders an assignment as text: one line per row, open cells showing their
     * letter (or a space), blocked cells shown as a solid block.
     */
    public String render(Map<Slot, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (structure[i][j]) {
                    s.append(letters[i][j] != null ? letters[i][j] : ' ');
                } else {
                    s.append(BLOCKED);
                }
            }
            s.append('\n');
        }
        return s.toString();
    }

    /**
     * Writes an assignment as a PNG image: a black canvas with one white square per open
     * cell, each holding its letter centered.
     */
    public void save(Map<Slot, String> assignment, File file) throws IOException {
        Character[][] letters = letterGrid(assignment);
        BufferedImage img = new BufferedImage(width * CELL_SIZE, height * CELL_SIZE, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, FONT_SIZE));
            FontMetrics fm = g.getFontMetrics();
            final int interior = CELL_SIZE - 2 * CELL_BORDER;
            for (int i = 0; i < height; ++i) {
                for (int j = 0; j < width; ++j) {
                    if (!structure[i][j]) continue;
                    int x = j * CELL_SIZE + CELL_BORDER;
                    int y = i * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interior, interior);
                    if (letters[i][j] == null) continue;
                    String letter = letters[i][j].toString();
                    g.setColor(Color.BLACK);
                    g.drawString(letter,
                            x + (interior - fm.stringWidth(letter)) / 2,
                            y + (interior - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        if (!ImageIO.write(img, "png", file)) throw new IOException("no PNG writer available");
    }

    public static Crossword parseFrom(String structure, Iterable<String> words) {
        return parseFrom(new StringReader(structure), words);
    }

    /**
     * Parses a grid structure. Each line is a row of the grid; '_' marks an open cell
     * and any other character a blocked one. Short rows are padded with blocked cells.
     * @param structure textual grid
     * @param words vocabulary; upper-cased, trimmed, blank entries skipped
     * @return the puzzle described
     */
    public static Crossword parseFrom(Reader structure, Iterable<String> words) {
        List<String> rows = new BufferedReader(structure).lines().collect(Collectors.toCollection(ArrayList::new));
        return new Crossword(rows, words);
    }

    /**
     * Parses a grid structure and a word list with one word per line.
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        return parseFrom(structure, new BufferedReader(words).lines().collect(Collectors.toList()));
    }
}
