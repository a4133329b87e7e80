package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' = open cell), or - for stdin")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "PNG file to receive an image of the filled grid")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader open(String filename) throws FileNotFoundException {
        return new BufferedReader(filename.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8));
    }

    private static String required(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return cmd.getOptionValue(option);
    }

    private static String wordsFile(CommandLine cmd) {
        String w = required(cmd, "words");
        if (w.equals("-")) throw new IllegalArgumentException("only -structure may be read from stdin");
        return w;
    }

    private static Duration logInterval(CommandLine cmd) {
        String s = cmd.getOptionValue("loginterval", "PT1S");
        try {
            return Duration.parse(s);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("bad -loginterval: " + s, e);
        }
    }

    /**
     * Solves the puzzle described by the command line and writes the filled grid (or
     * "No solution.") to out, and an image of it to the -output file if one is given.
     */
    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword;
        String wordsFile = wordsFile(cmd);
        try (Reader structure = open(required(cmd, "structure"));
             Reader words = open(wordsFile)) {
            crossword = Crossword.parseFrom(structure, words);
        }
        log.debug("%dx%d grid, %d slots, %d words",
                crossword.height(), crossword.width(), crossword.slots().size(), crossword.words().size());
        Stopwatch sw = Stopwatch.createStarted();
        Optional<Map<Slot, String>> assignment = new CrosswordSolver(crossword)
                .setLogInterval(logInterval(cmd))
                .solve();
        log.info("solver finished in %s", sw.stop());
        if (!assignment.isPresent()) {
            out.println("No solution.");
            return;
        }
        String grid = crossword.render(assignment.get());
        out.print(grid);
        if (cmd.hasOption("output")) {
            File output = new File(cmd.getOptionValue("output"));
            crossword.save(assignment.get(), output);
            log.info("wrote %s", output);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, System.out);
    }
}
