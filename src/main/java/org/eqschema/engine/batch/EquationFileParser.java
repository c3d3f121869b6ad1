package org.eqschema.engine.batch;

import org.eqschema.dsl.EquationParseException;
import org.eqschema.engine.EquationDocument;
import org.eqschema.engine.EquationLineParser;
import org.eqschema.engine.EquationRecord;
import org.eqschema.engine.ErrorPolicy;
import org.eqschema.engine.ParserOptions;
import org.eqschema.engine.serialization.EquationJsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reads a text file with one equation per line and parses every line.
 *
 * Line numbers are physical, 1-based, and become the record ids; blank lines are
 * skipped but still counted. Lines are parsed on a fixed worker pool and the
 * records are collected back in input order.
 */
public final class EquationFileParser implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EquationFileParser.class);

    private final ParserOptions options;
    private final EquationLineParser lineParser;
    private final ExecutorService executor;

    public EquationFileParser(ParserOptions options) {
        this.options = options;
        this.lineParser = new EquationLineParser(options);
        this.executor = Executors.newFixedThreadPool(options.threads(), r -> {
            Thread t = new Thread(r, "equation-parser");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parses every line of a .txt file.
     *
     * @param input Path of the input file
     * @return The parsed document
     * @throws IllegalArgumentException when the input is not a .txt file
     * @throws EquationFileException    when a line fails and the error policy is FAIL
     * @throws IOException              if the file cannot be read
     */
    public EquationDocument parseFile(Path input) throws IOException {
        String fileName = input.getFileName().toString();
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".txt")) {
            throw new IllegalArgumentException("Input file must be a .txt file: " + input);
        }

        List<String> lines = Files.readAllLines(input, StandardCharsets.UTF_8);
        log.debug("Read {} lines from {}", lines.size(), input);
        return parseLines(fileName, lines);
    }

    /**
     * Parses already loaded lines; index i holds line number i + 1.
     */
    public EquationDocument parseLines(String sourceFile, List<String> lines) {
        List<Future<EquationRecord>> pending = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            lineNumbers.add(lineNumber);
            pending.add(executor.submit(() -> lineParser.parseLine(line, lineNumber)));
        }

        List<EquationRecord> records = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < pending.size(); i++) {
            int lineNumber = lineNumbers.get(i);
            try {
                EquationRecord record = await(pending.get(i));
                log.debug("Line {}: {} ({})", lineNumber, record.equationType().id(), record.raw());
                records.add(record);
            } catch (EquationParseException e) {
                if (options.onError() == ErrorPolicy.FAIL) {
                    cancelFrom(pending, i + 1);
                    throw new EquationFileException(sourceFile, lineNumber, e);
                }
                skipped++;
                log.warn("Skipping {} line {}: {} ({})", sourceFile, lineNumber, e.getKind().id(), e.getMessage());
            }
        }

        log.info("Parsed {} equations from {} ({} skipped)", records.size(), sourceFile, skipped);
        return new EquationDocument(sourceFile, records);
    }

    /**
     * Writes a document as JSON. The output path gets a .json suffix when it has another one.
     *
     * @return The path actually written
     */
    public Path write(EquationDocument document, Path output) throws IOException {
        Path target = withJsonSuffix(output);
        EquationJsonSerializer serializer = new EquationJsonSerializer(options.prettyPrint());
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            serializer.write(document, out);
        }
        log.debug("Wrote {} equations to {}", document.count(), target);
        return target;
    }

    /**
     * Replaces the file extension with .json (equations.txt becomes equations.json).
     */
    public static Path withJsonSuffix(Path path) {
        String name = path.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return path;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(base + ".json");
    }

    private static EquationRecord await(Future<EquationRecord> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing equations", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Equation parsing failed", e.getCause());
        }
    }

    private static void cancelFrom(List<Future<EquationRecord>> pending, int from) {
        for (int i = from; i < pending.size(); i++) {
            pending.get(i).cancel(true);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
