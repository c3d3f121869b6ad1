package org.eqschema.engine.cli;

import org.eqschema.engine.BareExpressionPolicy;
import org.eqschema.engine.EquationDocument;
import org.eqschema.engine.ErrorPolicy;
import org.eqschema.engine.ParserOptions;
import org.eqschema.engine.batch.EquationFileException;
import org.eqschema.engine.batch.EquationFileParser;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "equation-schema",
        description = "Parse equations from a .txt file (one per line) into a .json expression-tree document",
        version = "1.0.0", mixinStandardHelpOptions = true)
public class EquationSchemaCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Input .txt file, one equation per line")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output .json file (default: input with .json suffix)")
    private Path output;

    @CommandLine.Option(names = "--bare-expressions", defaultValue = "REJECT",
            description = "Lines without a relation: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private BareExpressionPolicy bareExpressions;

    @CommandLine.Option(names = "--on-error", defaultValue = "SKIP",
            description = "Lines that fail to parse: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ErrorPolicy onError;

    @CommandLine.Option(names = "--threads", description = "Worker threads (default: available processors - 1)")
    private Integer threads;

    @CommandLine.Option(names = "--compact", description = "Write JSON without indentation")
    private boolean compact;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EquationSchemaCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.exists(input)) {
            err.println("Error: input file not found: " + input);
            return 1;
        }
        if (threads != null && threads < 1) {
            err.println("Error: --threads must be at least 1");
            return 1;
        }

        ParserOptions options = options();
        Path target = output != null ? output : EquationFileParser.withJsonSuffix(input);

        try (EquationFileParser parser = new EquationFileParser(options)) {
            EquationDocument document = parser.parseFile(input);
            Path written = parser.write(document, target);
            out.println("Parsed " + document.count() + " equations from " + document.sourceFile());
            out.println("Output: " + written);
            return 0;
        } catch (EquationFileException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            // Undecodable input or an unwritable output path
            err.println("Error: " + e);
            return 1;
        }
    }

    ParserOptions options() {
        ParserOptions options = ParserOptions.defaults()
                .withBareExpressions(bareExpressions)
                .withOnError(onError)
                .withPrettyPrint(!compact);
        return threads != null ? options.withThreads(threads) : options;
    }
}
