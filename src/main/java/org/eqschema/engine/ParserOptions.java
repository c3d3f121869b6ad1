package org.eqschema.engine;

import java.util.Objects;

/**
 * Settings for parsing equation lines and files.
 *
 * @param bareExpressions Handling of lines without a relation
 * @param onError         Handling of failing lines in batch runs
 * @param threads         Worker threads used for batch runs
 * @param prettyPrint     Indent JSON output
 */
public record ParserOptions(
        BareExpressionPolicy bareExpressions,
        ErrorPolicy onError,
        int threads,
        boolean prettyPrint) {

    public ParserOptions {
        Objects.requireNonNull(bareExpressions, "Bare expression policy cannot be null");
        Objects.requireNonNull(onError, "Error policy cannot be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(BareExpressionPolicy.REJECT, ErrorPolicy.SKIP,
                Math.max(Runtime.getRuntime().availableProcessors() - 1, 1), true);
    }

    public ParserOptions withBareExpressions(BareExpressionPolicy policy) {
        return new ParserOptions(policy, onError, threads, prettyPrint);
    }

    public ParserOptions withOnError(ErrorPolicy policy) {
        return new ParserOptions(bareExpressions, policy, threads, prettyPrint);
    }

    public ParserOptions withThreads(int count) {
        return new ParserOptions(bareExpressions, onError, count, prettyPrint);
    }

    public ParserOptions withPrettyPrint(boolean pretty) {
        return new ParserOptions(bareExpressions, onError, threads, pretty);
    }
}
