package org.eqschema.engine.batch;

import org.eqschema.dsl.EquationParseException;

/**
 * Thrown by a batch run with {@link org.eqschema.engine.ErrorPolicy#FAIL} when a line fails.
 */
public class EquationFileException extends RuntimeException {

    private final String sourceFile;
    private final int lineNumber;

    public EquationFileException(String sourceFile, int lineNumber, EquationParseException cause) {
        super(sourceFile + " line " + lineNumber + ": " + cause.getKind().id() + ": " + cause.getMessage(), cause);
        this.sourceFile = sourceFile;
        this.lineNumber = lineNumber;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public synchronized EquationParseException getCause() {
        return (EquationParseException) super.getCause();
    }
}
