package org.nchoosek.parser;

import lombok.Getter;

/**
 * 某一行的列数与第一行不同。
 */
@Getter
public class InconsistentWidthException extends TruthTableException {

    private static final long serialVersionUID = 1L;

    private final int expectedWidth;
    private final int actualWidth;
    private final int lineNumber;

    public InconsistentWidthException(int expectedWidth, int actualWidth, int lineNumber) {
        super("Not all truth-table rows contain the same number of columns");
        this.expectedWidth = expectedWidth;
        this.actualWidth = actualWidth;
        this.lineNumber = lineNumber;
    }
}
