package org.nchoosek.parser;

/**
 * 去掉注释和空行之后没有剩下任何行。
 */
public class EmptyTableException extends TruthTableException {

    private static final long serialVersionUID = 1L;

    public EmptyTableException() {
        super("Truth table is empty");
    }
}
