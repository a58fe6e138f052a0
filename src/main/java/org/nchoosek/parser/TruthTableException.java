package org.nchoosek.parser;

/**
 * 真值表文本无法解析时抛出的异常的基类。
 * 在任何搜索开始之前抛出，不会重试。
 */
public abstract class TruthTableException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    protected TruthTableException(String message) {
        super(message);
    }
}
