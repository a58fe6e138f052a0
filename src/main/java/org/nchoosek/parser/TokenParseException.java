package org.nchoosek.parser;

import lombok.Getter;

/**
 * 某个记号不是 0/1/F/f/T/t 之一。
 */
@Getter
public class TokenParseException extends TruthTableException {

    private static final long serialVersionUID = 1L;

    private final String token;

    // 从 1 开始的行号
    private final int lineNumber;

    public TokenParseException(String token, int lineNumber) {
        super("Failed to parse \"" + token + "\" as a Boolean value");
        this.token = token;
        this.lineNumber = lineNumber;
    }
}
