package com.plang.core.grammar;

import com.plang.core.ast.Position;

/**
 * A lexical token.
 *
 * @param type  token type
 * @param text  raw source text (string literals without quotes, unescaped)
 * @param value parsed literal value for INT/FLOAT/STRING/TRUE/FALSE, otherwise null
 * @param position where the token starts
 */
public record Token(TokenType type, String text, Object value, Position position) {

    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            case IDENT -> "identifier '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
