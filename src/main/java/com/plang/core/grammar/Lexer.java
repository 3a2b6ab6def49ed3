package com.plang.core.grammar;

import com.plang.core.ast.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns PLang source text into tokens. Keywords are case-insensitive; {@code #}
 * starts a comment that runs to the end of the line.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("import", TokenType.IMPORT),
            Map.entry("policy", TokenType.POLICY),
            Map.entry("rule", TokenType.RULE),
            Map.entry("priority", TokenType.PRIORITY),
            Map.entry("use", TokenType.USE),
            Map.entry("when", TokenType.WHEN),
            Map.entry("then", TokenType.THEN),
            Map.entry("to", TokenType.TO),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("in", TokenType.IN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("null", TokenType.NULL)
    );

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespaceAndComments();
            if (atEnd()) {
                tokens.add(new Token(TokenType.EOF, "", null, here()));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() {
        Position start = here();
        char c = peek();

        if (Character.isLetter(c) || c == '_') {
            return identifierOrKeyword(start);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"') {
            return string(start);
        }

        advance();
        switch (c) {
            case '{': return simple(TokenType.LBRACE, "{", start);
            case '}': return simple(TokenType.RBRACE, "}", start);
            case '(': return simple(TokenType.LPAREN, "(", start);
            case ')': return simple(TokenType.RPAREN, ")", start);
            case '[': return simple(TokenType.LBRACKET, "[", start);
            case ']': return simple(TokenType.RBRACKET, "]", start);
            case ',': return simple(TokenType.COMMA, ",", start);
            case ':': return simple(TokenType.COLON, ":", start);
            case '.': return simple(TokenType.DOT, ".", start);
            case '+': return simple(TokenType.PLUS, "+", start);
            case '-': return simple(TokenType.MINUS, "-", start);
            case '*': return simple(TokenType.STAR, "*", start);
            case '/': return simple(TokenType.SLASH, "/", start);
            case '%': return simple(TokenType.PERCENT, "%", start);
            case '<':
                return match('=') ? simple(TokenType.LTE, "<=", start) : simple(TokenType.LT, "<", start);
            case '>':
                return match('=') ? simple(TokenType.GTE, ">=", start) : simple(TokenType.GT, ">", start);
            case '=':
                if (match('=')) return simple(TokenType.EQ, "==", start);
                throw new ParseException(Diagnostic.syntax(start, "'=='", "'='"));
            case '!':
                if (match('=')) return simple(TokenType.NEQ, "!=", start);
                throw new ParseException(Diagnostic.syntax(start, "'!='", "'!'"));
            default:
                throw new ParseException(Diagnostic.syntax(start, "a token",
                        "unexpected character '" + c + "'"));
        }
    }

    private Token identifierOrKeyword(Position start) {
        int begin = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            advance();
        }
        String text = source.substring(begin, pos);
        TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
        if (keyword == null) {
            return new Token(TokenType.IDENT, text, null, start);
        }
        Object value = switch (keyword) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            default -> null;
        };
        return new Token(keyword, text, value, start);
    }

    private Token number(Position start) {
        int begin = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            advance();
        }
        boolean isFloat = false;
        if (!atEnd() && peek() == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
            isFloat = true;
            advance();
            while (!atEnd() && Character.isDigit(peek())) {
                advance();
            }
        }
        String text = source.substring(begin, pos);
        try {
            return isFloat
                    ? new Token(TokenType.FLOAT, text, Double.parseDouble(text), start)
                    : new Token(TokenType.INT, text, Long.parseLong(text), start);
        } catch (NumberFormatException e) {
            throw new ParseException(Diagnostic.syntax(start, "a number in range", text));
        }
    }

    private Token string(Position start) {
        advance(); // opening quote
        var sb = new StringBuilder();
        while (true) {
            if (atEnd() || peek() == '\n') {
                throw new ParseException(Diagnostic.syntax(start, "closing '\"'", "unterminated string"));
            }
            char c = advance();
            if (c == '"') {
                break;
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw new ParseException(Diagnostic.syntax(start, "closing '\"'", "unterminated string"));
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> throw new ParseException(Diagnostic.syntax(here(), "an escape sequence",
                            "'\\" + escaped + "'"));
                }
            } else {
                sb.append(c);
            }
        }
        String text = sb.toString();
        return new Token(TokenType.STRING, text, text, start);
    }

    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char c = peek();
            if (c == '#') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private Token simple(TokenType type, String text, Position start) {
        return new Token(type, text, null, start);
    }

    private boolean match(char expected) {
        if (!atEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return source.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private Position here() {
        return new Position(line, column);
    }
}
