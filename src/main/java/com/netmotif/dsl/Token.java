package com.netmotif.dsl;

/**
 * A lexical token. {@code intValue} is meaningful only for {@link TokenType#INT}.
 */
public record Token(TokenType type, String lexeme, int intValue, SourcePosition position) {

    public boolean is(TokenType t) {
        return type == t;
    }

    public String describe() {
        return switch (type) {
            case IDENT -> "IDENT '" + lexeme + "'";
            case INT -> "INT " + lexeme;
            case EOF -> "end of input";
            default -> type.describe();
        };
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")@" + position.line() + ":" + position.column();
    }
}
