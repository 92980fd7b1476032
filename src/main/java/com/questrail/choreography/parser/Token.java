package com.questrail.choreography.parser;

import com.questrail.choreography.model.SourcePosition;

import java.util.Objects;

/**
 * A lexeme with its category and start position.
 */
public record Token(TokenType type, String lexeme, SourcePosition position)
{
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(position, "position");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Human-readable form for error messages.
     */
    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + lexeme + "'";
    }
}
