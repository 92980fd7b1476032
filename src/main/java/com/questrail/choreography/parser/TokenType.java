package com.questrail.choreography.parser;

/**
 * Token categories produced by the {@link Lexer}.
 */
public enum TokenType
{
    // Keywords
    PROTOCOL,
    GLOBAL,
    ROLE,
    CHOICE,
    AT,
    OR,
    PAR,
    AND,
    REC,
    CONTINUE,
    FROM,
    TO,
    TYPE,
    AS,
    IMPORT,

    // Symbols
    ARROW,     // ->
    COLON,     // :
    SEMICOLON, // ;
    COMMA,     // ,
    LPAREN,    // (
    RPAREN,    // )
    LBRACE,    // {
    RBRACE,    // }
    LANGLE,    // <
    RANGLE,    // >

    // Role names, labels, type names
    IDENTIFIER,

    // "..." with escapes resolved; only import paths use it
    STRING,

    EOF
}
