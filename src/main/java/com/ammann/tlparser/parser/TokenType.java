package com.ammann.tlparser.parser;

/**
 * Lexical categories of the formula language.
 */
public enum TokenType
{
    LPAREN("'('"),
    RPAREN("')'"),
    IMPLIES("'-->'"),
    OR("'or'"),
    AND("'and'"),
    NOT("'not'"),
    /** Single-letter temporal operator or path quantifier: A, E, F, G, R, U, X */
    TEMPORAL("temporal operator"),
    ATOM("atomic proposition"),
    EOF("end of formula");

    private final String description;

    TokenType(String description)
    {
        this.description = description;
    }

    public String description()
    {
        return description;
    }
}
