package com.ammann.tlparser.parser;

/**
 * A lexical token with the character offset it starts at.
 *
 * @param type     lexical category
 * @param text     source text of the token
 * @param position zero-based offset in the formula
 */
public record Token(TokenType type, String text, int position)
{
    public boolean is(TokenType other)
    {
        return type == other;
    }

    /**
     * Whether this is the temporal operator written as {@code letter}.
     */
    public boolean isTemporal(String letter)
    {
        return type == TokenType.TEMPORAL && text.equals(letter);
    }

    /**
     * Human-readable form for error messages.
     */
    public String describe()
    {
        return type == TokenType.EOF ? type.description() : "'" + text + "'";
    }
}
