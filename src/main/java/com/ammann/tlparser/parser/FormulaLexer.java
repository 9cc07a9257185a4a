package com.ammann.tlparser.parser;

import com.ammann.tlparser.exception.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a parsable formula into tokens.
 *
 * <p>Words are runs of letters, digits, {@code _} and {@code .}. The words {@code and},
 * {@code or} and {@code not} are connectives, the single letters {@code A E F G R U X} are
 * temporal operators, every other word is an atomic proposition. Symbolic aliases
 * {@code ->}, {@code &}, {@code &&}, {@code |}, {@code ||} and {@code ~} are accepted.
 */
public final class FormulaLexer
{
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT);

    private static final Set<String> TEMPORAL_OPERATORS = Set.of("A", "E", "F", "G", "R", "U", "X");

    private final String input;
    private int pos;

    private FormulaLexer(String input)
    {
        this.input = input;
    }

    /**
     * Tokenizes a formula; the returned list always ends with an {@link TokenType#EOF} token.
     *
     * @throws FormulaSyntaxException on a character that starts no token
     */
    public static List<Token> tokenize(String input)
    {
        return new FormulaLexer(input).run();
    }

    private List<Token> run()
    {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next()
    {
        int start = pos;
        char c = input.charAt(pos);

        if (isWordChar(c)) {
            while (pos < input.length() && isWordChar(input.charAt(pos))) {
                pos++;
            }
            String word = input.substring(start, pos);
            TokenType keyword = KEYWORDS.get(word);
            if (keyword != null) {
                return new Token(keyword, word, start);
            }
            if (TEMPORAL_OPERATORS.contains(word)) {
                return new Token(TokenType.TEMPORAL, word, start);
            }
            return new Token(TokenType.ATOM, word, start);
        }

        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '~':
                pos++;
                return new Token(TokenType.NOT, "~", start);
            case '&':
                return symbol(TokenType.AND, "&&", "&");
            case '|':
                return symbol(TokenType.OR, "||", "|");
            case '-':
                if (input.startsWith("-->", pos)) {
                    pos += 3;
                    return new Token(TokenType.IMPLIES, "-->", start);
                }
                if (input.startsWith("->", pos)) {
                    pos += 2;
                    return new Token(TokenType.IMPLIES, "->", start);
                }
                break;
            default:
                break;
        }
        throw FormulaSyntaxException.unexpected("character '" + c + "'", start,
                "an operator, an atomic proposition or a parenthesis");
    }

    private Token symbol(TokenType type, String doubled, String single)
    {
        int start = pos;
        String text = input.startsWith(doubled, pos) ? doubled : single;
        pos += text.length();
        return new Token(type, text, start);
    }

    private void skipWhitespace()
    {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isWordChar(char c)
    {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
