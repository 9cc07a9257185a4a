package com.ammann.tlparser.parser;

import com.ammann.tlparser.analysis.TemporalKind;
import com.ammann.tlparser.exception.FormulaSyntaxException;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for parsable temporal-logic formulas.
 *
 * <p>Binding strength, lowest first:
 * <ol>
 *   <li>{@code -->} (right associative)</li>
 *   <li>{@code or} (chains collected into one node)</li>
 *   <li>{@code and} (chains collected into one node)</li>
 *   <li>{@code U}, {@code R} (non-associative, {@code a U b U c} needs parentheses)</li>
 *   <li>{@code not}, {@code F}, {@code G}, {@code X}, {@code A}, {@code E} (prefix)</li>
 *   <li>atomic propositions and parenthesized formulas</li>
 * </ol>
 *
 * <p>Single pass over the token list, one token of lookahead, no backtracking.
 */
@ApplicationScoped
public class FormulaParser
{

    /**
     * Parses a formula whose comparisons have already been normalized.
     *
     * @param formula parsable formula
     * @return root of the syntax tree
     * @throws FormulaSyntaxException if the formula is empty or malformed
     */
    public FormulaNode parse(String formula)
    {
        if (formula == null || formula.isBlank()) {
            throw FormulaSyntaxException.emptyFormula();
        }
        return new Cursor(FormulaLexer.tokenize(formula)).parseFormula();
    }

    /**
     * Token cursor holding the state of one parse.
     */
    private static final class Cursor
    {
        private static final String OPERAND = "an atomic proposition, a unary operator or '('";

        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens)
        {
            this.tokens = tokens;
        }

        FormulaNode parseFormula()
        {
            FormulaNode root = parseImplies();
            Token trailing = peek();
            if (!trailing.is(TokenType.EOF)) {
                String expected = trailing.is(TokenType.RPAREN)
                        ? "end of formula, parentheses are unbalanced"
                        : "end of formula or a binary operator";
                throw FormulaSyntaxException.unexpected(trailing.describe(), trailing.position(), expected);
            }
            return root;
        }

        private FormulaNode parseImplies()
        {
            FormulaNode left = parseOr();
            if (peek().is(TokenType.IMPLIES)) {
                advance();
                return FormulaNode.binary(NodeKind.IMPLIES, left, parseImplies());
            }
            return left;
        }

        private FormulaNode parseOr()
        {
            List<FormulaNode> operands = new ArrayList<>();
            operands.add(parseAnd());
            while (peek().is(TokenType.OR)) {
                advance();
                operands.add(parseAnd());
            }
            return operands.size() == 1 ? operands.get(0) : FormulaNode.nary(NodeKind.OR, operands);
        }

        private FormulaNode parseAnd()
        {
            List<FormulaNode> operands = new ArrayList<>();
            operands.add(parseBinaryTemporal());
            while (peek().is(TokenType.AND)) {
                advance();
                operands.add(parseBinaryTemporal());
            }
            return operands.size() == 1 ? operands.get(0) : FormulaNode.nary(NodeKind.AND, operands);
        }

        private FormulaNode parseBinaryTemporal()
        {
            FormulaNode left = parseUnary();
            Token next = peek();
            if (next.isTemporal("U") || next.isTemporal("R")) {
                advance();
                NodeKind kind = NodeKind.ofTemporal(TemporalKind.valueOf(next.text()));
                return FormulaNode.binary(kind, left, parseUnary());
            }
            return left;
        }

        private FormulaNode parseUnary()
        {
            Token token = peek();
            if (token.is(TokenType.NOT)) {
                advance();
                return FormulaNode.unary(NodeKind.NOT, parseUnary());
            }
            if (token.is(TokenType.TEMPORAL)) {
                NodeKind kind = NodeKind.ofTemporal(TemporalKind.valueOf(token.text()));
                if (kind.arity() != NodeKind.Arity.UNARY) {
                    throw FormulaSyntaxException.unexpected(
                            "binary operator " + token.describe(), token.position(), OPERAND);
                }
                advance();
                return FormulaNode.unary(kind, parseUnary());
            }
            return parsePrimary();
        }

        private FormulaNode parsePrimary()
        {
            Token token = advance();
            switch (token.type()) {
                case ATOM:
                    return FormulaNode.atom(token.text());
                case LPAREN:
                    FormulaNode inner = parseImplies();
                    Token closing = advance();
                    if (!closing.is(TokenType.RPAREN)) {
                        throw FormulaSyntaxException.unexpected(closing.describe(), closing.position(),
                                "')' to close '(' at position " + token.position());
                    }
                    return inner;
                case EOF:
                    throw FormulaSyntaxException.unexpected("end of formula, operand is missing",
                            token.position(), OPERAND);
                default:
                    throw FormulaSyntaxException.unexpected(token.describe(), token.position(), OPERAND);
            }
        }

        private Token peek()
        {
            return tokens.get(index);
        }

        private Token advance()
        {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }
    }
}
