package com.ammann.tlparser.parser;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A node of the formula syntax tree: a kind tag plus its children.
 *
 * <p>Atoms carry a name and no children. {@code AND} and {@code OR} hold every operand of
 * an unparenthesized chain, so {@code a and b and c} is one node with three children.
 * Nodes are immutable and compare structurally.
 *
 * @param kind     node tag
 * @param name     atomic proposition name, {@code null} for operators
 * @param children operands in source order
 */
public record FormulaNode(NodeKind kind, String name, List<FormulaNode> children)
{
    public FormulaNode
    {
        Objects.requireNonNull(kind, "kind");
        children = List.copyOf(children);
        int size = children.size();
        boolean valid = switch (kind.arity()) {
            case LEAF -> size == 0 && name != null;
            case UNARY -> size == 1;
            case BINARY -> size == 2;
            case NARY -> size >= 2;
        };
        if (!valid) {
            throw new IllegalArgumentException(
                    String.format("%s node cannot hold %d children", kind, size));
        }
    }

    public static FormulaNode atom(String name)
    {
        return new FormulaNode(NodeKind.ATOM, name, List.of());
    }

    public static FormulaNode unary(NodeKind kind, FormulaNode child)
    {
        return new FormulaNode(kind, null, List.of(child));
    }

    public static FormulaNode binary(NodeKind kind, FormulaNode left, FormulaNode right)
    {
        return new FormulaNode(kind, null, List.of(left, right));
    }

    public static FormulaNode nary(NodeKind kind, List<FormulaNode> operands)
    {
        return new FormulaNode(kind, null, operands);
    }

    public boolean isAtom()
    {
        return kind == NodeKind.ATOM;
    }

    /**
     * Renders the tree in canonical form: binary and chained operators are parenthesized,
     * unary temporal operators wrap their operand. Parsing the result yields an equal tree.
     */
    public String toFormulaString()
    {
        return switch (kind) {
            case ATOM -> name;
            case NOT -> "not " + children.get(0).toFormulaString();
            case AND -> join(" and ");
            case OR -> join(" or ");
            case IMPLIES -> join(" --> ");
            case UNTIL -> join(" U ");
            case RELEASE -> join(" R ");
            case FINALLY, GLOBALLY, NEXT, FOR_ALL, EXISTS -> prefix(kind.temporalKind().key());
        };
    }

    private String join(String separator)
    {
        return children.stream()
                .map(FormulaNode::toFormulaString)
                .collect(Collectors.joining(separator, "(", ")"));
    }

    private String prefix(String operator)
    {
        FormulaNode child = children.get(0);
        String operand = child.toFormulaString();
        return child.kind.arity() == NodeKind.Arity.BINARY || child.kind.arity() == NodeKind.Arity.NARY
                ? operator + operand
                : operator + "(" + operand + ")";
    }

    @Override
    public String toString()
    {
        return toFormulaString();
    }
}
