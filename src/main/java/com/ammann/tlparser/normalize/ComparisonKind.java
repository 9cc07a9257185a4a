package com.ammann.tlparser.normalize;

import com.ammann.tlparser.analysis.OperatorKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators that are folded into atomic propositions during normalization.
 *
 * <p>Declared in column order of the exported {@code stats.cops.*} fields.
 */
public enum ComparisonKind implements OperatorKind
{
    /** Equal, {@code ==} */
    EQ("eq", "=="),
    /** Greater than or equal, {@code >=} */
    GEQ("geq", ">="),
    /** Greater than, {@code >} */
    GT("gt", ">"),
    /** Less than or equal, {@code <=} */
    LEQ("leq", "<="),
    /** Less than, {@code <} */
    LT("lt", "<"),
    /** Not equal, {@code !=} */
    NEQ("neq", "!=");

    private final String key;
    private final String symbol;

    ComparisonKind(String key, String symbol)
    {
        this.key = key;
        this.symbol = symbol;
    }

    @Override
    public String key()
    {
        return key;
    }

    public String symbol()
    {
        return symbol;
    }

    /**
     * Looks up the kind for an operator symbol such as {@code <=}.
     */
    public static Optional<ComparisonKind> fromSymbol(String symbol)
    {
        return Arrays.stream(values()).filter(k -> k.symbol.equals(symbol)).findFirst();
    }
}
