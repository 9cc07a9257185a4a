package com.ammann.tlparser.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable tally of one operator family, with an entry for every kind of the family.
 *
 * <p>Serializes as a flat JSON object keyed by {@link OperatorKind#key()} in declaration
 * order, e.g. {@code {"and":1,"impl":1,"not":1,"or":1}}.
 *
 * @param <K> kind enum of the family
 */
public final class OperatorCounts<K extends Enum<K> & OperatorKind>
{
    private final Map<K, Integer> counts;

    private OperatorCounts(Map<K, Integer> counts)
    {
        this.counts = Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    /**
     * Counts of a family where every kind is zero.
     */
    public static <K extends Enum<K> & OperatorKind> OperatorCounts<K> zero(Class<K> family)
    {
        return builder(family).build();
    }

    public static <K extends Enum<K> & OperatorKind> Builder<K> builder(Class<K> family)
    {
        return new Builder<>(family);
    }

    public int get(K kind)
    {
        return counts.get(kind);
    }

    /**
     * Sum over all kinds of the family.
     */
    public int total()
    {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Count values in kind declaration order, zeros included.
     */
    public Collection<Integer> values()
    {
        return counts.values();
    }

    /**
     * Counts keyed by column key, in kind declaration order.
     */
    @JsonValue
    public Map<String, Integer> asMap()
    {
        Map<String, Integer> byKey = new LinkedHashMap<>();
        counts.forEach((kind, count) -> byKey.put(kind.key(), count));
        return byKey;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof OperatorCounts<?> that)) return false;
        return counts.equals(that.counts);
    }

    @Override
    public int hashCode()
    {
        return counts.hashCode();
    }

    @Override
    public String toString()
    {
        return asMap().toString();
    }

    /**
     * Mutable tally used while traversing one syntax tree.
     */
    public static final class Builder<K extends Enum<K> & OperatorKind>
    {
        private final EnumMap<K, Integer> counts;

        private Builder(Class<K> family)
        {
            counts = new EnumMap<>(family);
            for (K kind : family.getEnumConstants()) {
                counts.put(kind, 0);
            }
        }

        public Builder<K> increment(K kind, int amount)
        {
            counts.merge(kind, amount, Integer::sum);
            return this;
        }

        public Builder<K> increment(K kind)
        {
            return increment(kind, 1);
        }

        public OperatorCounts<K> build()
        {
            return new OperatorCounts<>(counts);
        }
    }
}
