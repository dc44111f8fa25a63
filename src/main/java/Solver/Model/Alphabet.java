package Solver.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

/**
 * Immutable, duplicate-free and ordered set of input symbols.
 * The position of a symbol is the column index used by the classifier and the minimizer.
 * @param <I> - Input symbol type, e.g., Character
 */
public final class Alphabet<I> implements Iterable<I> {
    public static final int MISSING_SYMBOL = -1;

    private static final Alphabet<?> EMPTY = new Alphabet<>(Collections.emptyList());

    private final List<I> symbols;
    private final Object2IntMap<I> symbolIndex;

    private Alphabet(List<I> symbols) {
        this.symbols = Collections.unmodifiableList(symbols);
        this.symbolIndex = new Object2IntOpenHashMap<>(symbols.size());
        this.symbolIndex.defaultReturnValue(MISSING_SYMBOL);
        for (int i = 0; i < symbols.size(); i++) {
            this.symbolIndex.put(symbols.get(i), i);
        }
    }

    /**
     * The canonical empty alphabet. Every empty construction returns this instance.
     */
    @SuppressWarnings("unchecked")
    public static <I> Alphabet<I> empty() {
        return (Alphabet<I>) EMPTY;
    }

    /**
     * Creates an alphabet from the given symbols, dropping duplicates but keeping first-occurrence order.
     * @param symbols - symbols, may be null
     * @return - the alphabet, or {@link #empty()} if there are no symbols
     * @param <I> - Input symbol type
     */
    public static <I> Alphabet<I> create(Iterable<? extends I> symbols) {
        if (symbols == null) {
            return empty();
        }
        final List<I> distinct = new ArrayList<>();
        final Set<I> seen = new ObjectOpenHashSet<>();
        for (I symbol : symbols) {
            Objects.requireNonNull(symbol, "symbol");
            if (seen.add(symbol)) {
                distinct.add(symbol);
            }
        }
        if (distinct.isEmpty()) {
            return empty();
        }
        return new Alphabet<>(distinct);
    }

    @SafeVarargs
    public static <I> Alphabet<I> of(I... symbols) {
        return symbols == null ? empty() : create(List.of(symbols));
    }

    public boolean contains(I symbol) {
        return symbolIndex.containsKey(symbol);
    }

    /**
     * @return index of the symbol, or {@link #MISSING_SYMBOL}
     */
    public int indexOf(I symbol) {
        return symbolIndex.getInt(symbol);
    }

    public I getSymbol(int index) {
        return symbols.get(index);
    }

    public List<I> getSymbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    @Override
    public Iterator<I> iterator() {
        return symbols.iterator();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
