package in.tradewell.domain.session;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, duplicate-free set of instrument symbols handled in this session.
 *
 * Instances are immutable. Use {@link Builder} to merge the symbol sources.
 */
public final class InstrumentUniverse implements Iterable<String> {

    private final Set<String> symbols;

    private InstrumentUniverse(LinkedHashSet<String> symbols) {
        this.symbols = Collections.unmodifiableSet(symbols);
    }

    public static InstrumentUniverse of(Collection<String> symbols) {
        return builder().addAll(symbols).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public boolean contains(String symbol) {
        return symbols.contains(symbol);
    }

    public List<String> asList() {
        return List.copyOf(symbols);
    }

    @Override
    public Iterator<String> iterator() {
        return symbols.iterator();
    }

    @Override
    public String toString() {
        return "InstrumentUniverse" + symbols;
    }

    /**
     * Collects symbols in first-seen order. Blank symbols and repeats are dropped.
     */
    public static final class Builder {
        private final LinkedHashSet<String> symbols = new LinkedHashSet<>();

        public Builder add(String symbol) {
            if (symbol != null && !symbol.isBlank()) {
                symbols.add(symbol.trim().toUpperCase());
            }
            return this;
        }

        public Builder addAll(Collection<String> more) {
            for (String symbol : more) {
                add(symbol);
            }
            return this;
        }

        public int size() {
            return symbols.size();
        }

        public InstrumentUniverse build() {
            return new InstrumentUniverse(new LinkedHashSet<>(symbols));
        }
    }
}
