package alspec.signature;

import alspec.SpecException;
import alspec.SpecException.Kind;
import alspec.sort.Sort;
import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A many-sorted signature Σ = (S, F, P). Immutable; each {@code declare*} returns a new signature.
 */
public final class Signature {
    private static final Signature EMPTY = new Signature(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(),
            ImmutableMap.of());

    private final ImmutableMap<SortRef, Sort> sorts;
    private final ImmutableMap<String, FunctionSymbol> functions;
    private final ImmutableMap<String, PredicateSymbol> predicates;
    private final ImmutableMap<SortRef, GeneratedSortInfo> generatedSorts;

    private Signature(ImmutableMap<SortRef, Sort> sorts, ImmutableMap<String, FunctionSymbol> functions,
            ImmutableMap<String, PredicateSymbol> predicates, ImmutableMap<SortRef, GeneratedSortInfo> generatedSorts) {
        this.sorts = sorts;
        this.functions = functions;
        this.predicates = predicates;
        this.generatedSorts = generatedSorts;
    }

    public static Signature empty() {
        return EMPTY;
    }

    public Signature declareSort(Sort sort) {
        Preconditions.checkNotNull(sort, "sort");
        if (sorts.containsKey(sort.name())) {
            throw SpecException.duplicate(Kind.DUPLICATE_SORT, sort.name().name(), "the sort table");
        }
        for (SortRef ref : sort.references()) {
            if (!sorts.containsKey(ref)) {
                throw SpecException.unknownSort(ref.name(), sort.name().name());
            }
        }
        return new Signature(append(sorts, sort.name(), sort), functions, predicates, generatedSorts);
    }

    public Signature declareFunction(FunctionSymbol function) {
        Preconditions.checkNotNull(function, "function");
        checkFreshSymbol(function.name());
        checkDeclared(function.argumentSorts(), function.name());
        checkDeclared(List.of(function.result()), function.name());
        return new Signature(sorts, append(functions, function.name(), function), predicates, generatedSorts);
    }

    public Signature declarePredicate(PredicateSymbol predicate) {
        Preconditions.checkNotNull(predicate, "predicate");
        checkFreshSymbol(predicate.name());
        checkDeclared(predicate.argumentSorts(), predicate.name());
        return new Signature(sorts, functions, append(predicates, predicate.name(), predicate), generatedSorts);
    }

    public Signature declareGeneratedSort(SortRef sort, GeneratedSortInfo info) {
        Preconditions.checkNotNull(sort, "sort");
        Preconditions.checkNotNull(info, "info");
        if (!sorts.containsKey(sort)) {
            throw SpecException.unknownSort(sort.name(), "generated sort info");
        }
        if (generatedSorts.containsKey(sort)) {
            throw SpecException.duplicate(Kind.DUPLICATE_GENERATED_SORT, sort.name(), "the generated sort table");
        }
        Set<String> seen = new HashSet<>();
        for (String constructor : info.constructors()) {
            if (!seen.add(constructor)) {
                throw SpecException.duplicate(Kind.DUPLICATE_SYMBOL, constructor, "the constructors of " + sort);
            }
            FunctionSymbol function = functions.get(constructor);
            if (function == null) {
                throw SpecException.unknownFunction(constructor);
            }
            if (!function.result().equals(sort)) {
                throw SpecException.wrongResultSort(constructor, sort.name(), function.result().name());
            }
        }
        for (var entry : info.selectors().entrySet()) {
            String constructor = entry.getKey();
            if (!info.isConstructor(constructor)) {
                throw new SpecException(Kind.UNKNOWN_FUNCTION, constructor,
                        String.format("Selectors given for '%s', which is not a constructor of %s", constructor, sort));
            }
            for (var selector : entry.getValue().entrySet()) {
                checkSelector(constructor, selector.getKey(), selector.getValue());
            }
        }
        return new Signature(sorts, functions, predicates, append(generatedSorts, sort, info));
    }

    private void checkSelector(String constructor, String selector, SortRef selectorSort) {
        if (!sorts.containsKey(selectorSort)) {
            throw SpecException.unknownSort(selectorSort.name(), selector);
        }
        FunctionSymbol function = functions.get(selector);
        if (function != null) {
            if (!function.result().equals(selectorSort)) {
                throw SpecException.wrongResultSort(selector, selectorSort.name(), function.result().name());
            }
        } else if (!predicates.containsKey(selector)) {
            throw SpecException.unknownObserver(selector, constructor);
        }
    }

    private void checkFreshSymbol(String name) {
        if (functions.containsKey(name) || predicates.containsKey(name)) {
            throw SpecException.duplicate(Kind.DUPLICATE_SYMBOL, name, "the symbol table");
        }
    }

    private void checkDeclared(List<SortRef> profile, String referrer) {
        for (SortRef ref : profile) {
            if (!sorts.containsKey(ref)) {
                throw SpecException.unknownSort(ref.name(), referrer);
            }
        }
    }

    private static <K, V> ImmutableMap<K, V> append(ImmutableMap<K, V> map, K key, V value) {
        return ImmutableMap.<K, V>builderWithExpectedSize(map.size() + 1).putAll(map).put(key, value).buildOrThrow();
    }

    public Map<SortRef, Sort> sorts() {
        return sorts;
    }

    public Map<String, FunctionSymbol> functions() {
        return functions;
    }

    public Map<String, PredicateSymbol> predicates() {
        return predicates;
    }

    public Map<SortRef, GeneratedSortInfo> generatedSorts() {
        return generatedSorts;
    }

    public Optional<Sort> sort(SortRef name) {
        return Optional.ofNullable(sorts.get(name));
    }

    public Optional<FunctionSymbol> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<PredicateSymbol> predicate(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    public Optional<GeneratedSortInfo> generatedSort(SortRef name) {
        return Optional.ofNullable(generatedSorts.get(name));
    }

    public boolean isDeclared(SortRef name) {
        return sorts.containsKey(name);
    }

    public boolean isGenerated(SortRef name) {
        return generatedSorts.containsKey(name);
    }

    /**
     * Constructor symbols of a generated sort, in declaration order; empty for any other sort.
     */
    public List<FunctionSymbol> constructorsOf(SortRef name) {
        GeneratedSortInfo info = generatedSorts.get(name);
        if (info == null) return List.of();
        return info.constructors().stream().map(functions::get).toList();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Signature other)) return false;
        return ordered(sorts).equals(ordered(other.sorts)) && ordered(functions).equals(ordered(other.functions))
                && ordered(predicates).equals(ordered(other.predicates))
                && ordered(generatedSorts).equals(ordered(other.generatedSorts));
    }

    // Declaration order is part of a signature's identity.
    private static <K, V> List<Map.Entry<K, V>> ordered(ImmutableMap<K, V> table) {
        return table.entrySet().asList();
    }

    @Override
    public int hashCode() {
        return Objects.hash(sorts, functions, predicates, generatedSorts);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        for (Sort sort : sorts.values()) {
            out.append("sort ").append(sort);
            GeneratedSortInfo info = generatedSorts.get(sort.name());
            if (info != null) out.append(" ").append(info);
            out.append('\n');
        }
        for (FunctionSymbol function : functions.values()) out.append("op ").append(function).append('\n');
        for (PredicateSymbol predicate : predicates.values()) out.append(predicate).append('\n');
        return out.toString();
    }
}
