package alspec.signature;

import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Marks a sort as generated by a finite set of constructors and records, per
 * constructor, which observers simply project one of its arguments (selectors).
 * <p>
 * This has no effect on how terms are built. It is the input for deriving the
 * observer × constructor axiom obligations of a specification.
 *
 * @param constructors constructor function names, in declaration order
 * @param selectors    constructor name → (selector name → selector sort)
 */
public record GeneratedSortInfo(List<String> constructors, Map<String, Map<String, SortRef>> selectors) {
    public GeneratedSortInfo {
        constructors = ImmutableList.copyOf(constructors);
        ImmutableMap.Builder<String, Map<String, SortRef>> copy = ImmutableMap.builder();
        for (var entry : selectors.entrySet()) {
            copy.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
        }
        selectors = copy.buildOrThrow();
    }

    public GeneratedSortInfo(List<String> constructors) {
        this(constructors, Map.of());
    }

    public Map<String, SortRef> selectorsOf(String constructor) {
        Preconditions.checkNotNull(constructor, "constructor");
        return selectors.getOrDefault(constructor, Map.of());
    }

    public boolean isConstructor(String function) {
        return constructors.contains(function);
    }

    @Override
    public String toString() {
        return "generated by " + String.join(" | ", constructors) + (selectors.isEmpty() ? "" : " selectors " + selectors);
    }
}
