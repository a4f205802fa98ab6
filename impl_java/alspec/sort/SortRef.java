package alspec.sort;

import com.google.common.base.Preconditions;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * The name of a sort. Used wherever a sort is referenced so that "this string
 * denotes a sort" is a fact the type system can see.
 */
public record SortRef(String name) {
    private static final Interner<SortRef> INTERNER = Interners.newWeakInterner();

    public SortRef {
        Preconditions.checkNotNull(name, "sort name");
        Preconditions.checkArgument(!name.isBlank(), "sort name must not be blank");
    }

    public static SortRef of(String name) {
        return INTERNER.intern(new SortRef(name));
    }

    @Override
    public String toString() {
        return name;
    }
}
