package alspec.sort;

import java.util.List;

/**
 * A sort declaration. Sorts are declared once in a signature and referenced
 * everywhere else through their {@link SortRef}.
 */
public sealed interface Sort permits AtomicSort, ProductSort, CoproductSort {
    SortRef name();

    /**
     * Sorts this declaration refers to, in declaration order. They must already
     * be declared when this sort is added to a signature.
     */
    List<SortRef> references();

    <R> R accept(SortVisitor<R> visitor);
}
