package alspec.term;

import alspec.SpecException;
import alspec.signature.Signature;
import alspec.sort.ProductSort;
import alspec.sort.Sort;
import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.Set;

/**
 * Projection of a named field out of a product-sorted term, e.g. {@code p.fst}.
 */
public final class FieldAccess implements Term {
    private final Term base;
    private final String field;
    private final SortRef sort;

    private FieldAccess(Term base, String field, SortRef sort) {
        this.base = base;
        this.field = field;
        this.sort = sort;
    }

    public static FieldAccess of(Signature signature, Term base, String field) {
        Preconditions.checkNotNull(base, "base");
        Preconditions.checkNotNull(field, "field");
        Sort baseSort = signature.sort(base.sort())
                .orElseThrow(() -> SpecException.unknownSort(base.sort().name(), "field access ." + field));
        if (!(baseSort instanceof ProductSort product)) {
            throw SpecException.unknownField(field, base.sort().name());
        }
        SortRef fieldSort = product.fieldSort(field)
                .orElseThrow(() -> SpecException.unknownField(field, base.sort().name()));
        return new FieldAccess(base, field, fieldSort);
    }

    public Term base() {
        return base;
    }

    public String field() {
        return field;
    }

    @Override
    public SortRef sort() {
        return sort;
    }

    @Override
    public Set<Variable> vars() {
        return base.vars();
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitFieldAccess(this);
    }

    @Override
    public String toString() {
        return base + "." + field;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof FieldAccess other)) return false;
        return base.equals(other.base) && field.equals(other.field) && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, field, sort);
    }
}
