package alspec.term;

import alspec.SpecException;
import alspec.signature.Signature;
import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A variable of a declared sort. Whether an occurrence is bound is decided by
 * the enclosing quantifiers, not by the variable itself.
 */
public final class Variable implements Term {
    private final String name;
    private final SortRef sort;

    private Variable(String name, SortRef sort) {
        this.name = name;
        this.sort = sort;
    }

    public static Variable of(Signature signature, String name, SortRef sort) {
        Preconditions.checkNotNull(name, "variable name");
        Preconditions.checkNotNull(sort, "variable sort");
        if (!signature.isDeclared(sort)) {
            throw SpecException.unknownSort(sort.name(), "variable " + name);
        }
        return new Variable(name, sort);
    }

    public String name() {
        return name;
    }

    @Override
    public SortRef sort() {
        return sort;
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = new LinkedHashSet<>();
        out.add(this);
        return out;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Variable other)) return false;
        return name.equals(other.name) && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sort);
    }
}
