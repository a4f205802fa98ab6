package alspec.formula;

import alspec.SpecException;
import alspec.signature.PredicateSymbol;
import alspec.signature.Signature;
import alspec.term.Application;
import alspec.term.Term;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class PredicateApplication implements Formula {
    private final String predicate;
    private final ImmutableList<Term> args;

    private PredicateApplication(String predicate, ImmutableList<Term> args) {
        this.predicate = predicate;
        this.args = args;
    }

    public static PredicateApplication of(Signature signature, String predicate, List<? extends Term> args) {
        Preconditions.checkNotNull(predicate, "predicate");
        PredicateSymbol symbol = signature.predicate(predicate)
                .orElseThrow(() -> SpecException.unknownPredicate(predicate));
        ImmutableList<Term> arguments = ImmutableList.copyOf(args);
        Application.checkArguments(predicate, symbol.argumentSorts(), arguments);
        return new PredicateApplication(predicate, arguments);
    }

    public String predicate() {
        return predicate;
    }

    public List<Term> args() {
        return args;
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new LinkedHashSet<>();
        for (Term arg : args) out.addAll(arg.vars());
        return out;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitPredicateApplication(this);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return predicate;
        return predicate + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof PredicateApplication other)) return false;
        return predicate.equals(other.predicate) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, args);
    }
}
