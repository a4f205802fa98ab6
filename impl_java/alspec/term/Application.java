package alspec.term;

import alspec.SortMismatchException;
import alspec.SpecException;
import alspec.signature.FunctionSymbol;
import alspec.signature.Signature;
import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A function symbol applied to arguments, e.g. {@code push(s, e)}. A constant
 * is an application with no arguments.
 */
public final class Application implements Term {
    private final String function;
    private final ImmutableList<Term> args;
    private final SortRef sort;

    private Application(String function, ImmutableList<Term> args, SortRef sort) {
        this.function = function;
        this.args = args;
        this.sort = sort;
    }

    /**
     * Applies {@code function} to {@code args}. Arguments are matched against the
     * profile left to right and the first mismatching position is reported.
     */
    public static Application of(Signature signature, String function, List<? extends Term> args) {
        Preconditions.checkNotNull(function, "function");
        FunctionSymbol symbol = signature.function(function)
                .orElseThrow(() -> SpecException.unknownFunction(function));
        ImmutableList<Term> arguments = ImmutableList.copyOf(args);
        checkArguments(function, symbol.argumentSorts(), arguments);
        return new Application(function, arguments, symbol.result());
    }

    /**
     * Checks {@code args} against a symbol profile: arity first, then each position in order.
     */
    public static void checkArguments(String symbol, List<SortRef> profile, List<Term> args) {
        if (profile.size() != args.size()) {
            throw SpecException.arityMismatch(symbol, profile.size(), args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            SortRef actual = args.get(i).sort();
            if (!actual.equals(profile.get(i))) {
                throw new SortMismatchException(symbol, i, profile.get(i), actual);
            }
        }
    }

    public String function() {
        return function;
    }

    public List<Term> args() {
        return args;
    }

    public boolean isConstant() {
        return args.isEmpty();
    }

    @Override
    public SortRef sort() {
        return sort;
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = new LinkedHashSet<>();
        for (Term arg : args) out.addAll(arg.vars());
        return out;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitApplication(this);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return function;
        return function + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Application other)) return false;
        return function.equals(other.function) && args.equals(other.args) && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, args, sort);
    }
}
