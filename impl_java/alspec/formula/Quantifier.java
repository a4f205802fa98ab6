package alspec.formula;

import alspec.SortMismatchException;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A binder over one variable. The bound name shadows any outer binder of the
 * same name inside the body, so every free occurrence of that name in the body
 * must carry the bound sort.
 */
public sealed interface Quantifier extends Formula permits UniversalQuantifier, ExistentialQuantifier {
    Variable bound();

    Formula body();

    @Override
    default Set<Variable> freeVars() {
        Set<Variable> out = new LinkedHashSet<>(body().freeVars());
        out.removeIf(v -> v.name().equals(bound().name()));
        return out;
    }

    static void checkBinding(Variable bound, Formula body) {
        Preconditions.checkNotNull(bound, "bound variable");
        Preconditions.checkNotNull(body, "body");
        for (Variable free : body.freeVars()) {
            if (free.name().equals(bound.name()) && !free.sort().equals(bound.sort())) {
                throw new SortMismatchException("occurrence of bound variable " + bound.name(),
                        SortMismatchException.NO_POSITION, bound.sort(), free.sort());
            }
        }
    }
}
