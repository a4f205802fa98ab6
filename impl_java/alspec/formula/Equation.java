package alspec.formula;

import alspec.SortMismatchException;
import alspec.term.Term;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An equation between two terms of the same sort. The two kinds differ on
 * undefined operands: a strong equation also holds when both sides are
 * undefined, an existential one only when both are defined and equal.
 */
public sealed interface Equation extends Formula permits StrongEquation, ExistentialEquation {

    enum Kind {
        STRONG("strong"),
        EXISTENTIAL("existential");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    Term left();

    Term right();

    Kind kind();

    @Override
    default Set<Variable> freeVars() {
        Set<Variable> out = new LinkedHashSet<>(left().vars());
        out.addAll(right().vars());
        return out;
    }

    static void checkSorts(Kind kind, Term left, Term right) {
        Preconditions.checkNotNull(left, "left");
        Preconditions.checkNotNull(right, "right");
        if (!left.sort().equals(right.sort())) {
            throw new SortMismatchException(kind.tag() + " equation " + left + " = " + right,
                    SortMismatchException.NO_POSITION, left.sort(), right.sort());
        }
    }
}
