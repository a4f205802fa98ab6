package alspec.formula;

import alspec.term.Term;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.Set;

/**
 * Asserts that a term is defined. Only meaningful for terms that involve partial functions.
 */
public record Definedness(Term term) implements Formula {
    public Definedness {
        Preconditions.checkNotNull(term, "term");
    }

    @Override
    public Set<Variable> freeVars() {
        return term.vars();
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitDefinedness(this);
    }

    @Override
    public String toString() {
        return "def " + term;
    }
}
