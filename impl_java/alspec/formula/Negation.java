package alspec.formula;

import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.Set;

public record Negation(Formula formula) implements Formula {
    public Negation {
        Preconditions.checkNotNull(formula, "formula");
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }

    @Override
    public String toString() {
        return "¬" + formula;
    }
}
