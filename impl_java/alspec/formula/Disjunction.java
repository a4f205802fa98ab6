package alspec.formula;

import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Set;

public record Disjunction(Formula left, Formula right) implements Formula {
    public Disjunction {
        Preconditions.checkNotNull(left, "left");
        Preconditions.checkNotNull(right, "right");
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new LinkedHashSet<>(left.freeVars());
        out.addAll(right.freeVars());
        return out;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitDisjunction(this);
    }

    @Override
    public String toString() {
        return "(" + left + " ∨ " + right + ")";
    }
}
