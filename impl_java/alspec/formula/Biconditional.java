package alspec.formula;

import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Set;

public record Biconditional(Formula left, Formula right) implements Formula {
    public Biconditional {
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
        return visitor.visitBiconditional(this);
    }

    @Override
    public String toString() {
        return "(" + left + " ⇔ " + right + ")";
    }
}
