package alspec.formula;

import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Set;

public record Implication(Formula antecedent, Formula consequent) implements Formula {
    public Implication {
        Preconditions.checkNotNull(antecedent, "antecedent");
        Preconditions.checkNotNull(consequent, "consequent");
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new LinkedHashSet<>(antecedent.freeVars());
        out.addAll(consequent.freeVars());
        return out;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitImplication(this);
    }

    @Override
    public String toString() {
        return "(" + antecedent + " ⇒ " + consequent + ")";
    }
}
