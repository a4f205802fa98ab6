package alspec.formula;

import alspec.term.Variable;

public record UniversalQuantifier(Variable bound, Formula body) implements Quantifier {
    public UniversalQuantifier {
        Quantifier.checkBinding(bound, body);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUniversal(this);
    }

    @Override
    public String toString() {
        return String.format("∀%s:%s • %s", bound.name(), bound.sort(), body);
    }
}
