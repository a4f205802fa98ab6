package alspec.formula;

import alspec.term.Variable;

public record ExistentialQuantifier(Variable bound, Formula body) implements Quantifier {
    public ExistentialQuantifier {
        Quantifier.checkBinding(bound, body);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitExistential(this);
    }

    @Override
    public String toString() {
        return String.format("∃%s:%s • %s", bound.name(), bound.sort(), body);
    }
}
