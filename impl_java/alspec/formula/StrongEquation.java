package alspec.formula;

import alspec.term.Term;

public record StrongEquation(Term left, Term right) implements Equation {
    public StrongEquation {
        Equation.checkSorts(Kind.STRONG, left, right);
    }

    @Override
    public Kind kind() {
        return Kind.STRONG;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitStrongEquation(this);
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
