package alspec.formula;

import alspec.term.Term;

public record ExistentialEquation(Term left, Term right) implements Equation {
    public ExistentialEquation {
        Equation.checkSorts(Kind.EXISTENTIAL, left, right);
    }

    @Override
    public Kind kind() {
        return Kind.EXISTENTIAL;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitExistentialEquation(this);
    }

    @Override
    public String toString() {
        return left + " =e= " + right;
    }
}
