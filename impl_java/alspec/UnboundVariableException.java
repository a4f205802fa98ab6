package alspec;

import alspec.term.Variable;

public class UnboundVariableException extends SpecException {

    private final Variable variable;
    private final int axiomIndex;
    private final String axiomLabel;

    public UnboundVariableException(Variable variable, int axiomIndex, String axiomLabel) {
        super(Kind.UNBOUND_VARIABLE, variable.name(),
                String.format("Variable '%s' in axiom %d (%s) is not bound by any quantifier",
                        variable, axiomIndex, axiomLabel));
        this.variable = variable;
        this.axiomIndex = axiomIndex;
        this.axiomLabel = axiomLabel;
    }

    public Variable variable() {
        return variable;
    }

    public int axiomIndex() {
        return axiomIndex;
    }

    public String axiomLabel() {
        return axiomLabel;
    }
}
