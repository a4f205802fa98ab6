package alspec.formula;

import alspec.term.Variable;
import java.util.Set;

/**
 * A formula denoting a truth value. Formulas and terms are distinct kinds:
 * connectives only ever hold formulas, and terms appear only as equation
 * operands, predicate arguments and definedness operands.
 */
public sealed interface Formula
        permits Equation, PredicateApplication, Negation, Conjunction, Disjunction, Implication, Biconditional,
        Quantifier, Definedness {

    /**
     * Get the variables occurring free in the formula, in order of first occurrence
     * @return free variables of the formula
     */
    Set<Variable> freeVars();

    <R> R accept(FormulaVisitor<R> visitor);
}
