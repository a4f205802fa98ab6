package alspec.formula;

/**
 * One method per concrete formula variant. Adding a variant breaks every implementation.
 */
public interface FormulaVisitor<R> {
    R visitStrongEquation(StrongEquation equation);

    R visitExistentialEquation(ExistentialEquation equation);

    R visitPredicateApplication(PredicateApplication application);

    R visitNegation(Negation negation);

    R visitConjunction(Conjunction conjunction);

    R visitDisjunction(Disjunction disjunction);

    R visitImplication(Implication implication);

    R visitBiconditional(Biconditional biconditional);

    R visitUniversal(UniversalQuantifier quantifier);

    R visitExistential(ExistentialQuantifier quantifier);

    R visitDefinedness(Definedness definedness);
}
