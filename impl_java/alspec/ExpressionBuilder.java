package alspec;

import alspec.formula.Biconditional;
import alspec.formula.Conjunction;
import alspec.formula.Definedness;
import alspec.formula.Disjunction;
import alspec.formula.ExistentialEquation;
import alspec.formula.ExistentialQuantifier;
import alspec.formula.Formula;
import alspec.formula.Implication;
import alspec.formula.Negation;
import alspec.formula.PredicateApplication;
import alspec.formula.StrongEquation;
import alspec.formula.UniversalQuantifier;
import alspec.signature.Signature;
import alspec.sort.SortRef;
import alspec.term.Application;
import alspec.term.FieldAccess;
import alspec.term.Term;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Builds terms and formulas against one signature. Every method fails
 * immediately, with the construction error of the node it builds, when the
 * result would be ill-sorted.
 * <pre>
 * ExpressionBuilder b = new ExpressionBuilder(sig);
 * Formula topPush = b.forall("s", "Stack", "e", "Elem",
 *         (s, e) -&gt; b.eq(b.app("top", b.app("push", s, e)), e));
 * </pre>
 */
public final class ExpressionBuilder {
    private final Signature signature;

    public ExpressionBuilder(Signature signature) {
        this.signature = Preconditions.checkNotNull(signature, "signature");
    }

    public Signature signature() {
        return signature;
    }

    // Terms

    public Variable var(String name, String sort) {
        return Variable.of(signature, name, SortRef.of(sort));
    }

    public Application app(String function, Term... args) {
        return Application.of(signature, function, List.of(args));
    }

    public Application constant(String name) {
        return Application.of(signature, name, List.of());
    }

    public FieldAccess field(Term base, String field) {
        return FieldAccess.of(signature, base, field);
    }

    // Atoms

    public StrongEquation eq(Term left, Term right) {
        return new StrongEquation(left, right);
    }

    public ExistentialEquation existEq(Term left, Term right) {
        return new ExistentialEquation(left, right);
    }

    public PredicateApplication pred(String predicate, Term... args) {
        return PredicateApplication.of(signature, predicate, List.of(args));
    }

    public Definedness defined(Term term) {
        return new Definedness(term);
    }

    // Connectives

    public Negation not(Formula formula) {
        return new Negation(formula);
    }

    /**
     * Right-nested conjunction of two or more formulas.
     */
    public Formula and(Formula first, Formula second, Formula... rest) {
        return nest(first, second, rest, Conjunction::new);
    }

    /**
     * Right-nested disjunction of two or more formulas.
     */
    public Formula or(Formula first, Formula second, Formula... rest) {
        return nest(first, second, rest, Disjunction::new);
    }

    private static Formula nest(Formula first, Formula second, Formula[] rest, BinaryOperator<Formula> connective) {
        List<Formula> all = new ArrayList<>(rest.length + 2);
        all.add(first);
        all.add(second);
        all.addAll(Arrays.asList(rest));
        Formula out = all.get(all.size() - 1);
        for (int i = all.size() - 2; i >= 0; i--) {
            out = connective.apply(all.get(i), out);
        }
        return out;
    }

    public Implication implies(Formula antecedent, Formula consequent) {
        return new Implication(antecedent, consequent);
    }

    public Biconditional iff(Formula left, Formula right) {
        return new Biconditional(left, right);
    }

    // Quantifiers

    public UniversalQuantifier forall(Variable bound, Formula body) {
        return new UniversalQuantifier(bound, body);
    }

    public ExistentialQuantifier exists(Variable bound, Formula body) {
        return new ExistentialQuantifier(bound, body);
    }

    /**
     * Universally closes {@code body} over {@code bound}, outermost first.
     */
    public Formula forall(List<Variable> bound, Formula body) {
        Formula out = body;
        for (int i = bound.size() - 1; i >= 0; i--) {
            out = new UniversalQuantifier(bound.get(i), out);
        }
        return out;
    }

    public Formula exists(List<Variable> bound, Formula body) {
        Formula out = body;
        for (int i = bound.size() - 1; i >= 0; i--) {
            out = new ExistentialQuantifier(bound.get(i), out);
        }
        return out;
    }

    public UniversalQuantifier forall(String name, String sort, Function<Variable, Formula> body) {
        Variable bound = var(name, sort);
        return new UniversalQuantifier(bound, body.apply(bound));
    }

    public ExistentialQuantifier exists(String name, String sort, Function<Variable, Formula> body) {
        Variable bound = var(name, sort);
        return new ExistentialQuantifier(bound, body.apply(bound));
    }

    public UniversalQuantifier forall(String name1, String sort1, String name2, String sort2,
            BiFunction<Variable, Variable, Formula> body) {
        return forall(name1, sort1, x -> forall(name2, sort2, y -> body.apply(x, y)));
    }
}
