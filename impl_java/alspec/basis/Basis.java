package alspec.basis;

import static alspec.Language.Symbols.constant;
import static alspec.Language.Symbols.fn;
import static alspec.Language.Symbols.generated;
import static alspec.Language.Symbols.param;
import static alspec.Language.Symbols.partialFn;
import static alspec.Language.Symbols.pred;
import static alspec.Language.sort;

import alspec.ExpressionBuilder;
import alspec.Language;
import alspec.formula.Formula;
import alspec.signature.Signature;
import alspec.spec.Axiom;
import alspec.spec.Specification;
import alspec.term.Term;
import alspec.term.Variable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * Standard building-block specifications (CASL basic libraries, Sannella and
 * Tarlecki). Axioms are written one per (operation, constructor) pair.
 */
public final class Basis {
    private Basis() {
    }

    public static List<Specification> all() {
        return List.of(bool(), nat(), pair(), stack(), list(), partialOrder(), totalOrder(), monoid(), finiteMap());
    }

    // free type Bool ::= true | false
    public static Specification bool() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Bool")
                .declareFunction(constant("true", "Bool"))
                .declareFunction(constant("false", "Bool"))
                .declareFunction(fn("not", List.of(param("a", "Bool")), "Bool"))
                .declareFunction(fn("and", List.of(param("a", "Bool"), param("b", "Bool")), "Bool"))
                .declareFunction(fn("or", List.of(param("a", "Bool"), param("b", "Bool")), "Bool"))
                .declareFunction(fn("implies", List.of(param("a", "Bool"), param("b", "Bool")), "Bool"))
                .declareGeneratedSort(sort("Bool"), generated("true", "false"));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable a = b.var("a", "Bool");
        Variable bv = b.var("b", "Bool");
        Term t = b.constant("true");
        Term f = b.constant("false");
        return Specification.build("Bool", sig, List.of(
                new Axiom("not_true", b.eq(b.app("not", t), f)),
                new Axiom("not_false", b.eq(b.app("not", f), t)),
                new Axiom("and_true", b.forall(bv, b.eq(b.app("and", t, bv), bv))),
                new Axiom("and_false", b.forall(bv, b.eq(b.app("and", f, bv), f))),
                new Axiom("or_true", b.forall(bv, b.eq(b.app("or", t, bv), t))),
                new Axiom("or_false", b.forall(bv, b.eq(b.app("or", f, bv), bv))),
                new Axiom("implies_def", b.forall(List.of(a, bv),
                        b.eq(b.app("implies", a, bv), b.app("or", b.app("not", a), bv))))));
    }

    // free type Nat ::= zero | suc(Nat)
    public static Specification nat() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Nat")
                .declareFunction(constant("zero", "Nat"))
                .declareFunction(fn("suc", List.of(param("n", "Nat")), "Nat"))
                .declareFunction(fn("add", List.of(param("x", "Nat"), param("y", "Nat")), "Nat"))
                .declareFunction(fn("mul", List.of(param("x", "Nat"), param("y", "Nat")), "Nat"))
                .declarePredicate(pred("leq", List.of(param("x", "Nat"), param("y", "Nat"))))
                .declarePredicate(pred("lt", List.of(param("x", "Nat"), param("y", "Nat"))))
                .declareGeneratedSort(sort("Nat"), generated("zero", "suc"));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable x = b.var("x", "Nat");
        Variable y = b.var("y", "Nat");
        Term zero = b.constant("zero");
        return Specification.build("Nat", sig, List.of(
                new Axiom("add_zero", b.forall(y, b.eq(b.app("add", zero, y), y))),
                new Axiom("add_suc", b.forall(List.of(x, y),
                        b.eq(b.app("add", b.app("suc", x), y), b.app("suc", b.app("add", x, y))))),
                new Axiom("mul_zero", b.forall(y, b.eq(b.app("mul", zero, y), zero))),
                new Axiom("mul_suc", b.forall(List.of(x, y),
                        b.eq(b.app("mul", b.app("suc", x), y), b.app("add", y, b.app("mul", x, y))))),
                new Axiom("leq_zero", b.forall(y, b.pred("leq", zero, y))),
                new Axiom("leq_suc_suc", b.forall(List.of(x, y),
                        b.implies(b.pred("leq", b.app("suc", x), b.app("suc", y)), b.pred("leq", x, y)))),
                new Axiom("lt_zero", b.forall(y, b.not(b.pred("lt", y, zero)))),
                new Axiom("lt_suc", b.forall(List.of(x, y),
                        b.implies(b.pred("lt", b.app("suc", x), b.app("suc", y)), b.pred("lt", x, y))))));
    }

    // free type Pair ::= pair(fst : Elem1; snd : Elem2)
    public static Specification pair() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Elem1", "Elem2", "Pair")
                .declareFunction(fn("pair", List.of(param("a", "Elem1"), param("b", "Elem2")), "Pair"))
                .declareFunction(fn("fst", List.of(param("p", "Pair")), "Elem1"))
                .declareFunction(fn("snd", List.of(param("p", "Pair")), "Elem2"))
                .declareGeneratedSort(sort("Pair"), generated(List.of("pair"),
                        ImmutableMap.of("pair", ImmutableMap.of("fst", sort("Elem1"), "snd", sort("Elem2")))));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable a = b.var("a", "Elem1");
        Variable bv = b.var("b", "Elem2");
        Term pair = b.app("pair", a, bv);
        return Specification.build("Pair", sig, List.of(
                new Axiom("fst_pair", b.forall(List.of(a, bv), b.eq(b.app("fst", pair), a))),
                new Axiom("snd_pair", b.forall(List.of(a, bv), b.eq(b.app("snd", pair), bv)))));
    }

    // pop and top are partial: undefined on new
    public static Specification stack() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Stack", "Elem")
                .declareFunction(constant("new", "Stack"))
                .declareFunction(fn("push", List.of(param("S", "Stack"), param("e", "Elem")), "Stack"))
                .declareFunction(partialFn("pop", List.of(param("S", "Stack")), "Stack"))
                .declareFunction(partialFn("top", List.of(param("S", "Stack")), "Elem"))
                .declarePredicate(pred("empty", List.of(param("S", "Stack"))))
                .declareGeneratedSort(sort("Stack"), generated(List.of("new", "push"),
                        ImmutableMap.of("push", ImmutableMap.of("pop", sort("Stack"), "top", sort("Elem")))));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable s = b.var("S", "Stack");
        Variable e = b.var("e", "Elem");
        Term push = b.app("push", s, e);
        return Specification.build("Stack", sig, List.of(
                new Axiom("pop_push", b.forall(List.of(s, e), b.eq(b.app("pop", push), s))),
                new Axiom("top_push", b.forall(List.of(s, e), b.eq(b.app("top", push), e))),
                new Axiom("empty_new", b.pred("empty", b.constant("new"))),
                new Axiom("not_empty_push", b.forall(List.of(s, e), b.not(b.pred("empty", push))))));
    }

    // free type List ::= nil | cons(hd :? Elem; tl :? List)
    public static Specification list() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Elem", "List", "Nat")
                .declareFunction(constant("nil", "List"))
                .declareFunction(fn("cons", List.of(param("x", "Elem"), param("L", "List")), "List"))
                .declareFunction(constant("zero", "Nat"))
                .declareFunction(fn("suc", List.of(param("n", "Nat")), "Nat"))
                .declareFunction(partialFn("hd", List.of(param("L", "List")), "Elem"))
                .declareFunction(partialFn("tl", List.of(param("L", "List")), "List"))
                .declareFunction(fn("append", List.of(param("L", "List"), param("M", "List")), "List"))
                .declareFunction(fn("length", List.of(param("L", "List")), "Nat"))
                .declareGeneratedSort(sort("List"), generated(List.of("nil", "cons"),
                        ImmutableMap.of("cons", ImmutableMap.of("hd", sort("Elem"), "tl", sort("List")))))
                .declareGeneratedSort(sort("Nat"), generated("zero", "suc"));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable x = b.var("x", "Elem");
        Variable l = b.var("L", "List");
        Variable m = b.var("M", "List");
        Term nil = b.constant("nil");
        Term cons = b.app("cons", x, l);
        return Specification.build("List", sig, List.of(
                new Axiom("hd_cons", b.forall(List.of(x, l), b.eq(b.app("hd", cons), x))),
                new Axiom("tl_cons", b.forall(List.of(x, l), b.eq(b.app("tl", cons), l))),
                new Axiom("append_nil", b.forall(m, b.eq(b.app("append", nil, m), m))),
                new Axiom("append_cons", b.forall(List.of(x, l, m),
                        b.eq(b.app("append", cons, m), b.app("cons", x, b.app("append", l, m))))),
                new Axiom("length_nil", b.eq(b.app("length", nil), b.constant("zero"))),
                new Axiom("length_cons", b.forall(List.of(x, l),
                        b.eq(b.app("length", cons), b.app("suc", b.app("length", l)))))));
    }

    public static Specification partialOrder() {
        return order("PartialOrder", false);
    }

    // partial order plus totality
    public static Specification totalOrder() {
        return order("TotalOrder", true);
    }

    private static Specification order(String name, boolean total) {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Elem")
                .declarePredicate(pred("leq", List.of(param("x", "Elem"), param("y", "Elem"))));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable x = b.var("x", "Elem");
        Variable y = b.var("y", "Elem");
        Variable z = b.var("z", "Elem");
        ImmutableList.Builder<Axiom> axioms = ImmutableList.<Axiom>builder()
                .add(new Axiom("reflexivity", b.forall(x, b.pred("leq", x, x))))
                .add(new Axiom("antisymmetry", b.forall(List.of(x, y),
                        b.implies(b.and(b.pred("leq", x, y), b.pred("leq", y, x)), b.eq(x, y)))))
                .add(new Axiom("transitivity", b.forall(List.of(x, y, z),
                        b.implies(b.and(b.pred("leq", x, y), b.pred("leq", y, z)), b.pred("leq", x, z)))));
        if (total) {
            axioms.add(new Axiom("totality", b.forall(List.of(x, y), b.or(b.pred("leq", x, y), b.pred("leq", y, x)))));
        }
        return Specification.build(name, sig, axioms.build());
    }

    // associative operation with unit
    public static Specification monoid() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "M")
                .declareFunction(constant("e", "M"))
                .declareFunction(fn("op", List.of(param("x", "M"), param("y", "M")), "M"));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable x = b.var("x", "M");
        Variable y = b.var("y", "M");
        Variable z = b.var("z", "M");
        Term unit = b.constant("e");
        return Specification.build("Monoid", sig, List.of(
                new Axiom("left_unit", b.forall(x, b.eq(b.app("op", unit, x), x))),
                new Axiom("right_unit", b.forall(x, b.eq(b.app("op", x, unit), x))),
                new Axiom("associativity", b.forall(List.of(x, y, z),
                        b.eq(b.app("op", b.app("op", x, y), z), b.app("op", x, b.app("op", y, z)))))));
    }

    /**
     * Lookup dispatched on key equality. Lookup on the empty map is stated
     * undefined explicitly rather than left out.
     */
    public static Specification finiteMap() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Key", "Val", "Map")
                .declareFunction(constant("empty", "Map"))
                .declareFunction(fn("update", List.of(param("M", "Map"), param("k", "Key"), param("v", "Val")), "Map"))
                .declareFunction(partialFn("lookup", List.of(param("M", "Map"), param("k", "Key")), "Val"))
                .declarePredicate(pred("eq_key", List.of(param("k1", "Key"), param("k2", "Key"))))
                .declareGeneratedSort(sort("Map"), generated("empty", "update"));
        ExpressionBuilder b = new ExpressionBuilder(sig);
        Variable k = b.var("k", "Key");
        Variable k1 = b.var("k1", "Key");
        Variable k2 = b.var("k2", "Key");
        Variable v = b.var("v", "Val");
        Variable m = b.var("M", "Map");
        Term lookupUpdate = b.app("lookup", b.app("update", m, k1, v), k2);
        Formula sameKey = b.pred("eq_key", k1, k2);
        return Specification.build("FiniteMap", sig, List.of(
                new Axiom("lookup_empty_undef", b.forall(k, b.not(b.defined(b.app("lookup", b.constant("empty"), k))))),
                new Axiom("lookup_update_hit", b.forall(List.of(m, k1, k2, v),
                        b.implies(sameKey, b.eq(lookupUpdate, v)))),
                new Axiom("lookup_update_miss", b.forall(List.of(m, k1, k2, v),
                        b.implies(b.not(sameKey), b.eq(lookupUpdate, b.app("lookup", m, k2))))),
                new Axiom("eq_key_refl", b.forall(k, b.pred("eq_key", k, k))),
                new Axiom("eq_key_sym", b.forall(List.of(k1, k2),
                        b.implies(sameKey, b.pred("eq_key", k2, k1))))));
    }
}
