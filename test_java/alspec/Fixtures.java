package alspec;

import static alspec.Language.Sorts.atomic;
import static alspec.Language.Sorts.coproduct;
import static alspec.Language.Sorts.field;
import static alspec.Language.Sorts.product;
import static alspec.Language.Sorts.variant;
import static alspec.Language.Symbols.constant;
import static alspec.Language.Symbols.fn;
import static alspec.Language.Symbols.generated;
import static alspec.Language.Symbols.param;
import static alspec.Language.Symbols.partialFn;
import static alspec.Language.Symbols.pred;
import static alspec.Language.sort;

import alspec.signature.Signature;
import java.util.List;

/**
 * Signatures shared by the tests.
 */
public final class Fixtures {
    private Fixtures() {
    }

    /**
     * Stack, Elem, Bool with Stack generated by new and push.
     */
    public static Signature stack() {
        return Language.withAtomicSorts(Signature.empty(), "Stack", "Elem", "Bool")
                .declareFunction(constant("new", "Stack"))
                .declareFunction(fn("push", List.of(param("s", "Stack"), param("e", "Elem")), "Stack"))
                .declareFunction(partialFn("pop", List.of(param("s", "Stack")), "Stack"))
                .declareFunction(partialFn("top", List.of(param("s", "Stack")), "Elem"))
                .declareFunction(fn("empty", List.of(param("s", "Stack")), "Bool"))
                .declarePredicate(pred("isEmpty", List.of(param("s", "Stack"))))
                .declareGeneratedSort(sort("Stack"), generated("new", "push"));
    }

    /**
     * Naturals with a product sort Pair, a coproduct Status and an ordering predicate.
     */
    public static Signature nat() {
        return Signature.empty()
                .declareSort(atomic("Nat"))
                .declareSort(atomic("Bool"))
                .declareSort(atomic("Msg"))
                .declareSort(product("Pair", field("fst", "Nat"), field("snd", "Nat")))
                .declareSort(coproduct("Status", variant("open", "Nat"), variant("resolved", "Msg")))
                .declareFunction(constant("zero", "Nat"))
                .declareFunction(constant("true", "Bool"))
                .declareFunction(fn("suc", List.of(param("n", "Nat")), "Nat"))
                .declareFunction(partialFn("pre", List.of(param("n", "Nat")), "Nat"))
                .declareFunction(fn("add", List.of(param("x", "Nat"), param("y", "Nat")), "Nat"))
                .declareFunction(fn("pair", List.of(param("a", "Nat"), param("b", "Nat")), "Pair"))
                .declarePredicate(pred("leq", List.of(param("x", "Nat"), param("y", "Nat"))))
                .declareGeneratedSort(sort("Nat"), generated("zero", "suc"));
    }
}
