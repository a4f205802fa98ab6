package alspec;

import alspec.signature.FunctionSymbol;
import alspec.signature.GeneratedSortInfo;
import alspec.signature.Parameter;
import alspec.signature.PredicateSymbol;
import alspec.signature.Signature;
import alspec.signature.Totality;
import alspec.sort.AtomicSort;
import alspec.sort.CoproductSort;
import alspec.sort.ProductSort;
import alspec.sort.SortRef;
import java.util.List;
import java.util.Map;

/**
 * Shorthands for declaring the vocabulary of a specification. Sort names are
 * plain strings here and become {@link SortRef}s on the way in.
 * <pre>
 * Signature sig = Signature.empty()
 *         .declareSort(atomic("Stack"))
 *         .declareSort(atomic("Elem"))
 *         .declareFunction(fn("push", List.of(param("s", "Stack"), param("e", "Elem")), "Stack"))
 *         .declareFunction(partialFn("top", List.of(param("s", "Stack")), "Elem"));
 * </pre>
 */
public final class Language {
    private Language() {
    }

    public static SortRef sort(String name) {
        return SortRef.of(name);
    }

    public static class Sorts {
        private Sorts() {
        }

        public static AtomicSort atomic(String name) {
            return new AtomicSort(sort(name));
        }

        public static ProductSort.Field field(String name, String sort) {
            return new ProductSort.Field(name, sort(sort));
        }

        public static ProductSort product(String name, ProductSort.Field... fields) {
            return new ProductSort(sort(name), List.of(fields));
        }

        public static CoproductSort.Variant variant(String tag, String sort) {
            return new CoproductSort.Variant(tag, sort(sort));
        }

        public static CoproductSort coproduct(String name, CoproductSort.Variant... variants) {
            return new CoproductSort(sort(name), List.of(variants));
        }
    }

    public static class Symbols {
        private Symbols() {
        }

        public static Parameter param(String name, String sort) {
            return new Parameter(name, sort(sort));
        }

        public static FunctionSymbol fn(String name, List<Parameter> params, String result) {
            return new FunctionSymbol(name, params, sort(result), Totality.TOTAL);
        }

        public static FunctionSymbol partialFn(String name, List<Parameter> params, String result) {
            return new FunctionSymbol(name, params, sort(result), Totality.PARTIAL);
        }

        public static FunctionSymbol constant(String name, String result) {
            return fn(name, List.of(), result);
        }

        public static PredicateSymbol pred(String name, List<Parameter> params) {
            return new PredicateSymbol(name, params);
        }

        /**
         * Constructors only; no selectors.
         */
        public static GeneratedSortInfo generated(String... constructors) {
            return new GeneratedSortInfo(List.of(constructors));
        }

        public static GeneratedSortInfo generated(List<String> constructors, Map<String, Map<String, SortRef>> selectors) {
            return new GeneratedSortInfo(constructors, selectors);
        }
    }

    /**
     * Declares every sort in {@code names} as an atomic sort, in order.
     */
    public static Signature withAtomicSorts(Signature signature, String... names) {
        Signature out = signature;
        for (String name : names) {
            out = out.declareSort(Sorts.atomic(name));
        }
        return out;
    }
}
