package alspec.signature;

import static alspec.Language.Sorts.atomic;
import static alspec.Language.Sorts.field;
import static alspec.Language.Sorts.product;
import static alspec.Language.Symbols.constant;
import static alspec.Language.Symbols.fn;
import static alspec.Language.Symbols.generated;
import static alspec.Language.Symbols.param;
import static alspec.Language.Symbols.partialFn;
import static alspec.Language.Symbols.pred;
import static alspec.Language.sort;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import alspec.Fixtures;
import alspec.Language;
import alspec.SpecException;
import alspec.SpecException.Kind;
import alspec.sort.SortRef;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SignatureTest {

    private static SpecException expect(Kind kind, Runnable action) {
        SpecException e = assertThrows(SpecException.class, action::run);
        assertEquals(kind, e.kind(), e.getMessage());
        return e;
    }

    @Test
    void declaringReturnsNewSignatureAndLeavesOriginalUntouched() {
        Signature base = Signature.empty().declareSort(atomic("Nat"));
        Signature extended = base.declareFunction(constant("zero", "Nat"));
        assertTrue(base.functions().isEmpty());
        assertEquals(1, extended.functions().size());
        assertTrue(extended.function("zero").orElseThrow().isConstant());
    }

    @Test
    void productReferencingUndeclaredSortFails() {
        SpecException e = expect(Kind.UNKNOWN_SORT,
                () -> Signature.empty().declareSort(product("Pair", field("fst", "Nat"))));
        assertEquals("Nat", e.subject());
        assertTrue(e.getMessage().contains("Pair"));
    }

    @Test
    void sortNamesAreUnique() {
        Signature sig = Signature.empty().declareSort(atomic("Nat"));
        expect(Kind.DUPLICATE_SORT, () -> sig.declareSort(atomic("Nat")));
    }

    @Test
    void functionProfileMustUseDeclaredSorts() {
        Signature sig = Signature.empty().declareSort(atomic("Nat"));
        SpecException e = expect(Kind.UNKNOWN_SORT,
                () -> sig.declareFunction(fn("f", List.of(param("x", "Nat")), "Bool")));
        assertEquals("Bool", e.subject());
        expect(Kind.UNKNOWN_SORT, () -> sig.declarePredicate(pred("p", List.of(param("x", "Int")))));
    }

    @Test
    void functionsAndPredicatesShareOneNamespace() {
        Signature sig = Signature.empty().declareSort(atomic("Nat"))
                .declareFunction(fn("f", List.of(param("x", "Nat")), "Nat"));
        expect(Kind.DUPLICATE_SYMBOL, () -> sig.declareFunction(constant("f", "Nat")));
        expect(Kind.DUPLICATE_SYMBOL, () -> sig.declarePredicate(pred("f", List.of(param("x", "Nat")))));
        Signature withPred = sig.declarePredicate(pred("p", List.of()));
        expect(Kind.DUPLICATE_SYMBOL, () -> withPred.declareFunction(constant("p", "Nat")));
    }

    @Test
    void generatedSortMustBeDeclared() {
        expect(Kind.UNKNOWN_SORT, () -> Signature.empty().declareGeneratedSort(sort("Stack"), generated()));
    }

    @Test
    void constructorMustBeDeclaredFunction() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Stack");
        SpecException e = expect(Kind.UNKNOWN_FUNCTION,
                () -> sig.declareGeneratedSort(sort("Stack"), generated("new")));
        assertEquals("new", e.subject());
    }

    @Test
    void constructorWithOtherResultSortIsRejected() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Stack", "Elem")
                .declareFunction(constant("new", "Stack"))
                .declareFunction(partialFn("pop", List.of(param("s", "Stack")), "Elem"));
        SpecException e = expect(Kind.WRONG_RESULT_SORT,
                () -> sig.declareGeneratedSort(sort("Stack"), generated("new", "pop")));
        assertEquals("pop", e.subject());
    }

    @Test
    void selectorMustBeDeclaredObserver() {
        Signature sig = Fixtures.stack().declareSort(atomic("Queue"))
                .declareFunction(constant("emptyQ", "Queue"))
                .declareFunction(fn("enq", List.of(param("q", "Queue"), param("e", "Elem")), "Queue"));
        Map<String, Map<String, SortRef>> selectors = Map.of("enq", Map.of("front", sort("Elem")));
        expect(Kind.UNKNOWN_OBSERVER,
                () -> sig.declareGeneratedSort(sort("Queue"), generated(List.of("emptyQ", "enq"), selectors)));
    }

    @Test
    void selectorsAreKeyedByListedConstructors() {
        Signature sig = Fixtures.stack().declareSort(atomic("Box"))
                .declareFunction(constant("boxed", "Box"));
        Map<String, Map<String, SortRef>> selectors = Map.of("push", Map.of("top", sort("Elem")));
        expect(Kind.UNKNOWN_FUNCTION,
                () -> sig.declareGeneratedSort(sort("Box"), generated(List.of("boxed"), selectors)));
    }

    @Test
    void functionSelectorMustReturnListedSort() {
        Signature sig = Language.withAtomicSorts(Signature.empty(), "Sensor", "Temp")
                .declareFunction(constant("init", "Sensor"))
                .declareFunction(fn("record", List.of(param("s", "Sensor"), param("t", "Temp")), "Sensor"))
                .declareFunction(partialFn("read", List.of(param("s", "Sensor")), "Temp"));
        Map<String, Map<String, SortRef>> wrong = Map.of("record", Map.of("read", sort("Sensor")));
        expect(Kind.WRONG_RESULT_SORT,
                () -> sig.declareGeneratedSort(sort("Sensor"), generated(List.of("init", "record"), wrong)));

        Map<String, Map<String, SortRef>> right = Map.of("record", Map.of("read", sort("Temp")));
        Signature ok = sig.declareGeneratedSort(sort("Sensor"), generated(List.of("init", "record"), right));
        assertEquals(Map.of("read", sort("Temp")), ok.generatedSort(sort("Sensor")).orElseThrow().selectorsOf("record"));
    }

    @Test
    void predicatesMayBeSelectors() {
        Signature sig = Fixtures.stack();
        Signature withFlag = sig.declareSort(atomic("Flag"))
                .declareFunction(constant("off", "Flag"))
                .declareFunction(fn("raise", List.of(param("f", "Flag"), param("s", "Stack")), "Flag"));
        Map<String, Map<String, SortRef>> selectors = new LinkedHashMap<>();
        selectors.put("raise", Map.of("isEmpty", sort("Stack")));
        Signature ok = withFlag.declareGeneratedSort(sort("Flag"), generated(List.of("off", "raise"), selectors));
        assertTrue(ok.isGenerated(sort("Flag")));
    }

    @Test
    void generatedSortInfoOnlyOncePerSort() {
        Signature sig = Fixtures.stack();
        expect(Kind.DUPLICATE_GENERATED_SORT, () -> sig.declareGeneratedSort(sort("Stack"), generated("new")));
    }

    @Test
    void constructorListedTwiceIsRejected() {
        Signature sig = Fixtures.stack().declareSort(atomic("Unit")).declareFunction(constant("unit", "Unit"));
        expect(Kind.DUPLICATE_SYMBOL, () -> sig.declareGeneratedSort(sort("Unit"), generated("unit", "unit")));
    }

    @Test
    void lookupsReflectDeclarations() {
        Signature sig = Fixtures.stack();
        assertTrue(sig.isDeclared(sort("Elem")));
        assertFalse(sig.isGenerated(sort("Elem")));
        assertTrue(sig.function("top").orElseThrow().isPartial());
        assertEquals(List.of(sort("Stack"), sort("Elem")), sig.function("push").orElseThrow().argumentSorts());
        assertEquals(List.of("new", "push"),
                sig.constructorsOf(sort("Stack")).stream().map(FunctionSymbol::name).toList());
        assertTrue(sig.constructorsOf(sort("Elem")).isEmpty());
        assertTrue(sig.predicate("isEmpty").isPresent());
        assertTrue(sig.function("isEmpty").isEmpty());
    }

    @Test
    void tablesKeepDeclarationOrder() {
        Signature sig = Fixtures.stack();
        assertEquals(List.of(sort("Stack"), sort("Elem"), sort("Bool")), List.copyOf(sig.sorts().keySet()));
        assertEquals(List.of("new", "push", "pop", "top", "empty"), List.copyOf(sig.functions().keySet()));
    }

    @Test
    void independentlyBuiltSignaturesAreEqual() {
        assertEquals(Fixtures.stack(), Fixtures.stack());
        assertEquals(Fixtures.stack().hashCode(), Fixtures.stack().hashCode());
    }

    @Test
    void declarationOrderDistinguishesSignatures() {
        Signature natFirst = Language.withAtomicSorts(Signature.empty(), "Nat", "Bool");
        Signature boolFirst = Language.withAtomicSorts(Signature.empty(), "Bool", "Nat");
        assertNotEquals(natFirst, boolFirst);

        Signature zeroFirst = natFirst.declareFunction(constant("zero", "Nat")).declareFunction(constant("one", "Nat"));
        Signature oneFirst = natFirst.declareFunction(constant("one", "Nat")).declareFunction(constant("zero", "Nat"));
        assertNotEquals(zeroFirst, oneFirst);
        assertEquals(zeroFirst, natFirst.declareFunction(constant("zero", "Nat")).declareFunction(constant("one", "Nat")));
    }
}
