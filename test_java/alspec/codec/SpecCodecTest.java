package alspec.codec;

import static alspec.Language.Sorts.atomic;
import static alspec.Language.Sorts.coproduct;
import static alspec.Language.Sorts.field;
import static alspec.Language.Sorts.product;
import static alspec.Language.Sorts.variant;
import static alspec.Language.Symbols.fn;
import static alspec.Language.Symbols.generated;
import static alspec.Language.Symbols.param;
import static alspec.Language.Symbols.partialFn;
import static alspec.Language.Symbols.pred;
import static alspec.Language.sort;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import alspec.ExpressionBuilder;
import alspec.Fixtures;
import alspec.Language;
import alspec.SortMismatchException;
import alspec.SpecException;
import alspec.SpecException.Kind;
import alspec.formula.Formula;
import alspec.signature.FunctionSymbol;
import alspec.signature.GeneratedSortInfo;
import alspec.signature.PredicateSymbol;
import alspec.signature.Signature;
import alspec.sort.Sort;
import alspec.spec.Axiom;
import alspec.spec.Specification;
import alspec.term.Term;
import java.util.List;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

class SpecCodecTest {
    private final SpecCodec codec = new SpecCodec();
    private final Signature sig = Fixtures.nat();
    private final ExpressionBuilder b = new ExpressionBuilder(sig);

    private Specification natSpec() {
        return Specification.build("Nat", sig, List.of(
                new Axiom("add_zero", b.forall("x", "Nat", x -> b.eq(b.app("add", x, b.constant("zero")), x))),
                new Axiom("pre_suc", b.forall("x", "Nat", x -> b.existEq(b.app("pre", b.app("suc", x)), x))),
                new Axiom("leq_zero", b.forall("x", "Nat", x -> b.pred("leq", b.constant("zero"), x)))));
    }

    @Test
    void sortsRoundTrip() {
        for (Sort s : List.<Sort>of(atomic("Nat"),
                product("Pair", field("fst", "Nat"), field("snd", "Nat")),
                coproduct("Status", variant("open", "Nat"), variant("resolved", "Msg")))) {
            assertEquals(s, codec.decodeSort(codec.encode(s)));
        }
    }

    @Test
    void encodedSortsCarryTypeAndFields() {
        JSONObject pair = codec.encode(product("Pair", field("fst", "Nat"), field("snd", "Bool")));
        assertEquals("ProductSort", pair.getString("type"));
        assertEquals("Pair", pair.getString("name"));
        JSONArray fields = pair.getJSONArray("fields");
        assertEquals("fst", fields.getJSONObject(0).getString("name"));
        assertEquals("Bool", fields.getJSONObject(1).getString("sort"));
    }

    @Test
    void symbolsRoundTrip() {
        FunctionSymbol pre = partialFn("pre", List.of(param("n", "Nat")), "Nat");
        JSONObject encoded = codec.encode(pre);
        assertEquals("partial", encoded.getString("totality"));
        assertEquals(pre, codec.decodeFunctionSymbol(encoded));

        FunctionSymbol add = fn("add", List.of(param("x", "Nat"), param("y", "Nat")), "Nat");
        assertEquals("total", codec.encode(add).getString("totality"));
        assertEquals(add, codec.decodeFunctionSymbol(codec.encode(add)));

        PredicateSymbol leq = pred("leq", List.of(param("x", "Nat"), param("y", "Nat")));
        assertEquals(leq, codec.decodePredicateSymbol(codec.encode(leq)));
    }

    @Test
    void generatedSortInfoRoundTripsWithSelectors() {
        GeneratedSortInfo info = generated(List.of("new", "push"),
                Map.of("push", Map.of("top", sort("Elem"))));
        GeneratedSortInfo decoded = codec.decodeGeneratedSortInfo(codec.encode(info));
        assertEquals(info, decoded);
        assertEquals(List.of("new", "push"), decoded.constructors());
    }

    @Test
    void signatureRoundTripKeepsDeclarationOrder() {
        Signature decoded = codec.decodeSignature(codec.encode(sig));
        assertEquals(sig, decoded);
        assertEquals(List.copyOf(sig.sorts().keySet()), List.copyOf(decoded.sorts().keySet()));
        assertEquals(List.copyOf(sig.functions().keySet()), List.copyOf(decoded.functions().keySet()));
        assertTrue(decoded.isGenerated(sort("Nat")));
    }

    @Test
    void termsRoundTrip() {
        Term pairFst = b.field(b.app("pair", b.var("x", "Nat"), b.app("suc", b.constant("zero"))), "fst");
        for (Term t : List.<Term>of(b.var("x", "Nat"), b.constant("zero"), pairFst)) {
            assertEquals(t, codec.decodeTerm(codec.encode(t), sig));
        }
    }

    @Test
    void everyFormulaVariantRoundTrips() {
        Term x = b.var("x", "Nat");
        Term zero = b.constant("zero");
        Formula atom = b.pred("leq", x, zero);
        List<Formula> formulas = List.of(
                b.eq(x, zero),
                b.existEq(b.app("pre", x), zero),
                atom,
                b.not(atom),
                b.and(atom, b.eq(x, zero)),
                b.or(atom, b.eq(x, zero)),
                b.implies(atom, b.eq(x, zero)),
                b.iff(atom, b.defined(b.app("pre", x))),
                b.forall("y", "Nat", y -> b.pred("leq", y, x)),
                b.exists("y", "Nat", y -> b.eq(b.app("suc", y), x)),
                b.defined(b.app("pre", x)));
        for (Formula f : formulas) {
            assertEquals(f, codec.decodeFormula(codec.encode(f), sig), f.toString());
        }
    }

    @Test
    void equationsRecordTheirKind() {
        Term zero = b.constant("zero");
        assertEquals("strong", codec.encode(b.eq(zero, zero)).getString("kind"));
        JSONObject existential = codec.encode(b.existEq(zero, zero));
        assertEquals("ExistentialEquation", existential.getString("type"));
        assertEquals("existential", existential.getString("kind"));
    }

    @Test
    void quantifierEncodesBoundVariableFlat() {
        JSONObject node = codec.encode(b.forall("x", "Nat", x -> b.pred("leq", x, x)));
        assertEquals("UniversalQuantifier", node.getString("type"));
        assertEquals("x", node.getString("bound_name"));
        assertEquals("Nat", node.getString("bound_sort"));
        assertEquals("PredicateApplication", node.getJSONObject("body").getString("type"));
    }

    @Test
    void specificationRoundTripsThroughText() {
        Specification spec = natSpec();
        String text = codec.dumps(spec);
        Specification loaded = codec.loads(text);
        assertEquals(spec, loaded);
        assertEquals(List.of("add_zero", "pre_suc", "leq_zero"),
                loaded.axioms().stream().map(Axiom::label).toList());
        assertEquals(text, codec.dumps(loaded));
    }

    @Test
    void zeroIndentWritesOneLine() {
        assertFalse(new SpecCodec(0).dumps(natSpec()).contains("\n"));
        assertThrows(IllegalArgumentException.class, () -> new SpecCodec(-1));
    }

    @Test
    void unknownDiscriminatorIsRejected() {
        JSONObject node = new JSONObject().put("type", "Lambda").put("body", new JSONObject());
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeFormula(node, sig));
        assertEquals(Kind.UNKNOWN_NODE_TYPE, e.kind());
        assertEquals("Lambda", e.subject());
        assertNull(e.field());

        assertEquals(Kind.UNKNOWN_NODE_TYPE, assertThrows(CodecException.class,
                () -> codec.decodeTerm(new JSONObject().put("type", "Literal"), sig)).kind());
        assertEquals(Kind.UNKNOWN_NODE_TYPE, assertThrows(CodecException.class,
                () -> codec.decodeSort(new JSONObject().put("type", "ListSort"))).kind());
        assertEquals(Kind.UNKNOWN_NODE_TYPE, assertThrows(CodecException.class,
                () -> codec.decodeFunctionSymbol(codec.encode(pred("p", List.of())))).kind());
    }

    @Test
    void missingFieldIsMalformed() {
        JSONObject node = codec.encode(b.eq(b.constant("zero"), b.constant("zero")));
        node.remove("right");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeFormula(node, sig));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("StrongEquation", e.nodeType());
        assertEquals("right", e.field());
    }

    @Test
    void missingDiscriminatorIsMalformed() {
        JSONObject node = codec.encode(b.var("x", "Nat"));
        node.remove("type");
        assertEquals(Kind.MALFORMED_NODE,
                assertThrows(CodecException.class, () -> codec.decodeTerm(node, sig)).kind());
    }

    @Test
    void wronglyTypedFieldIsMalformed() {
        JSONObject node = codec.encode(b.app("suc", b.constant("zero")));
        node.put("args", "zero");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeTerm(node, sig));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("args", e.field());
    }

    @Test
    void equationKindMustMatchItsType() {
        JSONObject node = codec.encode(b.eq(b.constant("zero"), b.constant("zero")));
        node.put("kind", "existential");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeFormula(node, sig));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("kind", e.field());
    }

    @Test
    void unknownTotalityIsMalformed() {
        JSONObject node = codec.encode(fn("suc", List.of(param("n", "Nat")), "Nat"));
        node.put("totality", "sometimes");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeFunctionSymbol(node));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("totality", e.field());
    }

    @Test
    void textThatIsNotJsonIsMalformed() {
        CodecException e = assertThrows(CodecException.class, () -> codec.loads("spec Nat = sort Nat"));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals(Kind.MALFORMED_NODE, assertThrows(CodecException.class, () -> codec.loads("[1, 2]")).kind());
    }

    @Test
    void trailingContentAfterDocumentIsMalformed() {
        String text = codec.dumps(natSpec()) + " {\"junk\": 1} garbage";
        CodecException e = assertThrows(CodecException.class, () -> codec.loads(text));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals(natSpec(), codec.loads(codec.dumps(natSpec()) + "\n  "));
    }

    @Test
    void repeatedSelectorNameIsMalformed() {
        JSONObject node = new JSONObject(
                "{\"type\": \"GeneratedSortInfo\", \"constructors\": [\"zero\", \"suc\"], \"selectors\": ["
                        + "{\"constructor\": \"suc\", \"selectors\": ["
                        + "{\"name\": \"pre\", \"sort\": \"Nat\"}, {\"name\": \"pre\", \"sort\": \"Bool\"}]}]}");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeGeneratedSortInfo(node));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("selectors", e.field());
    }

    @Test
    void repeatedConstructorEntryIsMalformed() {
        JSONObject node = new JSONObject(
                "{\"type\": \"GeneratedSortInfo\", \"constructors\": [\"zero\", \"suc\"], \"selectors\": ["
                        + "{\"constructor\": \"suc\", \"selectors\": [{\"name\": \"pre\", \"sort\": \"Nat\"}]},"
                        + "{\"constructor\": \"suc\", \"selectors\": []}]}");
        CodecException e = assertThrows(CodecException.class, () -> codec.decodeGeneratedSortInfo(node));
        assertEquals(Kind.MALFORMED_NODE, e.kind());
        assertEquals("GeneratedSortInfo", e.nodeType());
    }

    @Test
    void tamperedVariableSortFailsSortCheckOnDecode() {
        JSONObject node = codec.encode(natSpec());
        JSONObject leqZero = node.getJSONArray("axioms").getJSONObject(2).getJSONObject("formula");
        leqZero.getJSONObject("body").getJSONArray("args").getJSONObject(1).put("sort", "Bool");
        SortMismatchException e = assertThrows(SortMismatchException.class, () -> codec.decodeSpecification(node));
        assertEquals(Kind.SORT_MISMATCH, e.kind());
        assertEquals(1, e.position());
        assertEquals(sort("Nat"), e.expected());
        assertEquals(sort("Bool"), e.actual());
    }

    @Test
    void undeclaredSymbolInDocumentIsRejected() {
        JSONObject node = codec.encode(natSpec());
        JSONArray functions = node.getJSONObject("signature").getJSONArray("functions");
        functions.remove(4);
        SpecException e = assertThrows(SpecException.class, () -> codec.decodeSpecification(node));
        assertEquals(Kind.UNKNOWN_FUNCTION, e.kind());
        assertEquals("add", e.subject());
    }

    @Test
    void signatureDocumentIsReplayedThroughDeclarationChecks() {
        Signature small = Language.withAtomicSorts(Signature.empty(), "Nat");
        JSONObject node = codec.encode(small);
        node.getJSONArray("sorts").put(codec.encode(atomic("Nat")));
        SpecException e = assertThrows(SpecException.class, () -> codec.decodeSignature(node));
        assertEquals(Kind.DUPLICATE_SORT, e.kind());
    }

    @Test
    void openAxiomInDocumentIsRejected() {
        JSONObject node = codec.encode(natSpec());
        JSONObject axiom = node.getJSONArray("axioms").getJSONObject(0);
        axiom.put("formula", axiom.getJSONObject("formula").getJSONObject("body"));
        SpecException e = assertThrows(SpecException.class, () -> codec.decodeSpecification(node));
        assertEquals(Kind.UNBOUND_VARIABLE, e.kind());
    }
}
