package alspec.codec;

import alspec.formula.Biconditional;
import alspec.formula.Conjunction;
import alspec.formula.Definedness;
import alspec.formula.Disjunction;
import alspec.formula.Equation;
import alspec.formula.ExistentialEquation;
import alspec.formula.ExistentialQuantifier;
import alspec.formula.Formula;
import alspec.formula.FormulaVisitor;
import alspec.formula.Implication;
import alspec.formula.Negation;
import alspec.formula.PredicateApplication;
import alspec.formula.Quantifier;
import alspec.formula.StrongEquation;
import alspec.formula.UniversalQuantifier;
import alspec.signature.FunctionSymbol;
import alspec.signature.GeneratedSortInfo;
import alspec.signature.Parameter;
import alspec.signature.PredicateSymbol;
import alspec.signature.Signature;
import alspec.signature.Totality;
import alspec.sort.AtomicSort;
import alspec.sort.CoproductSort;
import alspec.sort.ProductSort;
import alspec.sort.Sort;
import alspec.sort.SortRef;
import alspec.sort.SortVisitor;
import alspec.spec.Axiom;
import alspec.spec.Specification;
import alspec.term.Application;
import alspec.term.FieldAccess;
import alspec.term.Term;
import alspec.term.TermVisitor;
import alspec.term.Variable;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Maps every node to a JSON record tagged with {@code "type"} and back. Decoding
 * goes through the validating factories.
 */
public final class SpecCodec {
    private static final Logger LOGGER = Logger.getLogger(SpecCodec.class.getName());

    public static final int DEFAULT_INDENT = 2;

    static final String TYPE = "type";

    private final int indent;

    public SpecCodec() {
        this(DEFAULT_INDENT);
    }

    /**
     * @param indent indentation used by {@link #dumps}; 0 writes a single line
     */
    public SpecCodec(int indent) {
        Preconditions.checkArgument(indent >= 0, "indent must be non-negative: %s", indent);
        this.indent = indent;
    }

    // =========================================================================
    // Text
    // =========================================================================

    public String dumps(Specification spec) {
        return encode(spec).toString(indent);
    }

    public Specification loads(String text) {
        Preconditions.checkNotNull(text, "text");
        JSONObject node;
        JSONTokener tokener = new JSONTokener(text);
        try {
            node = new JSONObject(tokener);
        } catch (JSONException e) {
            throw CodecException.malformed("Specification", null, "not a JSON object: " + e.getMessage(), e);
        }
        if (tokener.nextClean() != 0) {
            throw CodecException.malformed("Specification", null, "trailing content after the document", null);
        }
        Specification spec = decodeSpecification(node);
        LOGGER.fine(() -> String.format("Loaded specification %s (%d axiom(s))", spec.name(), spec.axioms().size()));
        return spec;
    }

    // =========================================================================
    // Encoding
    // =========================================================================

    public JSONObject encode(Sort sort) {
        return sort.accept(new SortEncoder());
    }

    public JSONObject encode(FunctionSymbol function) {
        return tagged("FunctionSymbol")
                .put("name", function.name())
                .put("params", encodeParams(function.params()))
                .put("result", function.result().name())
                .put("totality", function.totality().tag());
    }

    public JSONObject encode(PredicateSymbol predicate) {
        return tagged("PredicateSymbol")
                .put("name", predicate.name())
                .put("params", encodeParams(predicate.params()));
    }

    public JSONObject encode(GeneratedSortInfo info) {
        JSONArray selectors = new JSONArray();
        for (var entry : info.selectors().entrySet()) {
            JSONArray perConstructor = new JSONArray();
            for (var selector : entry.getValue().entrySet()) {
                perConstructor.put(new JSONObject().put("name", selector.getKey()).put("sort", selector.getValue().name()));
            }
            selectors.put(new JSONObject().put("constructor", entry.getKey()).put("selectors", perConstructor));
        }
        return tagged("GeneratedSortInfo")
                .put("constructors", new JSONArray(info.constructors()))
                .put("selectors", selectors);
    }

    public JSONObject encode(Signature signature) {
        JSONArray generated = new JSONArray();
        for (var entry : signature.generatedSorts().entrySet()) {
            generated.put(new JSONObject().put("sort", entry.getKey().name()).put("info", encode(entry.getValue())));
        }
        return tagged("Signature")
                .put("sorts", array(signature.sorts().values(), this::encode))
                .put("functions", array(signature.functions().values(), this::encode))
                .put("predicates", array(signature.predicates().values(), this::encode))
                .put("generated_sorts", generated);
    }

    public JSONObject encode(Term term) {
        return term.accept(new TermEncoder());
    }

    public JSONObject encode(Formula formula) {
        return formula.accept(new FormulaEncoder());
    }

    public JSONObject encode(Axiom axiom) {
        return tagged("Axiom")
                .put("label", axiom.label())
                .put("formula", encode(axiom.formula()));
    }

    public JSONObject encode(Specification spec) {
        return tagged("Specification")
                .put("name", spec.name())
                .put("signature", encode(spec.signature()))
                .put("axioms", array(spec.axioms(), this::encode));
    }

    private static JSONObject tagged(String type) {
        return new JSONObject().put(TYPE, type);
    }

    private static <T> JSONArray array(Iterable<T> items, Function<T, JSONObject> encoder) {
        JSONArray out = new JSONArray();
        for (T item : items) out.put(encoder.apply(item));
        return out;
    }

    private static JSONArray encodeParams(List<Parameter> params) {
        JSONArray out = new JSONArray();
        for (Parameter param : params) {
            out.put(new JSONObject().put("name", param.name()).put("sort", param.sort().name()));
        }
        return out;
    }

    private static final class SortEncoder implements SortVisitor<JSONObject> {
        @Override
        public JSONObject visitAtomic(AtomicSort sort) {
            return tagged("AtomicSort").put("name", sort.name().name());
        }

        @Override
        public JSONObject visitProduct(ProductSort sort) {
            JSONArray fields = new JSONArray();
            for (ProductSort.Field field : sort.fields()) {
                fields.put(new JSONObject().put("name", field.name()).put("sort", field.sort().name()));
            }
            return tagged("ProductSort").put("name", sort.name().name()).put("fields", fields);
        }

        @Override
        public JSONObject visitCoproduct(CoproductSort sort) {
            JSONArray variants = new JSONArray();
            for (CoproductSort.Variant variant : sort.variants()) {
                variants.put(new JSONObject().put("tag", variant.tag()).put("sort", variant.sort().name()));
            }
            return tagged("CoproductSort").put("name", sort.name().name()).put("variants", variants);
        }
    }

    private final class TermEncoder implements TermVisitor<JSONObject> {
        @Override
        public JSONObject visitVariable(Variable variable) {
            return tagged("Variable").put("name", variable.name()).put("sort", variable.sort().name());
        }

        @Override
        public JSONObject visitApplication(Application application) {
            return tagged("Application")
                    .put("function", application.function())
                    .put("args", array(application.args(), SpecCodec.this::encode));
        }

        @Override
        public JSONObject visitFieldAccess(FieldAccess fieldAccess) {
            return tagged("FieldAccess")
                    .put("base", encode(fieldAccess.base()))
                    .put("field", fieldAccess.field());
        }
    }

    private final class FormulaEncoder implements FormulaVisitor<JSONObject> {
        private JSONObject equation(String type, Equation equation) {
            return tagged(type)
                    .put("kind", equation.kind().tag())
                    .put("left", encode(equation.left()))
                    .put("right", encode(equation.right()));
        }

        private JSONObject binary(String type, Formula left, Formula right) {
            return tagged(type).put("left", encode(left)).put("right", encode(right));
        }

        private JSONObject quantifier(String type, Quantifier quantifier) {
            return tagged(type)
                    .put("bound_name", quantifier.bound().name())
                    .put("bound_sort", quantifier.bound().sort().name())
                    .put("body", encode(quantifier.body()));
        }

        @Override
        public JSONObject visitStrongEquation(StrongEquation equation) {
            return equation("StrongEquation", equation);
        }

        @Override
        public JSONObject visitExistentialEquation(ExistentialEquation equation) {
            return equation("ExistentialEquation", equation);
        }

        @Override
        public JSONObject visitPredicateApplication(PredicateApplication application) {
            return tagged("PredicateApplication")
                    .put("predicate", application.predicate())
                    .put("args", array(application.args(), SpecCodec.this::encode));
        }

        @Override
        public JSONObject visitNegation(Negation negation) {
            return tagged("Negation").put("formula", encode(negation.formula()));
        }

        @Override
        public JSONObject visitConjunction(Conjunction conjunction) {
            return binary("Conjunction", conjunction.left(), conjunction.right());
        }

        @Override
        public JSONObject visitDisjunction(Disjunction disjunction) {
            return binary("Disjunction", disjunction.left(), disjunction.right());
        }

        @Override
        public JSONObject visitImplication(Implication implication) {
            return tagged("Implication")
                    .put("antecedent", encode(implication.antecedent()))
                    .put("consequent", encode(implication.consequent()));
        }

        @Override
        public JSONObject visitBiconditional(Biconditional biconditional) {
            return binary("Biconditional", biconditional.left(), biconditional.right());
        }

        @Override
        public JSONObject visitUniversal(UniversalQuantifier quantifier) {
            return quantifier("UniversalQuantifier", quantifier);
        }

        @Override
        public JSONObject visitExistential(ExistentialQuantifier quantifier) {
            return quantifier("ExistentialQuantifier", quantifier);
        }

        @Override
        public JSONObject visitDefinedness(Definedness definedness) {
            return tagged("Definedness").put("term", encode(definedness.term()));
        }
    }

    // =========================================================================
    // Decoding
    // =========================================================================

    public Sort decodeSort(JSONObject node) {
        String type = type(node);
        return switch (type) {
            case "AtomicSort" -> new AtomicSort(sortRef(node, type, "name"));
            case "ProductSort" -> decodeProduct(node, type);
            case "CoproductSort" -> decodeCoproduct(node, type);
            default -> throw CodecException.unknownNodeType("sort", type);
        };
    }

    private static ProductSort decodeProduct(JSONObject node, String type) {
        List<ProductSort.Field> fields = new ArrayList<>();
        for (JSONObject field : objects(node, type, "fields")) {
            fields.add(new ProductSort.Field(string(field, type, "name"), sortRef(field, type, "sort")));
        }
        return new ProductSort(sortRef(node, type, "name"), fields);
    }

    private static CoproductSort decodeCoproduct(JSONObject node, String type) {
        List<CoproductSort.Variant> variants = new ArrayList<>();
        for (JSONObject variant : objects(node, type, "variants")) {
            variants.add(new CoproductSort.Variant(string(variant, type, "tag"), sortRef(variant, type, "sort")));
        }
        return new CoproductSort(sortRef(node, type, "name"), variants);
    }

    public FunctionSymbol decodeFunctionSymbol(JSONObject node) {
        String type = expect(node, "FunctionSymbol");
        String tag = string(node, type, "totality");
        Totality totality;
        try {
            totality = Totality.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw CodecException.malformed(type, "totality", "unknown totality '" + tag + "'", e);
        }
        return new FunctionSymbol(string(node, type, "name"), decodeParams(node, type), sortRef(node, type, "result"),
                totality);
    }

    public PredicateSymbol decodePredicateSymbol(JSONObject node) {
        String type = expect(node, "PredicateSymbol");
        return new PredicateSymbol(string(node, type, "name"), decodeParams(node, type));
    }

    public GeneratedSortInfo decodeGeneratedSortInfo(JSONObject node) {
        String type = expect(node, "GeneratedSortInfo");
        JSONArray names = array(node, type, "constructors");
        List<String> constructors = new ArrayList<>(names.length());
        for (int i = 0; i < names.length(); i++) {
            if (!(names.opt(i) instanceof String name)) {
                throw CodecException.malformed(type, "constructors[" + i + "]", "a string");
            }
            constructors.add(name);
        }
        Map<String, Map<String, SortRef>> selectors = new LinkedHashMap<>();
        for (JSONObject entry : objects(node, type, "selectors")) {
            String constructor = string(entry, type, "constructor");
            Map<String, SortRef> perConstructor = new LinkedHashMap<>();
            for (JSONObject selector : objects(entry, type, "selectors")) {
                String name = string(selector, type, "name");
                if (perConstructor.put(name, sortRef(selector, type, "sort")) != null) {
                    throw CodecException.malformed(type, "selectors",
                            "selector '" + name + "' listed twice for constructor '" + constructor + "'", null);
                }
            }
            if (selectors.put(constructor, perConstructor) != null) {
                throw CodecException.malformed(type, "selectors",
                        "constructor '" + constructor + "' has more than one selector entry", null);
            }
        }
        return new GeneratedSortInfo(constructors, selectors);
    }

    /**
     * Replays the encoded declarations in order, so a document that would not
     * pass the signature's own checks is rejected with the same error.
     */
    public Signature decodeSignature(JSONObject node) {
        String type = expect(node, "Signature");
        Signature signature = Signature.empty();
        for (JSONObject sort : objects(node, type, "sorts")) {
            signature = signature.declareSort(decodeSort(sort));
        }
        for (JSONObject function : objects(node, type, "functions")) {
            signature = signature.declareFunction(decodeFunctionSymbol(function));
        }
        for (JSONObject predicate : objects(node, type, "predicates")) {
            signature = signature.declarePredicate(decodePredicateSymbol(predicate));
        }
        for (JSONObject entry : objects(node, type, "generated_sorts")) {
            signature = signature.declareGeneratedSort(sortRef(entry, type, "sort"),
                    decodeGeneratedSortInfo(object(entry, type, "info")));
        }
        return signature;
    }

    public Term decodeTerm(JSONObject node, Signature signature) {
        String type = type(node);
        return switch (type) {
            case "Variable" -> Variable.of(signature, string(node, type, "name"), sortRef(node, type, "sort"));
            case "Application" ->
                    Application.of(signature, string(node, type, "function"), decodeTerms(node, type, signature));
            case "FieldAccess" ->
                    FieldAccess.of(signature, term(node, type, "base", signature), string(node, type, "field"));
            default -> throw CodecException.unknownNodeType("term", type);
        };
    }

    public Formula decodeFormula(JSONObject node, Signature signature) {
        String type = type(node);
        return switch (type) {
            case "StrongEquation" -> {
                checkKind(node, type, Equation.Kind.STRONG);
                yield new StrongEquation(term(node, type, "left", signature), term(node, type, "right", signature));
            }
            case "ExistentialEquation" -> {
                checkKind(node, type, Equation.Kind.EXISTENTIAL);
                yield new ExistentialEquation(term(node, type, "left", signature),
                        term(node, type, "right", signature));
            }
            case "PredicateApplication" ->
                    PredicateApplication.of(signature, string(node, type, "predicate"),
                            decodeTerms(node, type, signature));
            case "Negation" -> new Negation(formula(node, type, "formula", signature));
            case "Conjunction" ->
                    new Conjunction(formula(node, type, "left", signature), formula(node, type, "right", signature));
            case "Disjunction" ->
                    new Disjunction(formula(node, type, "left", signature), formula(node, type, "right", signature));
            case "Implication" ->
                    new Implication(formula(node, type, "antecedent", signature),
                            formula(node, type, "consequent", signature));
            case "Biconditional" ->
                    new Biconditional(formula(node, type, "left", signature), formula(node, type, "right", signature));
            case "UniversalQuantifier" ->
                    new UniversalQuantifier(bound(node, type, signature), formula(node, type, "body", signature));
            case "ExistentialQuantifier" ->
                    new ExistentialQuantifier(bound(node, type, signature), formula(node, type, "body", signature));
            case "Definedness" -> new Definedness(term(node, type, "term", signature));
            default -> throw CodecException.unknownNodeType("formula", type);
        };
    }

    public Axiom decodeAxiom(JSONObject node, Signature signature) {
        String type = expect(node, "Axiom");
        return new Axiom(string(node, type, "label"), decodeFormula(object(node, type, "formula"), signature));
    }

    public Specification decodeSpecification(JSONObject node) {
        String type = expect(node, "Specification");
        Signature signature = decodeSignature(object(node, type, "signature"));
        List<Axiom> axioms = new ArrayList<>();
        for (JSONObject axiom : objects(node, type, "axioms")) {
            axioms.add(decodeAxiom(axiom, signature));
        }
        return Specification.build(string(node, type, "name"), signature, axioms);
    }

    private List<Term> decodeTerms(JSONObject node, String type, Signature signature) {
        List<Term> terms = new ArrayList<>();
        for (JSONObject arg : objects(node, type, "args")) {
            terms.add(decodeTerm(arg, signature));
        }
        return terms;
    }

    private Term term(JSONObject node, String type, String key, Signature signature) {
        return decodeTerm(object(node, type, key), signature);
    }

    private Formula formula(JSONObject node, String type, String key, Signature signature) {
        return decodeFormula(object(node, type, key), signature);
    }

    private static Variable bound(JSONObject node, String type, Signature signature) {
        return Variable.of(signature, string(node, type, "bound_name"), sortRef(node, type, "bound_sort"));
    }

    private static void checkKind(JSONObject node, String type, Equation.Kind kind) {
        String tag = string(node, type, "kind");
        if (!tag.equals(kind.tag())) {
            throw CodecException.malformed(type, "kind", "kind '" + tag + "' does not match the node type", null);
        }
    }

    private static List<Parameter> decodeParams(JSONObject node, String type) {
        List<Parameter> params = new ArrayList<>();
        for (JSONObject param : objects(node, type, "params")) {
            params.add(new Parameter(string(param, type, "name"), sortRef(param, type, "sort")));
        }
        return params;
    }

    // =========================================================================
    // Field access
    // =========================================================================

    private static String type(JSONObject node) {
        Preconditions.checkNotNull(node, "node");
        if (!(node.opt(TYPE) instanceof String type)) {
            throw CodecException.malformed("untyped", TYPE, "a string");
        }
        return type;
    }

    private static String expect(JSONObject node, String expected) {
        String type = type(node);
        if (!type.equals(expected)) {
            throw CodecException.unknownNodeType(expected, type);
        }
        return type;
    }

    private static String string(JSONObject node, String type, String key) {
        if (!(node.opt(key) instanceof String value)) {
            throw CodecException.malformed(type, key, "a string");
        }
        return value;
    }

    private static SortRef sortRef(JSONObject node, String type, String key) {
        String name = string(node, type, key);
        if (name.isBlank()) {
            throw CodecException.malformed(type, key, "a non-blank sort name");
        }
        return SortRef.of(name);
    }

    private static JSONObject object(JSONObject node, String type, String key) {
        if (!(node.opt(key) instanceof JSONObject value)) {
            throw CodecException.malformed(type, key, "an object");
        }
        return value;
    }

    private static JSONArray array(JSONObject node, String type, String key) {
        if (!(node.opt(key) instanceof JSONArray value)) {
            throw CodecException.malformed(type, key, "an array");
        }
        return value;
    }

    private static List<JSONObject> objects(JSONObject node, String type, String key) {
        JSONArray items = array(node, type, key);
        List<JSONObject> out = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            if (!(items.opt(i) instanceof JSONObject item)) {
                throw CodecException.malformed(type, key + "[" + i + "]", "an object");
            }
            out.add(item);
        }
        return out;
    }
}
