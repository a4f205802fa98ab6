package alspec;

/**
 * Raised when a sort, symbol, term, formula or specification cannot be built
 * because it would violate one of the model's invariants. Nothing is ever
 * partially constructed: the operation that throws leaves its inputs untouched.
 */
public class SpecException extends RuntimeException {

    public enum Kind {
        UNKNOWN_SORT,
        UNKNOWN_FUNCTION,
        UNKNOWN_PREDICATE,
        UNKNOWN_FIELD,
        UNKNOWN_OBSERVER,
        ARITY_MISMATCH,
        SORT_MISMATCH,
        DUPLICATE_SORT,
        DUPLICATE_SYMBOL,
        DUPLICATE_FIELD,
        DUPLICATE_VARIANT,
        DUPLICATE_GENERATED_SORT,
        DUPLICATE_AXIOM_LABEL,
        WRONG_RESULT_SORT,
        UNBOUND_VARIABLE,
        UNKNOWN_NODE_TYPE,
        MALFORMED_NODE
    }

    private final Kind kind;
    private final String subject;

    public SpecException(Kind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public SpecException(Kind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The name the failure is about: the missing sort, the colliding symbol, the free variable...
     */
    public String subject() {
        return subject;
    }

    public static SpecException unknownSort(String missing, String referrer) {
        return new SpecException(Kind.UNKNOWN_SORT, missing,
                String.format("Unknown sort '%s' referenced by '%s'", missing, referrer));
    }

    public static SpecException unknownFunction(String name) {
        return new SpecException(Kind.UNKNOWN_FUNCTION, name, String.format("Unknown function '%s'", name));
    }

    public static SpecException unknownPredicate(String name) {
        return new SpecException(Kind.UNKNOWN_PREDICATE, name, String.format("Unknown predicate '%s'", name));
    }

    public static SpecException unknownField(String field, String sort) {
        return new SpecException(Kind.UNKNOWN_FIELD, field,
                String.format("Sort '%s' has no field '%s'", sort, field));
    }

    public static SpecException unknownObserver(String name, String constructor) {
        return new SpecException(Kind.UNKNOWN_OBSERVER, name,
                String.format("Selector '%s' of constructor '%s' is neither a declared function nor a predicate",
                        name, constructor));
    }

    public static SpecException arityMismatch(String symbol, int expected, int actual) {
        return new SpecException(Kind.ARITY_MISMATCH, symbol,
                String.format("'%s' expects %d argument(s), got %d", symbol, expected, actual));
    }

    public static SpecException duplicate(Kind kind, String name, String owner) {
        return new SpecException(kind, name, String.format("'%s' is already declared in %s", name, owner));
    }

    public static SpecException wrongResultSort(String function, String expected, String actual) {
        return new SpecException(Kind.WRONG_RESULT_SORT, function,
                String.format("'%s' has result sort '%s', expected '%s'", function, actual, expected));
    }
}
