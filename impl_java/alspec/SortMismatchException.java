package alspec;

import alspec.sort.SortRef;

/**
 * A term of one sort was used where another sort is required.
 */
public class SortMismatchException extends SpecException {

    public static final int NO_POSITION = -1;

    private final int position;
    private final SortRef expected;
    private final SortRef actual;

    public SortMismatchException(String context, int position, SortRef expected, SortRef actual) {
        super(Kind.SORT_MISMATCH, context, describe(context, position, expected, actual));
        this.position = position;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Zero-based argument position, or {@link #NO_POSITION} for equations and binders.
     */
    public int position() {
        return position;
    }

    public SortRef expected() {
        return expected;
    }

    public SortRef actual() {
        return actual;
    }

    private static String describe(String context, int position, SortRef expected, SortRef actual) {
        if (position == NO_POSITION) {
            return String.format("Sort mismatch in %s: expected %s, got %s", context, expected, actual);
        }
        return String.format("Sort mismatch in %s at argument %d: expected %s, got %s",
                context, position, expected, actual);
    }
}
