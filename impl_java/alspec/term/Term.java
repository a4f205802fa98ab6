package alspec.term;

import alspec.sort.SortRef;
import java.util.Set;

public sealed interface Term permits Variable, Application, FieldAccess {
    SortRef sort();

    /**
     * Variables occurring in the term, in order of first occurrence.
     */
    Set<Variable> vars();

    <R> R accept(TermVisitor<R> visitor);
}
