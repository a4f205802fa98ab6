package alspec.term;

public interface TermVisitor<R> {
    R visitVariable(Variable variable);

    R visitApplication(Application application);

    R visitFieldAccess(FieldAccess fieldAccess);
}
