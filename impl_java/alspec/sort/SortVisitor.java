package alspec.sort;

public interface SortVisitor<R> {
    R visitAtomic(AtomicSort sort);

    R visitProduct(ProductSort sort);

    R visitCoproduct(CoproductSort sort);
}
