package alspec.sort;

import com.google.common.base.Preconditions;
import java.util.List;

public record AtomicSort(SortRef name) implements Sort {
    public AtomicSort {
        Preconditions.checkNotNull(name, "name");
    }

    @Override
    public List<SortRef> references() {
        return List.of();
    }

    @Override
    public <R> R accept(SortVisitor<R> visitor) {
        return visitor.visitAtomic(this);
    }

    @Override
    public String toString() {
        return name.name();
    }
}
