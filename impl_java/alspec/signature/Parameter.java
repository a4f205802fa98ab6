package alspec.signature;

import alspec.sort.SortRef;
import com.google.common.base.Preconditions;

public record Parameter(String name, SortRef sort) {
    public Parameter {
        Preconditions.checkNotNull(name, "parameter name");
        Preconditions.checkNotNull(sort, "parameter sort");
    }

    @Override
    public String toString() {
        return name + ": " + sort;
    }
}
