package alspec.signature;

import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A function symbol with its profile {@code f : s1 × ... × sn → s}, or
 * {@code →?} when partial. A function with no parameters is a constant.
 */
public record FunctionSymbol(String name, List<Parameter> params, SortRef result, Totality totality) {
    public FunctionSymbol {
        Preconditions.checkNotNull(name, "function name");
        Preconditions.checkNotNull(result, "result sort");
        Preconditions.checkNotNull(totality, "totality");
        params = ImmutableList.copyOf(params);
    }

    public int arity() {
        return params.size();
    }

    public List<SortRef> argumentSorts() {
        return params.stream().map(Parameter::sort).toList();
    }

    public boolean isConstant() {
        return params.isEmpty();
    }

    public boolean isPartial() {
        return totality == Totality.PARTIAL;
    }

    @Override
    public String toString() {
        String arrow = isPartial() ? " →? " : " → ";
        if (params.isEmpty()) {
            return name + " :" + arrow + result;
        }
        return name + " : " + String.join(" × ", argumentSorts().stream().map(Object::toString).toArray(String[]::new))
                + arrow + result;
    }
}
