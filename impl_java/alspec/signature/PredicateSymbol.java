package alspec.signature;

import alspec.sort.SortRef;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

public record PredicateSymbol(String name, List<Parameter> params) {
    public PredicateSymbol {
        Preconditions.checkNotNull(name, "predicate name");
        params = ImmutableList.copyOf(params);
    }

    public int arity() {
        return params.size();
    }

    public List<SortRef> argumentSorts() {
        return params.stream().map(Parameter::sort).toList();
    }

    @Override
    public String toString() {
        return "pred " + name + " : " + String.join(" × ", argumentSorts().stream().map(Object::toString).toArray(String[]::new));
    }
}
