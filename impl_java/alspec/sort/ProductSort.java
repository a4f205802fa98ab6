package alspec.sort;

import alspec.SpecException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record ProductSort(SortRef name, List<Field> fields) implements Sort {

    public record Field(String name, SortRef sort) {
        public Field {
            Preconditions.checkNotNull(name, "field name");
            Preconditions.checkNotNull(sort, "field sort");
        }

        @Override
        public String toString() {
            return name + ": " + sort;
        }
    }

    public ProductSort {
        Preconditions.checkNotNull(name, "name");
        fields = ImmutableList.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (Field field : fields) {
            if (!seen.add(field.name())) {
                throw SpecException.duplicate(SpecException.Kind.DUPLICATE_FIELD, field.name(), "product sort " + name);
            }
        }
    }

    public Optional<SortRef> fieldSort(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).map(Field::sort).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(Field::name).toList();
    }

    @Override
    public List<SortRef> references() {
        return fields.stream().map(Field::sort).toList();
    }

    @Override
    public <R> R accept(SortVisitor<R> visitor) {
        return visitor.visitProduct(this);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", fields.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }
}
