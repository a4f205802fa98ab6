package alspec.sort;

import alspec.SpecException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A tagged union, used for case-analysis sorts such as Status = open | resolved.
 */
public record CoproductSort(SortRef name, List<Variant> variants) implements Sort {

    public record Variant(String tag, SortRef sort) {
        public Variant {
            Preconditions.checkNotNull(tag, "variant tag");
            Preconditions.checkNotNull(sort, "variant sort");
        }

        @Override
        public String toString() {
            return tag + "(" + sort + ")";
        }
    }

    public CoproductSort {
        Preconditions.checkNotNull(name, "name");
        variants = ImmutableList.copyOf(variants);
        Set<String> seen = new HashSet<>();
        for (Variant variant : variants) {
            if (!seen.add(variant.tag())) {
                throw SpecException.duplicate(SpecException.Kind.DUPLICATE_VARIANT, variant.tag(),
                        "coproduct sort " + name);
            }
        }
    }

    public Optional<SortRef> variantSort(String tag) {
        return variants.stream().filter(v -> v.tag().equals(tag)).map(Variant::sort).findFirst();
    }

    public List<String> tags() {
        return variants.stream().map(Variant::tag).toList();
    }

    @Override
    public List<SortRef> references() {
        return variants.stream().map(Variant::sort).toList();
    }

    @Override
    public <R> R accept(SortVisitor<R> visitor) {
        return visitor.visitCoproduct(this);
    }

    @Override
    public String toString() {
        return name + " = " + String.join(" | ", variants.stream().map(Object::toString).toArray(String[]::new));
    }
}
