package alspec.signature;

public enum Totality {
    TOTAL("total"),
    PARTIAL("partial");

    private final String tag;

    Totality(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Totality fromTag(String tag) {
        for (Totality totality : values()) {
            if (totality.tag.equals(tag)) return totality;
        }
        throw new IllegalArgumentException("Unknown totality: " + tag);
    }
}
