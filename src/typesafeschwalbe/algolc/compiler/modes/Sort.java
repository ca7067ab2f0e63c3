package typesafeschwalbe.algolc.compiler.modes;

// The strength of a syntactic position, i.e. which coercions it allows.
// Each sort allows everything the sorts before it allow.
public enum Sort {
    SOFT,   // deproceduring
    WEAK,   // and dereferencing that keeps a name
    MEEK,   // and dereferencing
    FIRM,   // and uniting
    STRONG; // and widening, rowing and voiding

    public boolean includes(Sort other) {
        return this.ordinal() >= other.ordinal();
    }

    @Override
    public String toString() {
        return this.name().toLowerCase();
    }
}
