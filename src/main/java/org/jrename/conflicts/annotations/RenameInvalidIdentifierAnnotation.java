package org.jrename.conflicts.annotations;

/** Marks a token whose replacement text is not a legal identifier. */
public final class RenameInvalidIdentifierAnnotation extends RenameAnnotation {
    public static final RenameInvalidIdentifierAnnotation INSTANCE = new RenameInvalidIdentifierAnnotation();

    private RenameInvalidIdentifierAnnotation() {}

    @Override
    public String toString() {
        return "invalid-identifier";
    }
}
