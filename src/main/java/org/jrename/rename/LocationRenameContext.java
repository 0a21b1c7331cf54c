package org.jrename.rename;

import java.util.Objects;

/** A rename location together with the text that replaces it. */
public final class LocationRenameContext {
    public final RenameLocation renameLocation;
    public final String replacementText;
    public final String originalText;
    public final boolean replacementTextValid;

    public LocationRenameContext(
            RenameLocation renameLocation, String replacementText, String originalText, boolean replacementTextValid) {
        this.renameLocation = Objects.requireNonNull(renameLocation);
        this.replacementText = Objects.requireNonNull(replacementText);
        this.originalText = Objects.requireNonNull(originalText);
        this.replacementTextValid = replacementTextValid;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof LocationRenameContext)) return false;
        var that = (LocationRenameContext) other;
        return this.renameLocation.equals(that.renameLocation)
                && this.replacementText.equals(that.replacementText)
                && this.originalText.equals(that.originalText)
                && this.replacementTextValid == that.replacementTextValid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(renameLocation, replacementText, originalText, replacementTextValid);
    }

    @Override
    public String toString() {
        return String.format("%s: %s -> %s", renameLocation, originalText, replacementText);
    }
}
