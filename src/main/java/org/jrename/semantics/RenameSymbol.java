package org.jrename.semantics;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A language-neutral view of a resolved symbol in one snapshot. Equality is by {@link SymbolKey}, so the same symbol
 * seen through two compilations of one snapshot compares equal.
 */
public final class RenameSymbol {
    public final SymbolKey key;
    public final String name;
    public final SymbolKind kind;
    public final ImmutableList<SymbolLocation> locations;
    /** Declared {@code private}, or otherwise invisible outside its top-level type. */
    public final boolean isPrivate;

    public final Optional<SymbolKey> containingSymbol;
    public final Optional<SymbolKey> overriddenMember;
    public final boolean overriddenMemberInMetadata;

    public RenameSymbol(
            SymbolKey key,
            String name,
            SymbolKind kind,
            List<SymbolLocation> locations,
            boolean isPrivate,
            Optional<SymbolKey> containingSymbol,
            Optional<SymbolKey> overriddenMember,
            boolean overriddenMemberInMetadata) {
        this.key = Objects.requireNonNull(key);
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.locations = ImmutableList.copyOf(locations);
        this.isPrivate = isPrivate;
        this.containingSymbol = containingSymbol;
        this.overriddenMember = overriddenMember;
        this.overriddenMemberInMetadata = overriddenMemberInMetadata;
    }

    public boolean isOverride() {
        return overriddenMember.isPresent();
    }

    public Optional<SymbolLocation> firstLocation() {
        if (locations.isEmpty()) return Optional.empty();
        return Optional.of(locations.get(0));
    }

    public Optional<SymbolLocation> firstSourceLocation() {
        for (var location : locations) {
            if (location.isInSource()) return Optional.of(location);
        }
        return Optional.empty();
    }

    /** Display name used to compare symbols that only exist in compiled classes. */
    public String metadataName() {
        return key.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof RenameSymbol)) return false;
        return key.equals(((RenameSymbol) other).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s %s", kind, key);
    }
}
