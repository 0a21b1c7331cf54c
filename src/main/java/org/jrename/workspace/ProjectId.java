package org.jrename.workspace;

import java.util.Objects;

public final class ProjectId {
    public final String name;

    public ProjectId(String name) {
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ProjectId)) return false;
        return name.equals(((ProjectId) other).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
