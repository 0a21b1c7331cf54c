package org.jrename.semantics;

public enum SymbolKind {
    NAMESPACE,
    TYPE,
    TYPE_PARAMETER,
    CONSTRUCTOR,
    METHOD,
    FIELD,
    PARAMETER,
    LOCAL,
    OTHER;

    /** Symbols that cannot be seen outside the body that declares them. */
    public boolean isLocal() {
        switch (this) {
            case PARAMETER:
            case LOCAL:
            case TYPE_PARAMETER:
                return true;
            default:
                return false;
        }
    }
}
