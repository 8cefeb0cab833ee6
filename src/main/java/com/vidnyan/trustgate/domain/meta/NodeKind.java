package com.vidnyan.trustgate.domain.meta;

/**
 * Closed set of language-agnostic node kinds.
 * Syntax node types with no mapping become {@link #UNKNOWN}; they are kept, never dropped.
 */
public enum NodeKind {
    MODULE,
    FUNCTION,
    CLASS,
    CALL,
    ASSIGNMENT,
    LOOP,
    CONDITIONAL,
    IMPORT,
    RETURN,
    VARIABLE,
    LITERAL,
    BINARY_OP,
    PARAMETER,
    BLOCK,
    ATTRIBUTE,
    TRY_EXCEPT,
    RAISE,
    UNKNOWN;

    /**
     * Kinds that form one control-flow step on their own.
     */
    public boolean isStatement() {
        return switch (this) {
            case ASSIGNMENT, CALL, RETURN, IMPORT, RAISE -> true;
            default -> false;
        };
    }
}
