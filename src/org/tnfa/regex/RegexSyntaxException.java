/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a pattern cannot be compiled to an automaton. Callers that only
 * care whether compilation succeeded can catch the
 * {@link PatternSyntaxException} base class; the {@link Kind} tells the
 * causes apart.
 */
public final class RegexSyntaxException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    /**
     * The distinct reasons a pattern is rejected.
     */
    public enum Kind {
        EMPTY_PATTERN("empty pattern"),
        UNSUPPORTED_CHARACTER("unsupported character"),
        UNBALANCED_GROUP("unbalanced parenthesis"),
        /**
         * An operator found fewer operands than it needs.
         */
        MISSING_OPERAND("operator is missing an operand"),
        /**
         * Operands were left over once every operator was applied.
         */
        DANGLING_OPERAND("operand without operator");

        final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    private final Kind kind;

    RegexSyntaxException(Kind kind, String regex, int index) {
        super(kind.description, regex, index);
        this.kind = kind;
    }

    RegexSyntaxException(Kind kind, String regex) {
        this(kind, regex, -1);
    }

    public Kind kind() {
        return kind;
    }
}
