/*
 * @LICENSE@
 */

package org.tnfa.regex;

/**
 * Classifies pattern characters. Literal symbols are the ASCII letters and
 * digits; everything else is either an operator, a grouping character, or
 * not part of the pattern language at all.
 */
final class Alphabet {

    private Alphabet() {
    } // never instantiated

    static final char UNION = '|';
    static final char UNION_ALT = '+';
    static final char STAR = '*';
    static final char CONCAT = '.';   // internal only; never written by users
    static final char OPEN = '(';
    static final char CLOSE = ')';

    static boolean isSymbol(int c) {
        return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z')
                || ('0' <= c && c <= '9');
    }

    static boolean isUnion(int c) {
        return c == UNION || c == UNION_ALT;
    }
}
