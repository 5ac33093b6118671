/*
 * @LICENSE@
 */

package org.tnfa.regex;

/**
 * An immutable element of a tokenized pattern: a literal symbol, an operator,
 * or a grouping character. Tokens carry no position; their place in the
 * sequence is all there is.
 */
final class Token {

    /**
     * Token categories. Operators carry their precedence rank: star binds
     * tighter than concatenation, which binds tighter than union. Non
     * operators have rank zero.
     */
    enum Kind {
        SYMBOL(0),
        UNION(1),
        CONCAT(2),
        STAR(3),
        OPEN(0),
        CLOSE(0);

        final int precedence;

        Kind(int precedence) {
            this.precedence = precedence;
        }

        boolean isOperator() {
            return precedence > 0;
        }
    }

    static final Token UNION = new Token(Kind.UNION, Alphabet.UNION);
    static final Token CONCAT = new Token(Kind.CONCAT, Alphabet.CONCAT);
    static final Token STAR = new Token(Kind.STAR, Alphabet.STAR);
    static final Token OPEN = new Token(Kind.OPEN, Alphabet.OPEN);
    static final Token CLOSE = new Token(Kind.CLOSE, Alphabet.CLOSE);

    final Kind kind;
    final char symbol;

    private Token(Kind kind, char symbol) {
        this.kind = kind;
        this.symbol = symbol;
    }

    static Token symbol(char c) {
        if (!Alphabet.isSymbol(c)) {
            throw new IllegalArgumentException("not a symbol: " + c);
        }
        return new Token(Kind.SYMBOL, c);
    }

    /**
     * Maps a pattern character to its token. Both union spellings map to the
     * canonical {@link #UNION} token.
     * 
     * @param c
     *            the pattern character
     * @return the token, or <code>null</code> if the character is neither a
     *         symbol nor an operator or grouping character.
     */
    static Token of(char c) {
        if (Alphabet.isSymbol(c)) return symbol(c);
        if (Alphabet.isUnion(c)) return UNION;
        switch (c) {
        case Alphabet.STAR:
            return STAR;
        case Alphabet.OPEN:
            return OPEN;
        case Alphabet.CLOSE:
            return CLOSE;
        default:
            return null;
        }
    }

    boolean is(Kind k) {
        return kind == k;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        final Token t = (Token) o;
        return kind == t.kind && symbol == t.symbol;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }

    static String stringFrom(Iterable<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.symbol);
        }
        return sb.toString();
    }
}
