/* @LICENSE@
 */

package org.tnfa.regex;

import static org.tnfa.regex.Misc.isSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

import org.tnfa.regex.RegexSyntaxException.Kind;

/**
 * Turns an infix pattern into a postfix token sequence: tokenize, make
 * concatenation explicit, bracket bare single symbol alternations, then
 * shunting-yard.
 */
final class RegexParser {

    static final class Result {
        Result(String regex, List<Token> infix, List<Token> postfix) {
            this.regex = regex;
            this.infix = Collections.unmodifiableList(infix);
            this.postfix = Collections.unmodifiableList(postfix);
        }
        final String regex;
        final List<Token> infix;    // concatenation explicit, bracketed
        final List<Token> postfix;
    }

    private final String regex;

    RegexParser(String regex) {
        this.regex = regex;
    }

    Result parse(int flags) {
        List<Token> tokens = tokenize(isSet(flags, NfaCompiler.X_IGNORE_WHITESPACE));
        if (tokens.isEmpty()) {
            throw new RegexSyntaxException(Kind.EMPTY_PATTERN, regex);
        }
        List<Token> infix = insertConcatenation(tokens);
        if (!isSet(flags, NfaCompiler.X_NO_BRACKETING)) {
            infix = bracketAlternation(infix);
        }
        return new Result(regex, infix, toPostfix(infix));
    }

    List<Token> tokenize(boolean ignoreWhitespace) {
        List<Token> ret = new ArrayList<Token>(regex.length());
        for (int i = 0; i < regex.length(); ++i) {
            char c = regex.charAt(i);
            if (ignoreWhitespace && Character.isWhitespace(c)) continue;
            Token t = Token.of(c);
            if (t == null) {
                throw new RegexSyntaxException(Kind.UNSUPPORTED_CHARACTER, regex, i);
            }
            ret.add(t);
        }
        return ret;
    }

    /*
     * One token of lookahead. Nothing follows an open group or a union;
     * nothing precedes a close group, a star or a union.
     */
    static List<Token> insertConcatenation(List<Token> tokens) {
        List<Token> ret = new ArrayList<Token>(2 * tokens.size());
        for (int i = 0; i < tokens.size(); ++i) {
            Token t = tokens.get(i);
            ret.add(t);
            if (t.is(Token.Kind.OPEN) || t.is(Token.Kind.UNION)) continue;
            if (i + 1 == tokens.size()) break;
            Token next = tokens.get(i + 1);
            switch (next.kind) {
            case CLOSE:
            case STAR:
            case UNION:
                continue;
            default:
                ret.add(Token.CONCAT);
            }
        }
        return ret;
    }

    /*
     * A union outside of any group whose neighbors are both single symbols
     * gets its own group: a|b becomes (a|b), ab|c becomes a(b|c). Longer
     * operands are not recognized; (aa|bb) has to be written by the user.
     * A starred symbol is not a single symbol on either side: a*|b and a|b*
     * are left to plain precedence.
     * Once wrapped, a symbol is no longer a neighbor of the next union, so
     * a|b|c becomes (a|b)|c.
     */
    static List<Token> bracketAlternation(List<Token> tokens) {
        List<Token> ret = new ArrayList<Token>(tokens.size() + 4);
        int depth = 0;
        for (int i = 0; i < tokens.size(); ++i) {
            Token t = tokens.get(i);
            switch (t.kind) {
            case OPEN:
                ++depth;
                break;
            case CLOSE:
                --depth;
                break;
            case UNION:
                if (depth != 0 || ret.isEmpty() || i + 1 == tokens.size()) break;
                Token left = ret.get(ret.size() - 1);
                Token right = tokens.get(i + 1);
                if (!left.is(Token.Kind.SYMBOL) || !right.is(Token.Kind.SYMBOL)) break;
                if (i + 2 < tokens.size() && tokens.get(i + 2).is(Token.Kind.STAR)) break;
                ret.set(ret.size() - 1, Token.OPEN);
                ret.add(left);
                ret.add(t);
                ret.add(right);
                ret.add(Token.CLOSE);
                ++i;
                continue;
            default:
                break;
            }
            ret.add(t);
        }
        return ret;
    }

    /*
     * Shunting-yard. Equal precedence reduces first: left associative.
     */
    List<Token> toPostfix(List<Token> infix) {
        List<Token> out = new ArrayList<Token>(infix.size());
        LinkedList<Token> ops = new LinkedList<Token>();
        for (Token t : infix) {
            switch (t.kind) {
            case SYMBOL:
                out.add(t);
                break;
            case OPEN:
                ops.push(t);
                break;
            case CLOSE:
                while (!ops.isEmpty() && !ops.peek().is(Token.Kind.OPEN)) {
                    out.add(ops.pop());
                }
                if (ops.isEmpty()) {
                    throw new RegexSyntaxException(Kind.UNBALANCED_GROUP, regex);
                }
                ops.pop();
                break;
            default:
                assert t.kind.isOperator() : t;
                while (!ops.isEmpty() && ops.peek().kind.isOperator()
                        && ops.peek().kind.precedence >= t.kind.precedence) {
                    out.add(ops.pop());
                }
                ops.push(t);
            }
        }
        while (!ops.isEmpty()) {
            Token t = ops.pop();
            if (t.is(Token.Kind.OPEN)) {
                throw new RegexSyntaxException(Kind.UNBALANCED_GROUP, regex);
            }
            out.add(t);
        }
        return out;
    }
}
