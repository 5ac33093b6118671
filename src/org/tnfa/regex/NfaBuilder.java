/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tnfa.regex.RegexSyntaxException.Kind;

/**
 * Interprets a postfix token sequence over a stack of {@link Fragment}s.
 * Symbols push a literal fragment; operators pop their operands (right
 * operand first) and push the combined fragment. Exactly one fragment must
 * remain at the end.
 */
final class NfaBuilder {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINER;

    private final String regex;
    private final LinkedList<Fragment> stack = new LinkedList<Fragment>();

    NfaBuilder(String regex) {
        this.regex = regex;
    }

    Fragment build(List<Token> postfix) {
        stack.clear();
        for (Token t : postfix) {
            Fragment f;
            switch (t.kind) {
            case SYMBOL:
                f = Fragment.literal(t.symbol);
                break;
            case CONCAT: {
                Fragment right = pop();
                Fragment left = pop();
                f = Fragment.concat(left, right);
                break;
            }
            case UNION: {
                Fragment right = pop();
                Fragment left = pop();
                f = Fragment.union(left, right);
                break;
            }
            case STAR:
                f = Fragment.star(pop());
                break;
            default:
                // grouping never survives the postfix conversion
                throw new IllegalStateException("unexpected token in postfix: " + t);
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "'" + t + "' -> " + f);
            }
            stack.push(f);
        }
        if (stack.isEmpty()) {
            throw new RegexSyntaxException(Kind.EMPTY_PATTERN, regex);
        }
        if (stack.size() > 1) {
            throw new RegexSyntaxException(Kind.DANGLING_OPERAND, regex);
        }
        return stack.pop();
    }

    private Fragment pop() {
        if (stack.isEmpty()) {
            throw new RegexSyntaxException(Kind.MISSING_OPERAND, regex);
        }
        return stack.pop();
    }
}
