/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.tnfa.regex.Misc.FlagMgr;

/**
 * Compiles a regular expression to an {@link NFA} by Thompson's
 * construction.
 * <p>
 * <strong>Syntax:</strong> literal symbols are the ASCII letters and digits.
 * Operators are union (<code>|</code>, or <code>+</code>), Kleene star
 * (<code>*</code>) and implicit concatenation, binding loosest to tightest as
 * union, concatenation, star. Parenthesis group. There are no character
 * classes, anchors, back references or escapes.
 * <p>
 * <strong>Alternation:</strong> an unparenthesized union whose operands are
 * single symbols is grouped on its own, so <code>ab|c</code> reads as
 * <code>a(b|c)</code>. Operands longer than one symbol must be grouped
 * explicitly: <code>(aa|bb)</code>. The {@link #X_NO_BRACKETING} flag turns
 * this off.
 * <p>
 * <strong>Concatenation</strong> is built without epsilon edges: the exit
 * state of the left operand and the entry state of the right operand are the
 * same state. State numbering, and therefore the serialized
 * {@linkplain NfaDocument document}, depends on this.
 * <p>
 * Compilation either returns an automaton or throws a
 * {@link RegexSyntaxException}; nothing is retained between calls.
 */
public final class NfaCompiler {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Skips the grouping of unparenthesized single symbol alternations; the
     * pattern is read with plain precedence, so <code>ab|c</code> is
     * <code>(ab)|c</code>.
     */
    public static final int X_NO_BRACKETING = flagMgr.next("X_NO_BRACKETING");

    /**
     * Whitespace in the pattern is skipped instead of rejected.
     */
    public static final int X_IGNORE_WHITESPACE = flagMgr.next("X_IGNORE_WHITESPACE");

    static final int FLAG_COUNT =
            flagMgr.freezeAndCount();

    private NfaCompiler() {
    } // never instantiated

    public static NFA compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @param flags
     *            the specified flags.
     * @return the automaton.
     * @throws RegexSyntaxException
     *             if the pattern is empty, uses unsupported characters, has
     *             unbalanced parenthesis, or misplaces an operator.
     * @throws IllegalArgumentException
     *             on unknown flags.
     */
    public static NFA compile(String regex, int flags) {
        RegexParser.Result r = parse(regex, flags);
        NFA nfa = new NFA(new NfaBuilder(regex).build(r.postfix));
        logger.log(level, "nfa final: " + nfa);
        return nfa;
    }

    /**
     * The postfix form of a pattern, with <code>.</code> for concatenation,
     * <code>|</code> for union and <code>*</code> for star. For example
     * <code>a(a|b)ab*</code> becomes <code>aab|.a.b*.</code>.
     */
    public static String postfix(String regex) {
        return postfix(regex, 0);
    }

    public static String postfix(String regex, int flags) {
        return Token.stringFrom(parse(regex, flags).postfix);
    }

    private static RegexParser.Result parse(String regex, int flags) {
        flagMgr.check(flags);
        logger.log(level, "regex: " + regex);
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        RegexParser.Result r = new RegexParser(regex).parse(flags);
        logger.log(level, "infix: " + Token.stringFrom(r.infix));
        logger.log(level, "postfix: " + Token.stringFrom(r.postfix));
        return r;
    }
}
