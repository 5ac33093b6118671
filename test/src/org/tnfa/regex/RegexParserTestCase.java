/* @LICENSE@  
 */

package org.tnfa.regex;

import java.util.List;

import org.tnfa.regex.RegexSyntaxException.Kind;

public class RegexParserTestCase extends AbstractNfaTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static List<Token> tokens(String regex) {
        return new RegexParser(regex).tokenize(false);
    }

    private static String concatenated(String regex) {
        return Token.stringFrom(RegexParser.insertConcatenation(tokens(regex)));
    }

    private static String bracketed(String regex) {
        return Token.stringFrom(RegexParser.bracketAlternation(
            RegexParser.insertConcatenation(tokens(regex))));
    }

    public void testTokenize() {
        List<Token> t = tokens("a(B|7)*");
        assertEquals(7, t.size());
        assertEquals(Token.symbol('a'), t.get(0));
        assertSame(Token.OPEN, t.get(1));
        assertEquals(Token.Kind.SYMBOL, t.get(2).kind);
        assertSame(Token.UNION, t.get(3));
        assertEquals('7', t.get(4).symbol);
        assertSame(Token.CLOSE, t.get(5));
        assertSame(Token.STAR, t.get(6));
    }

    public void testPlusIsUnion() {
        assertSame(Token.UNION, tokens("+").get(0));
        assertEquals("a|b", Token.stringFrom(tokens("a+b")));
    }

    public void testUnsupportedCharacter() {
        try {
            tokens("ab.c");
            fail("should throw");
        } catch (RegexSyntaxException e) {
            assertEquals(Kind.UNSUPPORTED_CHARACTER, e.kind());
            assertEquals(2, e.getIndex());
        }
        assertInvalid("a b", Kind.UNSUPPORTED_CHARACTER);
        assertInvalid("a?", Kind.UNSUPPORTED_CHARACTER);
        assertInvalid("[ab]", Kind.UNSUPPORTED_CHARACTER);
        assertInvalid("\\(", Kind.UNSUPPORTED_CHARACTER);
    }

    public void testIgnoreWhitespace() {
        assertEquals("ab", Token.stringFrom(new RegexParser(" a\tb \n").tokenize(true)));
        assertEquals("ab|", NfaCompiler.postfix("a | b", NfaCompiler.X_IGNORE_WHITESPACE));
    }

    public void testInsertConcatenation() {
        assertEquals("a.(a|b).a.b*", concatenated("a(a|b)ab*"));
        assertEquals("(a.b)*", concatenated("(ab)*"));
        assertEquals("a*.b*.a.b.b", concatenated("a*b*abb"));
        assertEquals("a", concatenated("a"));
        assertEquals("(a)*.(b)", concatenated("(a)*(b)"));
        assertEquals("a|b", concatenated("a|b"));
    }

    public void testBracketAlternation() {
        assertEquals("(a|b)", bracketed("a|b"));
        assertEquals("a.(b|c)", bracketed("ab|c"));
        assertEquals("(a|b).c", bracketed("a|bc"));
        assertEquals("(a|b)|c", bracketed("a|b|c"));
    }

    public void testBracketAlternationLeavesGroupsAlone() {
        assertEquals("a.(a|b).a.b*", bracketed("a(a|b)ab*"));
        assertEquals("(a.a|b.b)", bracketed("(aa|bb)"));
        assertEquals("(a.b)|c", bracketed("(ab)|c"));
        assertEquals("a*|b", bracketed("a*|b"));
        assertEquals("a|b*", bracketed("a|b*"));
        assertEquals("x.a|b*", bracketed("xa|b*"));
        assertEquals("(a|b).c*", bracketed("a|bc*"));
    }

    public void testPostfixStarredUnionOperand() {
        assertEquals("ab*|", NfaCompiler.postfix("a|b*"));
        assertEquals("a*b|", NfaCompiler.postfix("a*|b"));
    }

    public void testPostfix() {
        assertEquals("aab|.a.b*.", NfaCompiler.postfix("a(a|b)ab*"));
        assertEquals("ab.*", NfaCompiler.postfix("(ab)*"));
        assertEquals("a*b*.a.b.b.", NfaCompiler.postfix("a*b*abb"));
        assertEquals("ab|", NfaCompiler.postfix("a+b"));
    }

    public void testPostfixPrecedence() {
        // star over concatenation over union
        assertEquals("ab*.c|", NfaCompiler.postfix("ab*|c", NfaCompiler.X_NO_BRACKETING));
        assertEquals("abc.|", NfaCompiler.postfix("a|bc", NfaCompiler.X_NO_BRACKETING));
        // equal precedence reduces left to right
        assertEquals("ab.c.", NfaCompiler.postfix("abc"));
        assertEquals("ab|c|", NfaCompiler.postfix("a|b|c", NfaCompiler.X_NO_BRACKETING));
        assertEquals("a**", NfaCompiler.postfix("a**"));
    }

    public void testPostfixBracketing() {
        assertEquals("abc|.", NfaCompiler.postfix("ab|c"));
        assertEquals("ab.c|", NfaCompiler.postfix("ab|c", NfaCompiler.X_NO_BRACKETING));
    }

    public void testUnbalanced() {
        assertInvalid("(ab", Kind.UNBALANCED_GROUP);
        assertInvalid("ab)", Kind.UNBALANCED_GROUP);
        assertInvalid("((a)", Kind.UNBALANCED_GROUP);
        assertInvalid("(a))(", Kind.UNBALANCED_GROUP);
        assertInvalid(")(", Kind.UNBALANCED_GROUP);
    }

    public void testUnbalancedCarriesPattern() {
        RegexParser rxp = new RegexParser("(ab");
        try {
            rxp.toPostfix(RegexParser.insertConcatenation(rxp.tokenize(false)));
            fail("should throw");
        } catch (RegexSyntaxException e) {
            assertEquals(Kind.UNBALANCED_GROUP, e.kind());
            assertEquals("(ab", e.getPattern());
        }
        try {
            new RegexParser("a)").toPostfix(tokens("a)"));
            fail("should throw");
        } catch (RegexSyntaxException e) {
            assertEquals("a)", e.getPattern());
        }
    }

    public void testEmpty() {
        assertInvalid("", Kind.EMPTY_PATTERN);
        assertInvalid("()", Kind.EMPTY_PATTERN);
        assertInvalid("  ", NfaCompiler.X_IGNORE_WHITESPACE, Kind.EMPTY_PATTERN);
    }

    public void testUnknownFlags() {
        try {
            NfaCompiler.compile("a", 1 << NfaCompiler.FLAG_COUNT);
            fail("should throw");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("unknown flags"));
        }
        int all = NfaCompiler.X_NO_BRACKETING | NfaCompiler.X_IGNORE_WHITESPACE;
        assertEquals("ab|", NfaCompiler.postfix("a | b", all));
    }

    public void testFlagNames() {
        Misc.FlagMgr mgr = new Misc.FlagMgr();
        int x = mgr.next("X");
        int y = mgr.next("Y");
        assertEquals(2, mgr.freezeAndCount());
        assertEquals("X, Y", mgr.stringFrom(x | y));
        assertEquals("Y", mgr.stringFrom(y));
        mgr.check(x | y);
        try {
            mgr.next("Z");
            fail("should throw");
        } catch (IllegalStateException e) {}
    }
}
