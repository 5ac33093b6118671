/*
 * @LICENSE@
 */

/**
 * <h3><b>tnfa</b> - a regular expression to NFA compiler by Thompson's
 * construction.</h3>
 * <p>
 * A pattern over letters and digits, with union, Kleene star, implicit
 * concatenation and grouping, is compiled in two stages:
 * <ol>
 * <li>the infix pattern is tokenized, concatenation is made explicit,
 * bare single symbol alternations are grouped, and the shunting-yard
 * algorithm reorders the tokens into postfix form;</li>
 * <li>the postfix sequence is interpreted over a stack of automaton fragments,
 * with one combinator per literal and per operator.</li>
 * </ol>
 * The resulting {@link org.tnfa.regex.NFA} is fully enumerated: states,
 * a start state, accept states and transition records. It can be simulated,
 * drawn, or serialized to the JSON document produced by
 * {@link org.tnfa.regex.NfaDocument}.
 * <p>
 * The automaton is neither minimized nor determinized. Character classes,
 * anchors, back references and escapes are not supported.
 * <h4>References:</h4>
 * <ul>
 * <li>Ken Thompson, "Regular expression search algorithm", CACM 11(6), 1968.</li>
 * <li>For an introduction to the theory behind regular expression and their
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>.</li>
 * </ul>
 */
package org.tnfa.regex;
