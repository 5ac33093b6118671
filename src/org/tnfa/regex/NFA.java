/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata, as enumerated states and transitions.
 */
package org.tnfa.regex;

import static org.tnfa.regex.Misc.LS;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * The automaton a pattern compiles to: one start state, a non empty list of
 * accept states, and the transition records in construction order. Instances
 * are immutable and thread safe.
 * <p>
 * Besides exposing the graph, an NFA can {@linkplain #matches(CharSequence)
 * simulate} itself against an input, and render itself as a Graphviz
 * {@linkplain #toDotString(String) digraph}.
 */
public final class NFA {

    private final int start;
    private final List<Integer> accept;
    private final SortedSet<Integer> states;
    private final List<Transition> transitions;

    /*
     * outgoing transitions, indexed by source state
     */
    private final Map<Integer, List<Transition>> arcs =
            new HashMap<Integer, List<Transition>>();

    NFA(Fragment f) {
        this.start = f.start;
        this.accept = f.accept;
        this.states = f.states;
        this.transitions = f.transitions;
        for (Transition t : transitions) {
            List<Transition> l = arcs.get(t.from());
            if (l == null) {
                l = new ArrayList<Transition>(2);
                arcs.put(t.from(), l);
            }
            l.add(t);
        }
    }

    public int start() {
        return start;
    }

    /**
     * @return the accept states, unmodifiable.
     */
    public List<Integer> acceptStates() {
        return accept;
    }

    /**
     * @return the state identifiers in ascending order, unmodifiable.
     */
    public SortedSet<Integer> states() {
        return states;
    }

    /**
     * @return the transition records in construction order, unmodifiable.
     */
    public List<Transition> transitions() {
        return transitions;
    }

    public boolean isAccepting(int state) {
        return accept.contains(state);
    }

    /**
     * Runs the automaton over the whole input, tracking the set of live states
     * and closing it over epsilon transitions after every step.
     *
     * @param input
     *            the characters to consume
     * @return true if an accept state is live once the input is exhausted.
     */
    public boolean matches(CharSequence input) {
        BitSet live = new BitSet();
        live.set(start);
        closure(live);
        for (int i = 0; i < input.length() && !live.isEmpty(); ++i) {
            live = step(live, input.charAt(i));
        }
        for (int a : accept) {
            if (live.get(a)) return true;
        }
        return false;
    }

    private BitSet step(BitSet live, char c) {
        BitSet next = new BitSet();
        for (int s = live.nextSetBit(0); s >= 0; s = live.nextSetBit(s + 1)) {
            List<Transition> l = arcs.get(s);
            if (l == null) continue;
            for (Transition t : l) {
                if (t.label() != c) continue;
                for (int d : t.to()) next.set(d);
            }
        }
        closure(next);
        return next;
    }

    private void closure(BitSet set) {
        LinkedList<Integer> work = new LinkedList<Integer>();
        for (int s = set.nextSetBit(0); s >= 0; s = set.nextSetBit(s + 1)) {
            work.push(s);
        }
        while (!work.isEmpty()) {
            List<Transition> l = arcs.get(work.pop());
            if (l == null) continue;
            for (Transition t : l) {
                if (!t.isEpsilon()) continue;
                for (int d : t.to()) {
                    if (!set.get(d)) {
                        set.set(d);
                        work.push(d);
                    }
                }
            }
        }
    }

    /**
     * Renders the automaton in the Graphviz dot language. Accept states are
     * drawn as double circles; an unlabeled arrow points at the start state.
     *
     * @param name
     *            the graph name
     * @return the dot source
     */
    public String toDotString(String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(name.replace("\"", "\\\"")).append("\" {").append(LS);
        sb.append("  rankdir = LR;").append(LS);
        sb.append("  init [shape = point];").append(LS);
        for (int s : states) {
            sb.append("  S").append(s).append(" [shape = ")
                .append(isAccepting(s) ? "doublecircle" : "circle").append("];").append(LS);
        }
        sb.append("  init -> S").append(start).append(';').append(LS);
        for (Transition t : transitions) {
            String label = t.isEpsilon() ? "ε" : String.valueOf((char) t.label());
            for (int d : t.to()) {
                sb.append("  S").append(t.from()).append(" -> S").append(d)
                    .append(" [label = \"").append(label).append("\"];").append(LS);
            }
        }
        sb.append('}').append(LS);
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("NFA start: S").append(start)
            .append(", accept: ").append(Misc.stateNames(accept))
            .append(", states: ").append(states.size()).append(LS);
        for (Transition t : transitions) {
            sb.append("    ").append(t).append(LS);
        }
        return sb.toString();
    }
}
