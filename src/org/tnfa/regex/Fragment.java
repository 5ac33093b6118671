/*
 * @LICENSE@
 */

package org.tnfa.regex;

import static org.tnfa.regex.Misc.LS;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A Thompson construction fragment: an automaton under construction with a
 * single entry and, at every stage, a single exit. Fragments are immutable;
 * the combinators build new fragments from renumbered copies of their
 * operands.
 * <p>
 * Identifiers are contiguous from zero and the accept state always carries
 * the largest identifier. Every combinator relies on the latter: concatenation
 * overlays the right operand's start on the left operand's accept, and union
 * and star place their fresh accept state just past the shifted operands.
 */
final class Fragment {

    final int start;
    final List<Integer> accept;
    final SortedSet<Integer> states;
    final List<Transition> transitions;

    private Fragment(int start, List<Integer> accept,
            Collection<Integer> states, List<Transition> transitions) {
        this.start = start;
        this.accept = Collections.unmodifiableList(new ArrayList<Integer>(accept));
        this.states = Collections.unmodifiableSortedSet(new TreeSet<Integer>(states));
        this.transitions = Collections.unmodifiableList(
            new ArrayList<Transition>(transitions));
        assert isClosed() : this;
    }

    /**
     * Two states, one transition: <code>0 -symbol-> 1</code>.
     */
    static Fragment literal(char symbol) {
        List<Transition> t = new ArrayList<Transition>(1);
        t.add(new Transition(0, Collections.singletonList(1), symbol));
        return new Fragment(0, Collections.singletonList(1), list(0, 1), t);
    }

    /**
     * Concatenation without an epsilon edge: the right operand is shifted by
     * the left operand's largest identifier, so that its start lands on the
     * left operand's accept state and the two become one state.
     */
    static Fragment concat(Fragment left, Fragment right) {
        final int leftAccept = left.soleAccept();
        right.soleAccept();
        assert leftAccept == left.maxState() : left;
        assert right.start == 0 : right;
        assert left.outgoing(leftAccept).isEmpty() : left;

        Fragment r = right.shift(left.maxState());
        List<Integer> states = new ArrayList<Integer>(left.states);
        states.addAll(r.states);
        List<Transition> t = new ArrayList<Transition>(left.transitions);
        t.addAll(r.transitions);
        return new Fragment(left.start, r.accept, states, t);
    }

    /**
     * Fresh start 0; left shifted by one; right placed just past the left;
     * fresh accept just past the right. Epsilon edges fan out of the start
     * into both operands and converge on the accept.
     */
    static Fragment union(Fragment left, Fragment right) {
        left.soleAccept();
        right.soleAccept();

        Fragment l = left.shift(1);
        Fragment r = right.shift(left.maxState() + 2);
        final int accept = r.soleAccept() + 1;

        List<Integer> states = new ArrayList<Integer>();
        states.add(0);
        states.addAll(l.states);
        states.addAll(r.states);
        states.add(accept);

        List<Transition> t = new ArrayList<Transition>();
        t.add(Transition.epsilon(0, l.start, r.start));
        t.addAll(l.transitions);
        t.addAll(r.transitions);
        t.add(Transition.epsilon(l.soleAccept(), accept));
        t.add(Transition.epsilon(r.soleAccept(), accept));
        return new Fragment(0, Collections.singletonList(accept), states, t);
    }

    /**
     * Fresh start 0; operand shifted by one; fresh accept just past it. The
     * start may skip the operand, and the operand's accept may loop back to
     * its start or leave.
     */
    static Fragment star(Fragment fragment) {
        fragment.soleAccept();

        Fragment f = fragment.shift(1);
        final int accept = f.soleAccept() + 1;

        List<Integer> states = new ArrayList<Integer>();
        states.add(0);
        states.addAll(f.states);
        states.add(accept);

        List<Transition> t = new ArrayList<Transition>();
        t.add(Transition.epsilon(0, f.start, accept));
        t.addAll(f.transitions);
        t.add(Transition.epsilon(f.soleAccept(), f.start, accept));
        return new Fragment(0, Collections.singletonList(accept), states, t);
    }

    Fragment shift(int offset) {
        List<Transition> t = new ArrayList<Transition>(transitions.size());
        for (Transition tr : transitions) {
            t.add(tr.shift(offset));
        }
        return new Fragment(start + offset, Misc.shifted(accept, offset),
            Misc.shifted(states, offset), t);
    }

    int maxState() {
        return states.last();
    }

    /**
     * The single accept state every fragment has between combinator
     * applications.
     *
     * @throws IllegalStateException
     *             if there is not exactly one accept state.
     */
    int soleAccept() {
        if (accept.size() != 1) {
            throw new IllegalStateException(
                "fragment must have exactly one accept state: " + accept);
        }
        return accept.get(0);
    }

    List<Transition> outgoing(int state) {
        List<Transition> ret = new ArrayList<Transition>();
        for (Transition t : transitions) {
            if (t.from() == state) ret.add(t);
        }
        return ret;
    }

    /*
     * every referenced identifier is a member of states
     */
    private boolean isClosed() {
        if (!states.contains(start) || accept.isEmpty() || !states.containsAll(accept)) {
            return false;
        }
        for (Transition t : transitions) {
            if (!states.contains(t.from()) || !states.containsAll(t.to())) return false;
        }
        return true;
    }

    private static List<Integer> list(Integer... ids) {
        List<Integer> ret = new ArrayList<Integer>(ids.length);
        Collections.addAll(ret, ids);
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("start: S").append(start)
            .append(", accept: ").append(Misc.stateNames(accept))
            .append(", states: ").append(Misc.stateNames(states)).append(LS);
        for (Transition t : transitions) {
            sb.append("    ").append(t).append(LS);
        }
        return sb.toString();
    }
}
