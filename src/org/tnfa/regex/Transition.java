/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable transition record: from one state, on a symbol or on
 * epsilon, to an ordered list of destination states. Epsilon records fan out
 * to more than one destination in union and star fragments.
 */
public final class Transition {

    /**
     * The label of a transition taken without consuming input.
     */
    public static final int EPSILON = -1;

    private final int from;
    private final List<Integer> to;
    private final int label;

    Transition(int from, List<Integer> to, int label) {
        assert label == EPSILON || Alphabet.isSymbol(label) : label;
        assert !to.isEmpty();
        this.from = from;
        this.to = Collections.unmodifiableList(new ArrayList<Integer>(to));
        this.label = label;
    }

    static Transition epsilon(int from, Integer... to) {
        List<Integer> l = new ArrayList<Integer>(to.length);
        Collections.addAll(l, to);
        return new Transition(from, l, EPSILON);
    }

    public int from() {
        return from;
    }

    public List<Integer> to() {
        return to;
    }

    /**
     * @return the symbol, or {@link #EPSILON}.
     */
    public int label() {
        return label;
    }

    public boolean isEpsilon() {
        return label == EPSILON;
    }

    /*
     * the renumbered copy; this record is left alone
     */
    Transition shift(int offset) {
        return new Transition(from + offset, Misc.shifted(to, offset), label);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + from;
        result = prime * result + label;
        result = prime * result + to.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Transition))
            return false;
        final Transition t = (Transition) o;
        return from == t.from && label == t.label && to.equals(t.to);
    }

    @Override
    public String toString() {
        return "S" + from + " -" + (isEpsilon() ? "ε" : String.valueOf((char) label))
                + "-> " + Misc.stateNames(to);
    }
}
