/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes an {@link NFA} to its JSON document: a <code>startingState</code>
 * entry, one entry per transition record keyed by source state, and one
 * entry per accept state. States are named <code>"S" + id</code>.
 * <p>
 * The format is a fixed external contract, quirks included. Transition
 * entries carry <code>isTerminatingState</code> (true only for the first
 * accept state) plus the label (the symbol, or <code>Epsilon</code>) mapped
 * to the destinations. Accept state entries carry only
 * <code>isTerminating: true</code>. A later entry for a key already present
 * replaces it in place, and a digit label precedes
 * <code>isTerminatingState</code>: consumers of the format see integer-like
 * keys first.
 * <blockquote><pre>
 * {"startingState":"S0",
 *  "S0":{"isTerminatingState":false,"Epsilon":["S1","S4"]},
 *  "S1":{"isTerminatingState":false,"a":["S2"]},
 *  "S2":{"isTerminatingState":false,"b":["S3"]},
 *  "S3":{"isTerminatingState":false,"Epsilon":["S1","S4"]},
 *  "S4":{"isTerminating":true}}</pre></blockquote>
 * is the document for <code>(ab)*</code>.
 */
public final class NfaDocument {

    static final String STARTING_STATE = "startingState";
    static final String IS_TERMINATING_STATE = "isTerminatingState";
    static final String IS_TERMINATING = "isTerminating";
    static final String EPSILON = "Epsilon";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final ObjectMapper prettyMapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private NfaDocument() {
    } // never instantiated

    static String stateName(int id) {
        return "S" + id;
    }

    public static ObjectNode toJson(NFA nfa) {
        ObjectNode doc = mapper.createObjectNode();
        doc.put(STARTING_STATE, stateName(nfa.start()));
        final int firstAccept = nfa.acceptStates().get(0);
        for (Transition t : nfa.transitions()) {
            ObjectNode entry = mapper.createObjectNode();
            final boolean digit = !t.isEpsilon() && Character.isDigit(t.label());
            if (!digit) {
                entry.put(IS_TERMINATING_STATE, t.from() == firstAccept);
            }
            ArrayNode to = entry.putArray(labelName(t));
            for (int d : t.to()) {
                to.add(stateName(d));
            }
            if (digit) {
                entry.put(IS_TERMINATING_STATE, t.from() == firstAccept);
            }
            doc.set(stateName(t.from()), entry);
        }
        for (int a : nfa.acceptStates()) {
            ObjectNode entry = mapper.createObjectNode();
            entry.put(IS_TERMINATING, true);
            doc.set(stateName(a), entry);
        }
        return doc;
    }

    static String labelName(Transition t) {
        return t.isEpsilon() ? EPSILON : String.valueOf((char) t.label());
    }

    /**
     * @return the compact document.
     */
    public static String toJsonString(NFA nfa) throws JsonProcessingException {
        return toJsonString(nfa, false);
    }

    public static String toJsonString(NFA nfa, boolean pretty) throws JsonProcessingException {
        return (pretty ? prettyMapper : mapper).writeValueAsString(toJson(nfa));
    }

    /**
     * Writes the compact document to a file, replacing its contents.
     */
    public static void write(NFA nfa, File file) throws IOException {
        mapper.writeValue(file, toJson(nfa));
    }
}
