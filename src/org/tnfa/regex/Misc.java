/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for state id lists
     */
    static String stateNames(Collection<Integer> ids) {
        StringBuilder sb = new StringBuilder();
        sb.append('[');
        for (Iterator<Integer> it = ids.iterator(); it.hasNext();) {
            sb.append('S').append(it.next());
            if (it.hasNext()) sb.append(", ");
        }
        sb.append(']');
        return sb.toString();
    }

    static List<Integer> shifted(Collection<Integer> ids, int offset) {
        List<Integer> ret = new ArrayList<Integer>(ids.size());
        for (int id : ids) {
            ret.add(id + offset);
        }
        return ret;
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }
}
