/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Miscellaneous static helpers shared across the package.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * "a, b, c" - no brackets, for symbol vectors and state lists
     */
    static String join(Iterable<?> items) {
        StringBuilder sb = new StringBuilder();
        for (Iterator<?> i = items.iterator(); i.hasNext();) {
            sb.append(i.next());
            if (i.hasNext()) sb.append(", ");
        }
        return sb.toString();
    }

    static boolean containsNull(Collection<?> c) {
        for (Object o : c) if (o == null) return true;
        return false;
    }

    static final class FlagMgr {

        private final List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private static boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

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
            return sb.length() == 0 ? "none" : sb.toString();
        }
    }
}
