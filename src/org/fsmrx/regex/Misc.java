/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    /*
     * idiom suppression for walking a CharSequence by code point
     */
    static int[] codePointsOf(CharSequence cs) {
        int[] ret = new int[Character.codePointCount(cs, 0, cs.length())];
        int n = 0;
        for (int i = 0; i < cs.length(); i += Character.charCount(ret[n++])) {
            ret[n] = Character.codePointAt(cs, i);
        }
        assert n == ret.length;
        return ret;
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
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
        }

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (!contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        String stringFrom(int flags) {
            assert (((1 << freezeAndCount()) - 1) | flags) == ((1 << freezeAndCount()) - 1);
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
    }

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Integer, String> map =
                new HashMap<Integer, String>();

        public boolean esc(StringBuilder sb, int c) {
            String s = map.get(c);
            if (s != null)
                sb.append(s);
            return s != null;
        }

        MapEscaper map(int c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");
    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\b', "\\b").map('\f', "\\f").map('\013', "\\v").map(
                    '\007', "\\a");
    private static final MapEscaper rxccEscaper =
            new MapEscaper().map('^', "\\^").map('-', "\\-").map('[', "\\[")
                .map(']', "\\]");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, c > 0xffff ? "\\U" : "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain code points are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCII and beyond ->
         * \\u codes
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * Regex escaper - escapes Java and some ASCII ctl, non-printable-ASCII
         * and beyond -> \\u codes
         */
        RX(jsEscaper, rxEscaper, unicodeEscaper),
        /**
         * Char class escaper - escapes as RX plus char class metachars (like
         * '-')
         */
        RXCC(jsEscaper, rxEscaper, rxccEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.appendCodePoint(c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            for (int c : codePointsOf(cs)) {
                esc(sb, c);
            }
            return sb.toString();
        }
    }


    static final class IdentitySetQueue<E> extends AbstractQueue<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        public IdentitySetQueue() {
            super();
        }
        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }
    }

    /*
     * Generic digraph visitor. Vertices are compared by identity, so cycles
     * and reconvergent paths are each walked once.
     */
    static abstract class BreadthFirstVisitor<V> {

        final Map<V, Void> black = new IdentityHashMap<V, Void>();
        final Queue<V> gray = new IdentitySetQueue<V>();
        V vertex;

        final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.put(vertex = gray.remove(), null);
                visit(vertex);
                for (V next : successors(vertex)) {
                    if (black.containsKey(next)) {
                        visit(vertex, next, false);
                    } else {
                        visit(vertex, next, gray.offer(next));
                    }
                }
            }
        }

        protected abstract Iterable<V> successors(V vertex);

        /*
         * tree edges can be identified, but no more without augmenting the data structures.
         */
        protected void visit(V from, V to, boolean tree) {}
        protected void visit(V vertex) {}
    }
}
