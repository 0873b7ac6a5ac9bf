/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import static org.fsmrx.regex.Misc.Esc.RXCC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

/**
 * An immutable value class representing the set of code points of a bracketed
 * character class. (Not to be confused with <code>class Character</code> -
 * we're talking the regex sense of the term "character class" here.)
 * Negation is <em>not</em> part of the set; a negated class is represented by
 * a {@link State} holding a plain <code>CharClass</code> together with a
 * negation flag.
 * <p>
 * The sets of code points are represented as arrays of {@link Interval}s. The
 * {@link Builder} ensures that these arrays are properly sorted and
 * merged. The Builder allows clients (e.g. the {@link AutomatonBuilder}) to
 * incrementally build up CharClasses which respect all the internal
 * invariants.
 */
public final class CharClass {

    static final int CODE_POINT_END = Character.MAX_CODE_POINT + 1;

    static final class Interval implements Comparable<Interval> {

        /**
         * <code>begin</code> is inclusive.
         */
        final int begin;
        /**
         * <code>end</code> is exclusive.
         */
        final int end;

        /**
         * Represents the code point interval [begin, end).
         * <p />
         * Invariant: begin < end. Therefore, there is no "native"
         * representation for the empty range. The empty char class is
         * represented by a zero length array of <code>Interval</code>s
         * within {@link CharClass} proper.
         */
        private Interval(int begin, int end) {
            assert 0 <= begin && begin < end && end <= CODE_POINT_END;
            this.begin = begin;
            this.end = end;
        }

        /**
         * Attempt to merge an {@link Interval} with the current instance,
         * returning a new instance.
         *
         * @param ci
         *            the {@link Interval} to attempt to merge
         * @return a new {@link Interval} representing the merger between
         *         <code>this</code> and <code>ci</code> if possible;
         *         otherwise <code>null</code>.
         */
        private Interval maybeMerge(Interval ci) {
            assert this.compareTo(ci) <= 0 : "arg must be ordered";
            if (this.contains(ci)) {
                return this;
            } else if (end >= ci.begin) {
                return new Interval(begin, Math.max(end, ci.end));
            } else {
                return null;
            }
        }

        public int compareTo(Interval ci) {
            int ret = 0;
            if (begin < ci.begin) {
                ret = -1;
            } else if (begin > ci.begin) {
                ret = 1;
            } else if (end < ci.end) {
                ret = -1;
            } else if (end > ci.end) {
                ret = 1;
            }
            assert (ret == 0 ? this.equals(ci) : true);
            return ret;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (o == null || !(o instanceof Interval))
                return false;
            final Interval cr = (Interval) o;
            return begin == cr.begin && end == cr.end;
        }

        @Override
        public int hashCode() { // per Bloch
            int result = 17;
            result = 37 * result + begin;
            result = 37 * result + end;
            return result;
        }

        /**
         * For debugging only.
         */
        @Override
        public String toString() {
            return "[" + RXCC.esc(begin) + ',' + RXCC.esc(end) + ')';
        }

        private boolean contains(int c) {
            return begin <= c && c < end;
        }

        private boolean contains(Interval ci) {
            return contains(ci.begin) && contains(ci.end - 1);
        }

        private int size() {
            return end - begin;
        }
    }

    /**
     * Composes (immutable) {@link CharClass} instances one code point or one
     * range at a time.
     */
    public static final class Builder {

        private final ArrayList<Interval> cil = new ArrayList<Interval>();

        /**
         * Creates an empty <code>Builder</code> instance
         */
        public Builder() {
        }

        private boolean isValid() {
            Interval ci = null;
            for (Interval ciNext : cil) {
                if (ci != null) {
                    if (!(ci.compareTo(ciNext) < 0 && ci.end < ciNext.begin)) {
                        return false;
                    }
                }
                ci = ciNext;
            }
            return true;
        }

        /*
         * if non-negative, then the Interval at this index equals ci. If
         * negative, then this is the insertion point (-(i+1)).
         */
        private int indexFor(Interval ci) {
            return Collections.binarySearch(cil, ci);
        }

        /**
         * Attempt to merge two {@link Interval}s.
         *
         * @param ip
         *            the index in {@link Builder#cil} at which to attempt a
         *            merge between {@link Interval}s.
         * @return <code>true</code> if the {@link Interval} at
         *         <code>ip</code> has been merged with the {@link Interval}
         *         which follows in {@link Builder#cil}, othwise,
         *         <code>false</code>.
         */
        private boolean mergeAt(int ip) {
            if ((0 <= ip && ip < cil.size())
                    && (0 <= ip + 1 && ip + 1 < cil.size())) {
                Interval ciMerge = cil.get(ip).maybeMerge(cil.get(ip + 1));
                if (ciMerge != null) {
                    cil.set(ip, ciMerge);
                    cil.remove(ip + 1);
                    return true;
                }
            }
            return false;
        }

        /**
         * Adds the {@link Interval}, possibly causing {@link Interval}s
         * within the {@link Builder} to be merged.
         */
        private Builder add(Interval ci) {
            int i = indexFor(ci);
            if (i >= 0) return this;
            int ip = -(i + 1);
            cil.add(ip, ci);
            if (mergeAt(ip - 1))
                --ip; // merge left
            while (mergeAt(ip))
                ; // merge right
            assert this.isValid() : this;
            return this;
        }

        /**
         * Add a single code point.
         *
         * @param c
         *            The code point to add.
         * @return <code>this</code> instance.
         */
        public Builder add(int c) {
            checkCodePoint(c);
            return add(new Interval(c, c + 1));
        }

        /**
         * Add a range of code points. Note the range specified here is
         * inclusive. A range whose <code>first</code> lies above its
         * <code>last</code> is empty, and adds nothing.
         *
         * @param first
         *            the first code point in the range
         * @param last
         *            the last code point in the range
         * @return <code>this</code> instance.
         */
        public Builder add(int first, int last) {
            checkCodePoint(first);
            checkCodePoint(last);
            return first <= last ? add(new Interval(first, last + 1)) : this;
        }

        public boolean isEmpty() {
            return cil.size() == 0;
        }

        /**
         * Build a {@link CharClass} instance.
         *
         * @return the (immutable) {@link CharClass} instance which this
         *         {@link Builder} represents.
         */
        public CharClass build() {
            return build(null);
        }

        /**
         * @param s
         *            The string to associate with the built CharClass. This
         *            string will be returned by {@link CharClass#toString()}.
         *            It is typically the bracket content supplied by the
         *            builder, and is not checked.
         * @return the resulting {@link CharClass}
         */
        public CharClass build(String s) {
            return new CharClass(cil.toArray(new Interval[cil.size()]), s);
        }

        @Override
        public String toString() {
            return build().toString();
        }

        private static void checkCodePoint(int c) {
            if (!Character.isValidCodePoint(c)) {
                throw new IllegalArgumentException(
                    "not a code point: 0x" + Integer.toHexString(c));
            }
        }
    }

    public static final CharClass EMPTY = new Builder().build();

    /**
     * Caches a client-specified or lazily computed <code>String</code>
     * representing the instance.
     */
    private String s;
    /**
     * Field name mnemonic: Char Interval Array
     */
    private final Interval[] cia;

    private CharClass(Interval[] cia, String s) {
        this.cia = cia;
        this.s = s;
    }

    public boolean contains(int c) {
        int lo = 0;
        int hi = cia.length;
        int m = -1;
        boolean ret = false;
        while (lo < hi) {
            m = (lo + hi) >>> 1; // invariant: m <= length - 1;
            if (cia[m].begin <= c) {
                if (m+1 == cia.length || c < cia[m+1].begin) {
                    ret = c < cia[m].end;
                    break;
                } else {
                    lo = m+1;
                }
            } else {
                hi = m;
            }
        }
        return ret;
    }

    public boolean isEmpty() {
        return cia.length == 0;
    }

    /**
     * @return the number of code points in this class.
     */
    public int size() {
        int ret = 0;
        for (Interval ci : cia) ret += ci.size();
        return ret;
    }

    private static String stringFrom(Interval[] cia) {
        StringBuilder sb = new StringBuilder();
        for (Interval ci : cia) {
            sb.append(RXCC.esc(ci.begin));
            if (ci.size() > 1) {
                if (ci.size() > 2) sb.append('-');
                sb.append(RXCC.esc(ci.end - 1));
            }
        }
        return sb.toString();
    }

    /**
     * The bracket content this class was built from, if the builder supplied
     * one; otherwise a canonical rendering of the sorted ranges.
     */
    @Override
    public String toString() {
        if (s == null) {
            s = stringFrom(cia);
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CharClass))
            return false;
        CharClass cc = (CharClass) o;
        return Arrays.equals(cia, cc.cia);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cia);
    }
}
