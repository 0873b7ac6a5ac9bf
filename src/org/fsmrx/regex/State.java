/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import static org.fsmrx.regex.Misc.Esc.RX;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of an {@link Automaton}. The set of node kinds is closed, and is
 * enumerated by {@link Kind}; the kind supplies the behavior of
 * {@link #checkSelf(int)} and {@link #checkNext(int)}, while the
 * <code>State</code> instance carries the kind's payload (a literal code
 * point, a {@link CharClass}, the base of a repeat) and the outgoing edges.
 * <p>
 * Instances are created and linked by the {@link AutomatonBuilder}, and are
 * sealed when the automaton is complete. A sealed state is immutable, so the
 * graph may be read (and matched against) from any number of threads.
 */
public final class State {

    /**
     * The repetition operators, each of which yields a {@link Kind#REPEAT}
     * state.
     */
    public enum Quantifier {
        /**
         * Zero or more: <code>a*</code>.
         */
        STAR('*'),
        /**
         * One or more: <code>a+</code>.
         */
        PLUS('+');

        private final char symbol;

        Quantifier(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        /**
         * @return the quantifier spelled by <code>c</code>, or
         *         <code>null</code> if <code>c</code> is not a quantifier.
         */
        static Quantifier forSymbol(int c) {
            for (Quantifier q : values()) {
                if (q.symbol == c) return q;
            }
            return null;
        }
    }

    /**
     * The kinds of automaton node. Each constant implements the acceptance
     * predicate for its kind.
     */
    public enum Kind {

        /**
         * Entry point of the automaton; never consumes a code point itself.
         */
        START {
            @Override
            boolean checkSelf(State s, int c) {
                return false;
            }
        },

        /**
         * Acceptance with no remaining input; never consumes a code point.
         */
        TERMINAL {
            @Override
            boolean checkSelf(State s, int c) {
                return false;
            }
        },

        /**
         * A single literal code point.
         */
        LITERAL {
            @Override
            boolean checkSelf(State s, int c) {
                return c == s.codePoint
                    || (s.foldcase && Character.toUpperCase(c) == Character.toUpperCase(s.codePoint))
                    || (s.foldcase && Character.toLowerCase(c) == Character.toLowerCase(s.codePoint));
            }
        },

        /**
         * The <code>.</code> atom: any code point at all.
         */
        WILDCARD {
            @Override
            boolean checkSelf(State s, int c) {
                return true;
            }
        },

        /**
         * A bracketed class, possibly negated.
         */
        CHAR_CLASS {
            @Override
            boolean checkSelf(State s, int c) {
                boolean in = s.cc.contains(c)
                    || (s.foldcase && s.cc.contains(Character.toUpperCase(c)))
                    || (s.foldcase && s.cc.contains(Character.toLowerCase(c)));
                return in != s.negated;
            }
        },

        /**
         * Repetition of a base state. Accepts what the base accepts, and
         * prefers to stay put while it can.
         */
        REPEAT {
            @Override
            boolean checkSelf(State s, int c) {
                return s.base.checkSelf(c);
            }

            @Override
            State checkNext(State s, int c) {
                return checkSelf(s, c) ? s : super.checkNext(s, c);
            }
        };

        abstract boolean checkSelf(State s, int c);

        /*
         * first edge wins; null means no edge takes c
         */
        State checkNext(State s, int c) {
            for (State ns : s.next) {
                if (ns.checkSelf(c)) return ns;
            }
            return null;
        }
    }

    private final Kind kind;
    private final int position;     // for ease of debug only
    private final int codePoint;
    private final CharClass cc;
    private final boolean negated;
    private final boolean foldcase;
    private final State base;
    private final Quantifier quantifier;

    private boolean fin;
    private List<State> next = new ArrayList<State>(2);
    private boolean sealed = false;

    private State(Kind kind, int position, int codePoint, CharClass cc,
            boolean negated, boolean foldcase, State base, Quantifier quantifier) {
        this.kind = kind;
        this.position = position;
        this.codePoint = codePoint;
        this.cc = cc;
        this.negated = negated;
        this.foldcase = foldcase;
        this.base = base;
        this.quantifier = quantifier;
        this.fin = kind == Kind.TERMINAL || kind == Kind.REPEAT;
    }

    static State start() {
        return new State(Kind.START, -1, -1, null, false, false, null, null);
    }

    static State terminal(int position) {
        return new State(Kind.TERMINAL, position, -1, null, false, false, null, null);
    }

    static State literal(int position, int codePoint, boolean foldcase) {
        return new State(Kind.LITERAL, position, codePoint, null, false, foldcase, null, null);
    }

    static State wildcard(int position) {
        return new State(Kind.WILDCARD, position, -1, null, false, false, null, null);
    }

    static State charClass(int position, CharClass cc, boolean negated, boolean foldcase) {
        assert cc != null;
        return new State(Kind.CHAR_CLASS, position, -1, cc, negated, foldcase, null, null);
    }

    /**
     * Wraps <code>base</code> in a new, unlinked {@link Kind#REPEAT} state.
     * Linking the repeat into the graph is left to the caller, since
     * {@link Quantifier#STAR} and {@link Quantifier#PLUS} differ only in their
     * incoming edges.
     */
    static State repeat(int position, State base, Quantifier quantifier) {
        assert base != null && quantifier != null;
        return new State(Kind.REPEAT, position, -1, null, false, false, base, quantifier);
    }

    /**
     * Appends an edge from this state to <code>ns</code>.
     */
    void link(State ns) {
        if (sealed) {
            throw new IllegalStateException("sealed: " + this);
        }
        assert ns != null;
        next.add(ns);
    }

    /**
     * Withdraws the zero-length acceptance of a repeat.
     */
    void markNonFinal() {
        if (sealed) {
            throw new IllegalStateException("sealed: " + this);
        }
        assert kind == Kind.REPEAT : this;
        fin = false;
    }

    void seal() {
        if (!sealed) {
            next = Collections.unmodifiableList(next);
            sealed = true;
        }
    }

    /**
     * @return <code>true</code> if this state accepts the code point
     *         <code>c</code> on its own account.
     */
    public boolean checkSelf(int c) {
        return kind.checkSelf(this, c);
    }

    /**
     * The state reached by consuming <code>c</code> from this state: the first
     * edge target (in edge order) which accepts <code>c</code>; or, for a
     * {@link Kind#REPEAT} state which itself accepts <code>c</code>, the
     * repeat state itself.
     *
     * @return the next state, or <code>null</code> if <code>c</code> is
     *         rejected here.
     */
    public State checkNext(int c) {
        return kind.checkNext(this, c);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFinal() {
        return fin;
    }

    /**
     * @return the outgoing edges, in the order they were linked. The list is
     *         unmodifiable once the automaton is built.
     */
    public List<State> nextStates() {
        return sealed ? next : Collections.unmodifiableList(next);
    }

    /**
     * @return the index in the pattern of the atom this state was built from;
     *         -1 for the start state, the pattern length for the terminal.
     */
    public int position() {
        return position;
    }

    /**
     * @return the code point of a {@link Kind#LITERAL} state, otherwise -1.
     */
    public int codePoint() {
        return codePoint;
    }

    /**
     * @return the set of a {@link Kind#CHAR_CLASS} state, otherwise
     *         <code>null</code>.
     */
    public CharClass charClass() {
        return cc;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * @return the repeated state of a {@link Kind#REPEAT} state, otherwise
     *         <code>null</code>.
     */
    public State base() {
        return base;
    }

    public Quantifier quantifier() {
        return quantifier;
    }

    /**
     * A short label for the state, e.g. <code>'a'</code>,
     * <code>[^x-z]</code> or <code>'a'*</code>.
     */
    public String label() {
        switch (kind) {
        case START:
            return "Start";
        case TERMINAL:
            return "End";
        case LITERAL:
            return "'" + RX.esc(codePoint) + "'";
        case WILDCARD:
            return ".";
        case CHAR_CLASS:
            return "[" + (negated ? "^" : "") + cc + "]";
        case REPEAT:
            return base.label() + quantifier.symbol;
        default:
            throw new AssertionError(kind);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("pos:").append(position).append(',')
          .append(label()).append(',')
          .append("final=").append(fin).append(',')
          .append("next:[");
        for (int i = 0; i < next.size(); ++i) {
            sb.append(i == 0 ? "" : ", ").append(next.get(i).position);
        }
        sb.append(']');
        return sb.toString();
    }
}
