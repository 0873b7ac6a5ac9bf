/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import static org.fsmrx.regex.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fsmrx.regex.Misc.BreadthFirstVisitor;

/**
 * The state graph built from a pattern: a single {@link State.Kind#START}
 * state, a single {@link State.Kind#TERMINAL} state, and whatever lies between.
 * <p>
 * Instances are immutable. The graph is cyclic in general (a repeat is its
 * own successor while it keeps consuming) and states may be shared between
 * several predecessors, so clients walking {@link State#nextStates()} for
 * themselves - to render a diagram, say - must keep track of the states they
 * have seen. {@link #states()} does that already.
 */
public final class Automaton {

    private final String regex;
    private final State start;
    private final State terminal;
    private final List<State> states;

    Automaton(String regex, State start, State terminal) {
        this.regex = regex;
        this.start = start;
        this.terminal = terminal;
        final List<State> states = new ArrayList<State>();
        new BreadthFirstVisitor<State>() {
            @Override
            protected Iterable<State> successors(State s) {
                return s.nextStates();
            }
            @Override
            protected void visit(State s) {
                states.add(s);
            }
        }.start(start);
        for (State s : states) s.seal();
        this.states = Collections.unmodifiableList(states);
        assert states.contains(terminal) : this;
    }

    public State start() {
        return start;
    }

    public State terminal() {
        return terminal;
    }

    /**
     * @return every state reachable from {@link #start()}, each exactly once,
     *         in breadth-first order. The start state comes first.
     */
    public List<State> states() {
        return states;
    }

    /**
     * @return the pattern this automaton was built from.
     */
    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("automaton: ").append(regex);
        for (State s : states) {
            sb.append(LS).append('\t').append(s);
        }
        return sb.toString();
    }
}
