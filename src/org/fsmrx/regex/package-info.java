/*
 * @LICENSE@
 */

/**
 * <h3><b>fsmrx</b> - a small finite automata based Java regex package.</h3>
 * <p>
 * <h4>Overview.</h4>
 * <p>
 * <b>fsmrx</b> compiles a deliberately small regular expression syntax -
 * literals, <code>.</code>, bracketed classes with ranges and negation, and
 * the <code>*</code> and <code>+</code> quantifiers - into a graph of
 * {@linkplain org.fsmrx.regex.State states}, and decides whether an input is
 * accepted by running every live state of the graph in lock step over the
 * input. There is no backtracking, so there are no "pathological patterns":
 * matching time is bounded by the input length times the number of states.
 * <p>
 * The API follows the shape of the standard {@linkplain java.util.regex regex}
 * package:
 * <blockquote><pre>
 *     Pattern p = Pattern.compile("[a-c]+d");
 *     assert p.matcher("acccd").matches();
 *     assert !p.matcher("ed").matches();
 * </pre></blockquote>
 * <p>
 * <h4>The automaton.</h4>
 * <p>
 * Each atom of a pattern becomes one state, linked from the state built
 * before it. A quantifier wraps the state before it in a repeat state, which
 * keeps consuming for as long as its base accepts; a <code>*</code> repeat may
 * also be entered directly, skipping its base. The finished
 * {@link org.fsmrx.regex.Automaton} is immutable and is exposed through
 * {@link org.fsmrx.regex.Pattern#automaton()}, so that other components may
 * draw it. Being cyclic, it must not be walked as a tree;
 * {@link org.fsmrx.regex.Automaton#states()} enumerates each state once.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The package logs through <code>java.util.logging</code>, to the logger
 * <code>org.fsmrx.regex</code>. Compiled automata are logged at
 * <code>FINER</code>, the live states at each input position at
 * <code>FINEST</code>.
 */
package org.fsmrx.regex;
