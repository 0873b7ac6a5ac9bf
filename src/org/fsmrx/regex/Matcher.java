/*
 * @LICENSE@
 */
package org.fsmrx.regex;

/**
 * Analog to the {@link java.util.regex.Matcher} class, reduced to whole-input
 * matching. Note that like the analagous {@link java.util.regex.Matcher} class
 * of the standard regex package, instances of this class are <em>not</em>
 * thread safe - it is the responsibility of the client to ensure that the
 * methods of an instance are not re-entered. The {@link Pattern} it matches
 * against may be shared freely.
 */
public final class Matcher {

    private Pattern pattern;
    private CharSequence csq;

    Matcher(Pattern pattern, CharSequence csq) {
        this.pattern = pattern;
        reset(csq);
    }

    /**
     * Attempts to match the entire input against the pattern. Repeated calls
     * give the same answer until the matcher is reset.
     *
     * @return <code>true</code> if, and only if, the entire input is accepted
     *         by the pattern's automaton.
     */
    public boolean matches() {
        return FrontierEngine.INSTANCE.accepts(pattern.automaton, csq);
    }

    public Pattern pattern() {
        return pattern;
    }

    public Matcher reset() {
        return reset(csq);
    }

    public Matcher reset(CharSequence csq) {
        if (csq == null) throw new NullPointerException("input");
        this.csq = csq;
        return this;
    }

    public Matcher usePattern(Pattern newPattern) {
        if (newPattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        pattern = newPattern;
        return this;
    }

    @Override
    public String toString() {
        return getClass().getName() + "[pattern=" + pattern + ']';
    }
}
