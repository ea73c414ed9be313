package org.Aayush.citeproc.output;

/**
 * Nothing rendered. Propagates emptiness to enclosing groups.
 */
public final class NullOutput implements Output {
    static final NullOutput INSTANCE = new NullOutput();

    private NullOutput() {
    }

    @Override
    public Kind kind() {
        return Kind.NULL;
    }

    @Override
    public String toString() {
        return "Null";
    }
}
