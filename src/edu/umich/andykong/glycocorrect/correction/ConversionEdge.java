package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

/**
 * Directed edge of a {@link GlycationGraph}: a fraction {@code rate} of the source population is converted into the
 * sink by adding {@code delta}.
 */
public class ConversionEdge {
    private final int source;
    private final int sink;
    private final Composition delta;
    private final ValueWithUncertainty rate;

    ConversionEdge(int source, int sink, Composition delta, ValueWithUncertainty rate) {
        this.source = source;
        this.sink = sink;
        this.delta = delta;
        this.rate = rate;
    }

    public int getSource() {
        return source;
    }

    public int getSink() {
        return sink;
    }

    public Composition getDelta() {
        return delta;
    }

    public ValueWithUncertainty getRate() {
        return rate;
    }

    public String toString() {
        return String.format("%d -> %d [%s: %s]", source, sink, delta, rate);
    }
}
