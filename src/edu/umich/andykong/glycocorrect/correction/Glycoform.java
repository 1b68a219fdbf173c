package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.glyco.GlycoformCandidate;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

/**
 * Node of a {@link GlycationGraph}: a distinct glycoform composition with its observed abundance.
 * Nodes are immutable; corrected abundances are kept separately in a {@link CorrectionResult}.
 */
public class Glycoform {
    private final int index;
    private final Composition composition;
    private final String name;
    private final ValueWithUncertainty observed;
    private final double theoreticalAbundance;
    private final double mass;

    Glycoform(int index, Composition composition, String name, ValueWithUncertainty observed,
              double theoreticalAbundance, double mass) {
        this.index = index;
        this.composition = composition;
        this.name = name;
        this.observed = observed;
        this.theoreticalAbundance = theoreticalAbundance;
        this.mass = mass;
    }

    /** Position of this node in its graph. */
    public int getIndex() {
        return index;
    }

    public Composition getComposition() {
        return composition;
    }

    public String getName() {
        return name;
    }

    /** First of the alternative names, used as a short label. */
    public String getLabel() {
        int i = name.indexOf(GlycoformCandidate.ALTERNATIVE_SEPARATOR);
        return i < 0 ? name : name.substring(0, i);
    }

    public ValueWithUncertainty getObserved() {
        return observed;
    }

    public double getTheoreticalAbundance() {
        return theoreticalAbundance;
    }

    public double getMass() {
        return mass;
    }

    public String toString() {
        return String.format("%s (%s) = %s", name, composition, observed);
    }
}
