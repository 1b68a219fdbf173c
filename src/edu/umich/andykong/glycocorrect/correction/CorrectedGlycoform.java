package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

/**
 * Read-only pairing of a graph node with its corrected abundance.
 */
public class CorrectedGlycoform {
    private final Glycoform glycoform;
    private final ValueWithUncertainty corrected;

    CorrectedGlycoform(Glycoform glycoform, ValueWithUncertainty corrected) {
        this.glycoform = glycoform;
        this.corrected = corrected;
    }

    public Glycoform getGlycoform() {
        return glycoform;
    }

    public ValueWithUncertainty getObserved() {
        return glycoform.getObserved();
    }

    public ValueWithUncertainty getCorrected() {
        return corrected;
    }

    public String getName() {
        return glycoform.getName();
    }

    public String toString() {
        return String.format("%s: %s -> %s", glycoform.getName(), glycoform.getObserved(), corrected);
    }
}
