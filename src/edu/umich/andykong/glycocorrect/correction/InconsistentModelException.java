package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

/**
 * Thrown when the conversion rates leaving a glycoform add up to 1 or more, which leaves its original abundance
 * undefined.
 */
public class InconsistentModelException extends Exception {
    private final Glycoform glycoform;
    private final ValueWithUncertainty outgoingRate;

    public InconsistentModelException(Glycoform glycoform, ValueWithUncertainty outgoingRate) {
        super(String.format("Conversion rates leaving glycoform %d '%s' (%s) sum to %.4f, must be less than 1",
                glycoform.getIndex(), glycoform.getName(), glycoform.getComposition(), outgoingRate.getValue()));
        this.glycoform = glycoform;
        this.outgoingRate = outgoingRate;
    }

    public Glycoform getGlycoform() {
        return glycoform;
    }

    public ValueWithUncertainty getOutgoingRate() {
        return outgoingRate;
    }
}
