package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Corrected abundances of a glycation graph, stored by node index. This is the read-only view handed to writers.
 */
public class CorrectionResult {
    private final GlycationGraph graph;
    private final ValueWithUncertainty[] corrected;
    private final boolean normalized;
    private final ImmutableList<CorrectedGlycoform> glycoforms;

    CorrectionResult(GlycationGraph graph, ValueWithUncertainty[] corrected, boolean normalized) {
        this.graph = graph;
        this.corrected = corrected.clone();
        this.normalized = normalized;
        ImmutableList.Builder<CorrectedGlycoform> builder = ImmutableList.builder();
        for (Glycoform node : graph.nodes()) {
            builder.add(new CorrectedGlycoform(node, this.corrected[node.getIndex()]));
        }
        this.glycoforms = builder.build();
    }

    public GlycationGraph graph() {
        return graph;
    }

    public List<CorrectedGlycoform> glycoforms() {
        return glycoforms;
    }

    public List<ConversionEdge> edges() {
        return graph.edges();
    }

    public ValueWithUncertainty corrected(int index) {
        return corrected[index];
    }

    /** True if the corrected abundances were rescaled to sum to 100. */
    public boolean isNormalized() {
        return normalized;
    }

    public double totalObserved() {
        double total = 0;
        for (Glycoform node : graph.nodes()) {
            total += node.getObserved().getValue();
        }
        return total;
    }

    public double totalCorrected() {
        double total = 0;
        for (ValueWithUncertainty value : corrected) {
            total += value.getValue();
        }
        return total;
    }

    /**
     * Rescale corrected abundances (and their uncertainties) so that they sum to 100. This turns measurement-scale
     * abundances into fractions of the whole population.
     * @return a new, normalized result
     * @throws IllegalStateException if the corrected abundances sum to zero
     */
    public CorrectionResult normalize() {
        double total = totalCorrected();
        if (total == 0 || !Double.isFinite(total)) {
            throw new IllegalStateException(String.format("Cannot normalize corrected abundances summing to %f", total));
        }
        double factor = 100.0 / total;
        ValueWithUncertainty[] scaled = new ValueWithUncertainty[corrected.length];
        for (int i = 0; i < corrected.length; i++) {
            scaled[i] = corrected[i].multiply(factor);
        }
        return new CorrectionResult(graph, scaled, true);
    }
}
