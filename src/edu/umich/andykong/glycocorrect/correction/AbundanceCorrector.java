package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the effect of glycation from observed glycoform abundances.
 *
 * Nodes are processed in topological order. For a node n with observed abundance obs(n),
 * <pre>
 *   in(n)        = sum over predecessors p of corrected(p) * rate(p -&gt; n)
 *   out(n)       = sum over successors s of rate(n -&gt; s)
 *   corrected(n) = (obs(n) - in(n)) / (1 - out(n))
 * </pre>
 * Each value only depends on predecessors, which are final by the time n is visited, so every topological order gives
 * the same result. Negative corrected abundances are reported as they are.
 */
public class AbundanceCorrector {
    private static final Logger log = LoggerFactory.getLogger(AbundanceCorrector.class);

    // summed outgoing rates within this distance of 1 count as 1
    static final double RATE_TOLERANCE = 1e-9;

    public static CorrectionResult correct(GlycationGraph graph) throws InconsistentModelException {
        return correct(graph, graph.topologicalOrder());
    }

    /**
     * @param graph glycation graph
     * @param order topological order of the graph's node indices
     * @return corrected abundances
     * @throws InconsistentModelException if the conversion rates leaving any node sum to 1 or more
     * @throws IllegalArgumentException if {@code order} is not a topological order of the graph
     */
    public static CorrectionResult correct(GlycationGraph graph, int[] order) throws InconsistentModelException {
        if (!graph.isTopologicalOrder(order)) {
            throw new IllegalArgumentException("Node order is not a topological order of the glycation graph");
        }
        validate(graph);

        ValueWithUncertainty[] corrected = new ValueWithUncertainty[graph.size()];
        for (int n : order) {
            ValueWithUncertainty inAbundance = ValueWithUncertainty.ZERO;
            for (ConversionEdge edge : graph.incomingEdges(n)) {
                inAbundance = inAbundance.add(corrected[edge.getSource()].multiply(edge.getRate()));
            }
            ValueWithUncertainty remaining = ValueWithUncertainty.exact(1.0).subtract(graph.outgoingRate(n));
            corrected[n] = graph.node(n).getObserved().subtract(inAbundance).divide(remaining);
            if (corrected[n].getValue() < 0) {
                log.warn("Corrected abundance of glycoform '{}' is negative ({}).", graph.node(n).getName(), corrected[n]);
            }
        }
        return new CorrectionResult(graph, corrected, false);
    }

    /**
     * Check that no node converts its whole population (or more) into other glycoforms.
     * @throws InconsistentModelException for the first offending node
     */
    public static void validate(GlycationGraph graph) throws InconsistentModelException {
        for (Glycoform node : graph.nodes()) {
            ValueWithUncertainty outRate = graph.outgoingRate(node.getIndex());
            if (!Double.isFinite(outRate.getValue()) || Precision.compareTo(outRate.getValue(), 1.0, RATE_TOLERANCE) >= 0) {
                throw new InconsistentModelException(node, outRate);
            }
        }
    }
}
