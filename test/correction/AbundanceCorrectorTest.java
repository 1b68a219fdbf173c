package correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.core.AbundanceDataset;
import edu.umich.andykong.glycocorrect.core.InputFormatException;
import edu.umich.andykong.glycocorrect.correction.AbundanceCorrector;
import edu.umich.andykong.glycocorrect.correction.CorrectedGlycoform;
import edu.umich.andykong.glycocorrect.correction.ConversionRateTable;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;
import edu.umich.andykong.glycocorrect.correction.GlycationGraph;
import edu.umich.andykong.glycocorrect.correction.GlycationGraphBuilder;
import edu.umich.andykong.glycocorrect.correction.InconsistentModelException;
import edu.umich.andykong.glycocorrect.glyco.GlycanNomenclature;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.PriorityQueue;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class AbundanceCorrectorTest {

    private static GlycationGraph chainGraph() {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.exact(80));
        builder.addNode(Composition.of("Hex", 1), "B", ValueWithUncertainty.exact(20));
        builder.addEdge(0, 1, ValueWithUncertainty.exact(0.10));
        return builder.build();
    }

    private static GlycationGraph diamond() {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.of(50, 2));
        builder.addNode(Composition.parse("a"), "B", ValueWithUncertainty.of(20, 1));
        builder.addNode(Composition.parse("b"), "C", ValueWithUncertainty.of(20, 1));
        builder.addNode(Composition.parse("a, b, c"), "D", ValueWithUncertainty.of(10, 0.5));
        builder.addEdge(0, 1, ValueWithUncertainty.of(0.05, 0.01));
        builder.addEdge(0, 2, ValueWithUncertainty.of(0.03, 0.01));
        builder.addEdge(1, 3, ValueWithUncertainty.of(0.20, 0.02));
        builder.addEdge(2, 3, ValueWithUncertainty.of(0.20, 0.02));
        return builder.build();
    }

    @Test
    void chain() throws InconsistentModelException {
        CorrectionResult result = AbundanceCorrector.correct(chainGraph());
        assertEquals(88.8889, result.corrected(0).getValue(), 1e-4);
        assertEquals(11.1111, result.corrected(1).getValue(), 1e-4);
        assertEquals(0.0, result.corrected(0).getError(), 1e-12);
        assertFalse(result.isNormalized());
    }

    @Test
    void isolatedNodeKeepsObservedAbundance() throws InconsistentModelException {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.of(60, 3));
        builder.addNode(Composition.of("Fuc", 1), "B", ValueWithUncertainty.of(40, 2));
        CorrectionResult result = AbundanceCorrector.correct(builder.build());
        assertEquals(ValueWithUncertainty.of(60, 3), result.corrected(0));
        assertEquals(ValueWithUncertainty.of(40, 2), result.corrected(1));
    }

    @Test
    void orderIndependence() throws InconsistentModelException {
        GlycationGraph graph = diamond();
        CorrectionResult abcd = AbundanceCorrector.correct(graph, new int[]{0, 1, 2, 3});
        CorrectionResult acbd = AbundanceCorrector.correct(graph, new int[]{0, 2, 1, 3});
        for (int i = 0; i < graph.size(); i++) {
            assertTrue(abcd.corrected(i).equalsWithin(acbd.corrected(i), 1e-12), "Mismatch at node " + i);
        }

        double a = 50 / (1 - 0.08);
        double b = (20 - a * 0.05) / 0.8;
        double c = (20 - a * 0.03) / 0.8;
        double d = 10 - 0.2 * b - 0.2 * c;
        assertEquals(a, abcd.corrected(0).getValue(), 1e-9);
        assertEquals(b, abcd.corrected(1).getValue(), 1e-9);
        assertEquals(c, abcd.corrected(2).getValue(), 1e-9);
        assertEquals(d, abcd.corrected(3).getValue(), 1e-9);
        assertTrue(abcd.corrected(3).getError() > 0.5);
    }

    @Test
    void totalAbundanceIsConserved() throws InconsistentModelException {
        CorrectionResult result = AbundanceCorrector.correct(diamond());
        assertEquals(100.0, result.totalObserved(), 1e-9);
        assertEquals(result.totalObserved(), result.totalCorrected(), 1e-9);
    }

    @Test
    void rejectsOrdersThatAreNotTopological() {
        GlycationGraph graph = chainGraph();
        assertThrows(IllegalArgumentException.class, () -> AbundanceCorrector.correct(graph, new int[]{1, 0}));
        assertThrows(IllegalArgumentException.class, () -> AbundanceCorrector.correct(graph, new int[]{0, 0}));
        assertThrows(IllegalArgumentException.class, () -> AbundanceCorrector.correct(graph, new int[]{0}));
    }

    @Test
    void inconsistentRates() {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.exact(50));
        builder.addNode(Composition.of("Hex", 1), "B", ValueWithUncertainty.exact(30));
        builder.addNode(Composition.of("Hex", 2), "C", ValueWithUncertainty.exact(20));
        builder.addEdge(0, 1, ValueWithUncertainty.exact(0.5));
        builder.addEdge(0, 2, ValueWithUncertainty.exact(0.5));
        GlycationGraph graph = builder.build();

        InconsistentModelException e = assertThrows(InconsistentModelException.class,
                () -> AbundanceCorrector.correct(graph));
        assertEquals("A", e.getGlycoform().getName());
        assertEquals(0, e.getGlycoform().getIndex());
        assertEquals(1.0, e.getOutgoingRate().getValue(), 1e-12);
        assertTrue(e.getMessage().contains("'A'"));
    }

    @Test
    void percentagesSummingToHundredAreInconsistent() throws InputFormatException, NomenclatureException {
        AbundanceDataset glycation = new AbundanceDataset("glycation");
        glycation.add("1", 6.0, 0.0);
        glycation.add("2", 58.0, 0.0);
        glycation.add("3", 36.0, 0.0);
        ConversionRateTable rates = ConversionRateTable.fromGlycation(glycation, GlycanNomenclature.HEX);

        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 40.0, 0.0);
        observed.add("A2G1F", 30.0, 0.0);
        observed.add("A2G2F", 20.0, 0.0);
        observed.add("A2Ga1G1F", 10.0, 0.0);
        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, null);
        assertEquals(3, graph.outgoingEdges(0).size());

        InconsistentModelException e = assertThrows(InconsistentModelException.class,
                () -> AbundanceCorrector.correct(graph));
        assertEquals("A2G0F", e.getGlycoform().getName());
        assertEquals(1.0, e.getOutgoingRate().getValue(), 1e-9);
    }

    @Test
    void randomGraphs() throws InconsistentModelException {
        Random rng = new Random(20221);
        for (int trial = 0; trial < 50; trial++) {
            GlycationGraph graph = randomGraph(rng, 2 + rng.nextInt(12));

            int[] lowestFirst = graph.topologicalOrder();
            int[] highestFirst = kahnOrder(graph, new PriorityQueue<>(Collections.reverseOrder()));
            assertTrue(graph.isTopologicalOrder(highestFirst));

            CorrectionResult a = AbundanceCorrector.correct(graph, lowestFirst);
            CorrectionResult b = AbundanceCorrector.correct(graph, highestFirst);
            for (int i = 0; i < graph.size(); i++) {
                assertTrue(a.corrected(i).equalsWithin(b.corrected(i), 1e-9), "Mismatch at node " + i + " in trial " + trial);
            }
            assertEquals(a.totalObserved(), a.totalCorrected(), 1e-6, "Total changed in trial " + trial);
            assertEquals(a.totalObserved(), b.totalCorrected(), 1e-6, "Total changed in trial " + trial);
        }
    }

    // node i holds i hexoses, so every edge from a lower to a higher index adds units
    private static GlycationGraph randomGraph(Random rng, int size) {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        for (int i = 0; i < size; i++) {
            builder.addNode(Composition.of("Hex", i), "G" + i,
                    ValueWithUncertainty.of(100 * rng.nextDouble(), 5 * rng.nextDouble()));
        }
        for (int source = 0; source < size; source++) {
            int targets = size - source - 1;
            for (int sink = source + 1; sink < size; sink++) {
                if (rng.nextDouble() < 0.5) {
                    double rate = 0.95 * rng.nextDouble() / targets;
                    builder.addEdge(source, sink, ValueWithUncertainty.of(rate, 0.1 * rate));
                }
            }
        }
        return builder.build();
    }

    private static int[] kahnOrder(GlycationGraph graph, PriorityQueue<Integer> ready) {
        int[] inDegree = new int[graph.size()];
        for (int i = 0; i < graph.size(); i++) {
            inDegree[i] = graph.incomingEdges(i).size();
            if (inDegree[i] == 0)
                ready.add(i);
        }
        int[] order = new int[graph.size()];
        int n = 0;
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order[n++] = current;
            for (int i = 0; i < graph.outgoingEdges(current).size(); i++) {
                int sink = graph.outgoingEdges(current).get(i).getSink();
                if (--inDegree[sink] == 0)
                    ready.add(sink);
            }
        }
        return order;
    }

    @Test
    void negativeValuesAreKept() throws InconsistentModelException {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.exact(90));
        builder.addNode(Composition.of("Hex", 1), "B", ValueWithUncertainty.exact(1));
        builder.addEdge(0, 1, ValueWithUncertainty.exact(0.2));
        CorrectionResult result = AbundanceCorrector.correct(builder.build());
        assertEquals(1 - 0.2 * 90 / 0.8, result.corrected(1).getValue(), 1e-9);
        assertTrue(result.corrected(1).getValue() < 0);
    }

    @Test
    void normalize() throws InconsistentModelException {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.of(90, 3));
        builder.addNode(Composition.of("Hex", 1), "B", ValueWithUncertainty.of(60, 6));
        CorrectionResult result = AbundanceCorrector.correct(builder.build());
        assertEquals(150.0, result.totalCorrected(), 1e-9);

        CorrectionResult normalized = result.normalize();
        assertTrue(normalized.isNormalized());
        assertEquals(100.0, normalized.totalCorrected(), 1e-9);
        assertTrue(ValueWithUncertainty.of(60, 2).equalsWithin(normalized.corrected(0), 1e-9));
        assertTrue(ValueWithUncertainty.of(40, 4).equalsWithin(normalized.corrected(1), 1e-9));
        // observed values are untouched
        assertEquals(150.0, normalized.totalObserved(), 1e-9);
        assertEquals(150.0, result.totalCorrected(), 1e-9);
    }

    @Test
    void normalizeRejectsZeroTotal() throws InconsistentModelException {
        GlycationGraph.Builder builder = new GlycationGraph.Builder();
        builder.addNode(Composition.EMPTY, "A", ValueWithUncertainty.ZERO);
        CorrectionResult result = AbundanceCorrector.correct(builder.build());
        assertThrows(IllegalStateException.class, result::normalize);
    }

    @Test
    void exportSurface() throws InconsistentModelException {
        CorrectionResult result = AbundanceCorrector.correct(diamond());
        assertEquals(4, result.glycoforms().size());
        assertEquals(4, result.edges().size());
        CorrectedGlycoform d = result.glycoforms().get(3);
        assertEquals("D", d.getName());
        assertEquals(ValueWithUncertainty.of(10, 0.5), d.getObserved());
        assertEquals(result.corrected(3), d.getCorrected());
        assertThrows(UnsupportedOperationException.class, () -> result.glycoforms().clear());
        assertThrows(UnsupportedOperationException.class, () -> result.edges().clear());
    }
}
