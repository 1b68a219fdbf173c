package correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.core.AbundanceDataset;
import edu.umich.andykong.glycocorrect.core.InputFormatException;
import edu.umich.andykong.glycocorrect.correction.AbundanceCorrector;
import edu.umich.andykong.glycocorrect.correction.ConversionEdge;
import edu.umich.andykong.glycocorrect.correction.ConversionRateTable;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;
import edu.umich.andykong.glycocorrect.correction.GlycationGraph;
import edu.umich.andykong.glycocorrect.correction.GlycationGraphBuilder;
import edu.umich.andykong.glycocorrect.correction.Glycoform;
import edu.umich.andykong.glycocorrect.correction.InconsistentModelException;
import edu.umich.andykong.glycocorrect.glyco.Glycan;
import edu.umich.andykong.glycocorrect.glyco.GlycanLibrary;
import edu.umich.andykong.glycocorrect.glyco.GlycanNomenclature;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class GlycationGraphBuilderTest {

    private ConversionRateTable rates;

    @BeforeEach
    void setUp() throws InputFormatException {
        AbundanceDataset glycation = new AbundanceDataset("glycation");
        glycation.add("0", 90.0, 1.0);
        glycation.add("1", 8.0, 1.0);
        glycation.add("2", 2.0, 0.5);
        rates = ConversionRateTable.fromGlycation(glycation, GlycanNomenclature.HEX);
    }

    @Test
    void singleSiteWithoutLibrary() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 50.0, 2.0);
        observed.add("A2G1F", 30.0, 1.5);
        observed.add("A2G2F", 20.0, 1.0);

        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, null);
        assertEquals(3, graph.size());
        assertEquals(3, graph.edges().size());

        Glycoform g0 = graph.find(Composition.parse("3 Hex, 4 HexNAc, Fuc"));
        Glycoform g2 = graph.find(Composition.parse("5 Hex, 4 HexNAc, Fuc"));
        assertEquals("A2G0F", g0.getName());
        assertEquals(ValueWithUncertainty.of(50.0, 2.0), g0.getObserved());
        assertEquals(2, graph.outgoingEdges(g0.getIndex()).size());
        assertEquals(0.10, graph.outgoingRate(g0.getIndex()).getValue(), 1e-12);
        assertEquals(2, graph.incomingEdges(g2.getIndex()).size());
        for (ConversionEdge edge : graph.edges()) {
            assertTrue(edge.getDelta().get(GlycanNomenclature.HEX) > 0);
            assertEquals(edge.getDelta().get(GlycanNomenclature.HEX), edge.getDelta().totalCount());
        }
        assertNull(graph.find(Composition.parse("6 Hex, 4 HexNAc, Fuc")));
    }

    @Test
    void siteOrderDoesNotMatter() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F/A2G0F", 40.0, 1.0);
        observed.add("A2G1F/A2G0F", 40.0, 1.0);
        observed.add("A2G1F/A2G1F", 20.0, 1.0);

        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, null);
        assertEquals(3, graph.size());
        Glycoform mixed = graph.find(Composition.parse("7 Hex, 8 HexNAc, 2 Fuc"));
        assertEquals("A2G0F/A2G1F or A2G1F/A2G0F", mixed.getName());
        assertEquals("A2G0F/A2G1F", mixed.getLabel());
        assertEquals(40.0, mixed.getObserved().getValue());
    }

    @Test
    void unmatchedGlycoformGetsZero() throws InputFormatException, NomenclatureException, InconsistentModelException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 70.0, 0.0);
        observed.add("A2G2F", 30.0, 0.0);
        GlycanLibrary library = new GlycanLibrary();
        library.add(Glycan.fromName("A2G0F"));
        library.add(Glycan.fromName("A2G1F"));
        library.add(Glycan.fromName("A2G2F"));

        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, library);
        assertEquals(3, graph.size());
        Glycoform g1 = graph.find(Composition.parse("4 Hex, 4 HexNAc, Fuc"));
        assertEquals(ValueWithUncertainty.ZERO, g1.getObserved());
        assertEquals(3, library.size());

        CorrectionResult result = AbundanceCorrector.correct(graph);
        // A2G1F receives glycated A2G0F and loses some of it again
        assertTrue(result.corrected(g1.getIndex()).getValue() < 0);
        assertEquals(100.0, result.totalCorrected(), 1e-9);
    }

    @Test
    void glycansMissingFromLibraryAreAdded() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 60.0, 0.0);
        observed.add("A2G1F", 40.0, 0.0);
        GlycanLibrary library = new GlycanLibrary();
        library.add(Glycan.fromName("A2G0F"));
        library.add(Glycan.fromName("M5"));

        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, library);
        assertEquals(3, graph.size());
        assertNotNull(graph.find(Composition.parse("4 Hex, 4 HexNAc, Fuc")));
        assertEquals(ValueWithUncertainty.ZERO, graph.find(Composition.parse("5 Hex, 2 HexNAc")).getObserved());
        assertEquals(2, library.size());
    }

    @Test
    void siteSpecificLibraryDefinesSites() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F/M5", 80.0, 0.0);
        observed.add("A2G1F/M5", 20.0, 0.0);
        GlycanLibrary library = new GlycanLibrary();
        library.add(new Glycan("A2G0F", GlycanNomenclature.toComposition("A2G0F"), 1.0, Collections.singletonList("N1")));
        library.add(new Glycan("A2G1F", GlycanNomenclature.toComposition("A2G1F"), 1.0, Collections.singletonList("N1")));
        library.add(new Glycan("M5", GlycanNomenclature.toComposition("M5"), 1.0, Collections.singletonList("N2")));

        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, library, 3);
        assertEquals(2, graph.size());
        assertEquals(1, graph.edges().size());
        assertEquals("A2G0F/M5", graph.node(0).getName());
        assertEquals(80.0, graph.node(0).getObserved().getValue());
    }

    @Test
    void explicitSiteCount() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 100.0, 0.0);
        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, null, 2);
        assertEquals(1, graph.size());
        assertEquals("A2G0F/A2G0F", graph.node(0).getName());
        assertEquals(ValueWithUncertainty.ZERO, graph.node(0).getObserved());
    }

    @Test
    void invalidGlycanName() throws InputFormatException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("A2G0F", 50.0, 0.0);
        observed.add("Man5", 50.0, 0.0);
        NomenclatureException e = assertThrows(NomenclatureException.class,
                () -> GlycationGraphBuilder.build(observed, rates, null));
        assertEquals("Man5", e.getGlycanName());
    }

    @Test
    void unglycosylatedForm() throws InputFormatException, NomenclatureException {
        AbundanceDataset observed = new AbundanceDataset("observed");
        observed.add("null", 10.0, 0.0);
        observed.add("M5", 90.0, 0.0);
        GlycationGraph graph = GlycationGraphBuilder.build(observed, rates, null);
        assertEquals(2, graph.size());
        assertTrue(graph.node(0).getComposition().isEmpty());
        // M5 also carries two HexNAc more than the unglycosylated form
        assertTrue(graph.edges().isEmpty());
        assertEquals(Arrays.asList(graph.node(0), graph.node(1)), graph.nodes());
    }
}
