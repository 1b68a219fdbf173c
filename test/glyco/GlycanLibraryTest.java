package glyco;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.glyco.Glycan;
import edu.umich.andykong.glycocorrect.glyco.GlycanLibrary;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GlycanLibraryTest {

    @Test
    void siteSpecificLibrary() {
        GlycanLibrary library = new GlycanLibrary();
        library.add(new Glycan("A2G0F", Composition.parse("3 Hex, 4 HexNAc, Fuc"), 1.0, Arrays.asList("N1", "N2")));
        library.add(new Glycan("M5", Composition.parse("5 Hex, 2 HexNAc"), 1.0, Collections.singletonList("N2")));
        library.add(new Glycan("null", Composition.EMPTY));

        assertTrue(library.isSiteSpecific());
        assertEquals(Arrays.asList("N1", "N2"), library.siteNames());

        List<List<Glycan>> sites = library.siteLibraries(5);
        assertEquals(2, sites.size());
        assertEquals(2, sites.get(0).size());
        assertEquals(3, sites.get(1).size());
        assertEquals("null", sites.get(0).get(1).getName());
    }

    @Test
    void sharedLibrary() throws NomenclatureException {
        GlycanLibrary library = new GlycanLibrary();
        library.add(Glycan.fromName("A2G0F"));
        library.add(Glycan.fromName("A2G1F"));
        assertFalse(library.isSiteSpecific());
        assertTrue(library.siteNames().isEmpty());
        assertEquals(3, library.siteLibraries(3).size());
        assertEquals(2, library.siteLibraries(3).get(2).size());
        assertTrue(library.contains("A2G1F"));
        assertFalse(library.contains("A2G2F"));
    }

    @Test
    void copyDoesNotShareState() throws NomenclatureException {
        GlycanLibrary library = new GlycanLibrary();
        library.add(Glycan.fromName("A2G0F"));
        GlycanLibrary copy = new GlycanLibrary(library);
        copy.add(Glycan.fromName("A2G1F"));
        assertEquals(1, library.size());
        assertEquals(2, copy.size());
        assertThrows(UnsupportedOperationException.class, () -> library.getGlycans().clear());
    }
}
