package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.core.AbundanceDataset;
import edu.umich.andykong.glycocorrect.glyco.Glycan;
import edu.umich.andykong.glycocorrect.glyco.GlycanLibrary;
import edu.umich.andykong.glycocorrect.glyco.GlycoformCandidate;
import edu.umich.andykong.glycocorrect.glyco.GlycoformSpace;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import com.google.common.collect.ImmutableMultiset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the glycation graph from observed glycoform abundances, a conversion rate table and an optional glycan
 * library.
 *
 * Observed glycoforms are labelled by their site glycans joined with "/", e.g. "A2G0F/A2G1F". Labels are matched
 * regardless of site order.
 */
public class GlycationGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GlycationGraphBuilder.class);

    public static GlycationGraph build(AbundanceDataset observed, ConversionRateTable rates, GlycanLibrary library)
            throws NomenclatureException {
        return build(observed, rates, library, 0);
    }

    /**
     * @param observed observed glycoform abundances
     * @param rates conversion rates
     * @param library glycan library, or null to derive all glycans from the observed labels
     * @param sites number of glycosylation sites; 0 to infer it from the observed labels (a site specific library
     *              always defines its own sites)
     * @return the glycation graph
     * @throws NomenclatureException if a glycan without known composition has an invalid name
     */
    public static GlycationGraph build(AbundanceDataset observed, ConversionRateTable rates, GlycanLibrary library,
                                       int sites) throws NomenclatureException {
        LinkedHashSet<String> observedGlycans = new LinkedHashSet<>();
        int inferredSites = 0;
        for (String label : observed.labels()) {
            List<String> siteGlycans = splitSites(label);
            observedGlycans.addAll(siteGlycans);
            inferredSites = Math.max(inferredSites, siteGlycans.size());
        }

        GlycanLibrary workingLibrary = workingLibrary(library, observedGlycans);
        int siteCount = sites > 0 ? sites : inferredSites;
        if (workingLibrary.isSiteSpecific()) {
            int librarySites = workingLibrary.siteNames().size();
            if (librarySites != siteCount) {
                log.warn("Glycan library defines {} sites, but {} sites were expected. Using the sites of the library.",
                        librarySites, siteCount);
            }
            siteCount = librarySites;
        }

        GlycoformSpace space = new GlycoformSpace(workingLibrary, siteCount);
        log.info("Enumerating {} site combinations of {} glycans at {} sites", space.combinationCount(),
                workingLibrary.size(), siteCount);
        List<GlycoformCandidate> candidates = space.enumerate();

        Map<ImmutableMultiset<String>, String> labelsBySiteGlycans = new HashMap<>();
        for (String label : observed.labels()) {
            ImmutableMultiset<String> key = ImmutableMultiset.copyOf(splitSites(label));
            String previous = labelsBySiteGlycans.putIfAbsent(key, label);
            if (previous != null) {
                log.warn("Glycoforms '{}' and '{}' are indistinguishable, ignoring '{}'.", previous, label, label);
            }
        }

        GlycationGraph.Builder graph = new GlycationGraph.Builder();
        Set<String> usedLabels = new HashSet<>();
        for (GlycoformCandidate candidate : candidates) {
            ValueWithUncertainty abundance = null;
            for (String name : candidate.alternativeNames()) {
                String label = labelsBySiteGlycans.get(ImmutableMultiset.copyOf(splitSites(name)));
                if (label != null) {
                    abundance = observed.get(label);
                    usedLabels.add(label);
                    break;
                }
            }
            if (abundance == null) {
                log.warn("No abundance found for glycoform '{}'. Assuming 0.", candidate.getName());
                abundance = ValueWithUncertainty.ZERO;
            }

            Glycoform node = graph.addNode(candidate.getComposition(), candidate.getName(), abundance,
                    candidate.getAbundance(), candidate.getMass());
            connect(graph, node, rates);
        }

        for (String label : observed.labels()) {
            if (!usedLabels.contains(label) && labelsBySiteGlycans.containsValue(label)) {
                log.warn("Observed glycoform '{}' does not match any glycoform of the glycan library.", label);
            }
        }

        GlycationGraph result = graph.build();
        log.info("Assembled {}", result);
        return result;
    }

    /**
     * Connect a new node to every node added before it whose composition differs by a delta of the rate table.
     */
    private static void connect(GlycationGraph.Builder graph, Glycoform node, ConversionRateTable rates) {
        Composition composition = node.getComposition();
        for (int i = 0; i < node.getIndex(); i++) {
            Glycoform other = graph.node(i);
            Composition delta = composition.subtract(other.getComposition());
            ValueWithUncertainty rate = rates.lookup(delta);
            if (rate != null) {
                graph.addEdge(other.getIndex(), node.getIndex(), rate);
                continue;
            }
            rate = rates.lookup(delta.negate());
            if (rate != null) {
                graph.addEdge(node.getIndex(), other.getIndex(), rate);
            }
        }
    }

    private static GlycanLibrary workingLibrary(GlycanLibrary library, Set<String> observedGlycans)
            throws NomenclatureException {
        if (library == null) {
            GlycanLibrary derived = new GlycanLibrary();
            for (String name : observedGlycans) {
                derived.add(Glycan.fromName(name));
            }
            return derived;
        }

        GlycanLibrary working = new GlycanLibrary(library);
        Set<String> libraryGlycans = library.names();

        Set<String> onlyInLibrary = new LinkedHashSet<>(libraryGlycans);
        onlyInLibrary.removeAll(observedGlycans);
        if (!onlyInLibrary.isEmpty()) {
            log.warn("The following glycans only appear in the glycan library, but not in the list of glycoforms: {}.",
                    onlyInLibrary);
        }

        Set<String> onlyInGlycoforms = new LinkedHashSet<>(observedGlycans);
        onlyInGlycoforms.removeAll(libraryGlycans);
        if (!onlyInGlycoforms.isEmpty()) {
            log.warn("The following glycans only appear in the list of glycoforms, but not in the glycan library: {}. "
                    + "They will be added to the library.", onlyInGlycoforms);
            for (String name : onlyInGlycoforms) {
                working.add(Glycan.fromName(name));
            }
        }
        return working;
    }

    static List<String> splitSites(String label) {
        List<String> glycans = new ArrayList<>();
        for (String glycan : label.split(GlycoformCandidate.SITE_SEPARATOR, -1)) {
            glycans.add(glycan.trim());
        }
        return glycans;
    }
}
