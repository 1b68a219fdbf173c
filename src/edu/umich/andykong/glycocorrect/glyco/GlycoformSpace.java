/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.glycocorrect.glyco;

import edu.umich.andykong.glycocorrect.composition.Composition;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * All glycoforms of a glycoprotein that are distinct in terms of monosaccharide composition.
 *
 * Site combinations are generated as the Cartesian product of the per-site glycan lists. The product is a lazy view
 * that can be traversed any number of times; its size is the product of the per-site list sizes.
 */
public class GlycoformSpace {
    private final List<List<Glycan>> siteLibraries;

    public GlycoformSpace(List<List<Glycan>> siteLibraries) {
        this.siteLibraries = new ArrayList<>();
        for (List<Glycan> site : siteLibraries) {
            this.siteLibraries.add(new ArrayList<>(site));
        }
    }

    public GlycoformSpace(GlycanLibrary library, int siteCount) {
        this(library.siteLibraries(siteCount));
    }

    public int siteCount() {
        return siteLibraries.size();
    }

    /**
     * @return number of site combinations, before merging equal compositions
     */
    public long combinationCount() {
        long n = 1;
        for (List<Glycan> site : siteLibraries) {
            n *= site.size();
        }
        return n;
    }

    public List<List<Glycan>> combinations() {
        return Lists.cartesianProduct(siteLibraries);
    }

    /**
     * Enumerate the glycoform space.
     * Combinations with equal composition are merged: their weights are summed and their names joined with " or ".
     * Weights are the product of the per-site glycan abundances and are rescaled so that the largest is 100.
     * @return one candidate per distinct composition, in order of first occurrence
     */
    public List<GlycoformCandidate> enumerate() {
        LinkedHashMap<Composition, MergedGlycoform> merged = new LinkedHashMap<>();
        for (List<Glycan> combination : combinations()) {
            Composition composition = Composition.EMPTY;
            double abundance = 1.0;
            double mass = 0.0;
            List<String> names = new ArrayList<>(combination.size());
            for (Glycan glycan : combination) {
                composition = composition.add(glycan.getComposition());
                abundance *= glycan.getAbundance();
                mass += glycan.mass();
                names.add(glycan.getName());
            }
            String name = String.join(GlycoformCandidate.SITE_SEPARATOR, names);
            MergedGlycoform group = merged.get(composition);
            if (group == null) {
                merged.put(composition, new MergedGlycoform(name, abundance, mass));
            } else {
                group.names.add(name);
                group.abundance += abundance;
            }
        }

        double maxAbundance = 0;
        for (MergedGlycoform group : merged.values()) {
            maxAbundance = Math.max(maxAbundance, group.abundance);
        }

        List<GlycoformCandidate> candidates = new ArrayList<>(merged.size());
        for (Map.Entry<Composition, MergedGlycoform> entry : merged.entrySet()) {
            MergedGlycoform group = entry.getValue();
            double abundance = maxAbundance > 0 ? group.abundance / maxAbundance * 100 : group.abundance;
            candidates.add(new GlycoformCandidate(entry.getKey(),
                    String.join(GlycoformCandidate.ALTERNATIVE_SEPARATOR, group.names), abundance, group.mass));
        }
        return candidates;
    }

    private static class MergedGlycoform {
        final LinkedHashSet<String> names = new LinkedHashSet<>();
        double abundance;
        final double mass;

        MergedGlycoform(String name, double abundance, double mass) {
            this.names.add(name);
            this.abundance = abundance;
            this.mass = mass;
        }
    }
}
