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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered collection of the glycans that may occupy the glycosylation sites of a protein. Glycans either apply to
 * every site or name the sites they occur at.
 */
public class GlycanLibrary {
    private final ArrayList<Glycan> glycans;

    public GlycanLibrary() {
        this.glycans = new ArrayList<>();
    }

    public GlycanLibrary(List<Glycan> glycans) {
        this.glycans = new ArrayList<>(glycans);
    }

    /** Copy constructor, so callers can extend a working library without touching the original. */
    public GlycanLibrary(GlycanLibrary other) {
        this(other.glycans);
    }

    public void add(Glycan glycan) {
        glycans.add(glycan);
    }

    public List<Glycan> getGlycans() {
        return Collections.unmodifiableList(glycans);
    }

    public LinkedHashSet<String> names() {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (Glycan glycan : glycans) {
            names.add(glycan.getName());
        }
        return names;
    }

    public boolean contains(String name) {
        for (Glycan glycan : glycans) {
            if (glycan.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return glycans.size();
    }

    public boolean isEmpty() {
        return glycans.isEmpty();
    }

    public boolean isSiteSpecific() {
        for (Glycan glycan : glycans) {
            if (glycan.isSiteSpecific()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return site names in order of first appearance; empty if no glycan is site specific
     */
    public List<String> siteNames() {
        LinkedHashSet<String> sites = new LinkedHashSet<>();
        for (Glycan glycan : glycans) {
            sites.addAll(glycan.getSites());
        }
        return new ArrayList<>(sites);
    }

    /**
     * Split the library into one glycan list per glycosylation site. A site specific library yields one list per named
     * site (glycans without site names join every list) and ignores {@code siteCount}; otherwise the whole library is
     * used at each of {@code siteCount} sites.
     * @param siteCount number of sites for a library that is not site specific
     * @return per-site glycan lists, in site order
     */
    public List<List<Glycan>> siteLibraries(int siteCount) {
        List<List<Glycan>> result = new ArrayList<>();
        if (isSiteSpecific()) {
            for (String site : siteNames()) {
                List<Glycan> siteGlycans = new ArrayList<>();
                for (Glycan glycan : glycans) {
                    if (!glycan.isSiteSpecific() || glycan.getSites().contains(site)) {
                        siteGlycans.add(glycan);
                    }
                }
                result.add(siteGlycans);
            }
        } else {
            for (int i = 0; i < siteCount; i++) {
                result.add(new ArrayList<>(glycans));
            }
        }
        return result;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("Glycan library with ").append(glycans.size()).append(" glycans");
        for (Glycan glycan : glycans) {
            sb.append("\n\t").append(glycan);
        }
        return sb.toString();
    }
}
