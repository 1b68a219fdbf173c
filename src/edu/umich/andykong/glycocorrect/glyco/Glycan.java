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
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * A glycan that can be attached at a glycosylation site, described by its monosaccharide composition.
 */
public class Glycan {
    public static final double DEFAULT_ABUNDANCE = 1.0;

    private final String name;
    private final Composition composition;
    private final double abundance;
    private final ImmutableSet<String> sites;     // empty means the glycan may occur at every site

    public Glycan(@NotNull String name, @NotNull Composition composition, double abundance, Collection<String> sites) {
        this.name = name;
        this.composition = composition;
        this.abundance = abundance;
        this.sites = sites == null ? ImmutableSet.of() : ImmutableSet.copyOf(sites);
    }

    public Glycan(@NotNull String name, @NotNull Composition composition) {
        this(name, composition, DEFAULT_ABUNDANCE, null);
    }

    /**
     * Create a glycan whose composition is derived from its name.
     * @param name glycan abbreviation in Zhang nomenclature
     * @throws NomenclatureException if the name cannot be converted
     */
    public static Glycan fromName(@NotNull String name) throws NomenclatureException {
        return new Glycan(name, GlycanNomenclature.toComposition(name));
    }

    public String getName() {
        return name;
    }

    public Composition getComposition() {
        return composition;
    }

    /** Relative abundance used to weight glycoforms containing this glycan. */
    public double getAbundance() {
        return abundance;
    }

    public ImmutableSet<String> getSites() {
        return sites;
    }

    public boolean isSiteSpecific() {
        return !sites.isEmpty();
    }

    public double mass() {
        return GlycanMasses.monoisotopicMass(composition);
    }

    public String toString() {
        return String.format("%s (%s) = %s", name, composition, abundance);
    }
}
