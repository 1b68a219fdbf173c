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

/**
 * One distinct glycoform composition produced by {@link GlycoformSpace}, annotated with the merged names of all site
 * combinations that produce it and their combined theoretical weight.
 */
public class GlycoformCandidate {
    public static final String SITE_SEPARATOR = "/";
    public static final String ALTERNATIVE_SEPARATOR = " or ";

    private final Composition composition;
    private final String name;
    private final double abundance;
    private final double mass;

    public GlycoformCandidate(Composition composition, String name, double abundance, double mass) {
        this.composition = composition;
        this.name = name;
        this.abundance = abundance;
        this.mass = mass;
    }

    public Composition getComposition() {
        return composition;
    }

    /** Site selections joined by "/", alternatives joined by " or ", e.g. "A2G0F/A2G1F or A2G1F/A2G0F". */
    public String getName() {
        return name;
    }

    /** Theoretical weight, rescaled so the most abundant candidate of its space has 100. */
    public double getAbundance() {
        return abundance;
    }

    public double getMass() {
        return mass;
    }

    public String[] alternativeNames() {
        return name.split(ALTERNATIVE_SEPARATOR);
    }

    public String toString() {
        return String.format("%s (%s, %.2f)", name, composition, abundance);
    }
}
