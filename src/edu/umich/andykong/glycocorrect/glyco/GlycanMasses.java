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

import java.util.Map;
import java.util.TreeMap;

public class GlycanMasses {

    // Building blocks for glycan compositions
    public static final double hexnacMass = 203.07937;
    public static final double hexMass = 162.05282;
    public static final double dhexMass = 146.057909;
    public static final double neuacMass = 291.095417;
    public static final double neugcMass = 307.090334;
    public static final double phosphoMass = 79.96633;
    public static final double sulfoMass = 79.95682;

    // Map of unit names (as used in compositions) to residue masses. NOTE: case sensitive, "Hex" and "HexNAc" differ
    public static final TreeMap<String, Double> residueMasses;
    static
    {
        residueMasses = new TreeMap<>();
        residueMasses.put("Hex", hexMass);
        residueMasses.put("HexNAc", hexnacMass);
        residueMasses.put("Fuc", dhexMass);
        residueMasses.put("dHex", dhexMass);
        residueMasses.put("Neu5Ac", neuacMass);
        residueMasses.put("NeuAc", neuacMass);
        residueMasses.put("Neu5Gc", neugcMass);
        residueMasses.put("NeuGc", neugcMass);
        residueMasses.put("Phospho", phosphoMass);
        residueMasses.put("Sulfo", sulfoMass);
    }

    /**
     * Monoisotopic mass of a composition of glycan residues.
     * @param composition residue composition
     * @return summed residue mass, or NaN if any unit has no known mass
     */
    public static double monoisotopicMass(Composition composition) {
        double mass = 0;
        for (Map.Entry<String, Integer> entry : composition.asMap().entrySet()) {
            Double residueMass = residueMasses.get(entry.getKey());
            if (residueMass == null) {
                return Double.NaN;
            }
            mass += residueMass * entry.getValue();
        }
        return mass;
    }
}
