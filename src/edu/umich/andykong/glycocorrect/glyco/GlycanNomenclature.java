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
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts glycan abbreviations in Zhang nomenclature (e.g. "A2G1F") to monosaccharide compositions
 * (e.g. "4 Hex, 4 HexNAc, 1 Fuc").
 *
 * Grammar, every part optional but in this order:
 * <pre>
 *   A&lt;n&gt;   antennas (GlcNAc)
 *   Sg&lt;n&gt;  Neu5Gc
 *   S&lt;n&gt;   Neu5Ac
 *   Ga&lt;n&gt;  alpha-Gal
 *   G&lt;n&gt;   Gal
 *   M&lt;n&gt;   Man
 *   F       core Fuc
 *   B       bisecting GlcNAc
 * </pre>
 * Complex glycans (no M part) always carry the three core Man; if the antenna count is missing as well, two antennas
 * are assumed.
 */
public class GlycanNomenclature {

    public static final String HEX = "Hex";
    public static final String HEXNAC = "HexNAc";
    public static final String NEU5AC = "Neu5Ac";
    public static final String NEU5GC = "Neu5Gc";
    public static final String FUC = "Fuc";

    private static final Pattern zhangPattern = Pattern.compile(
            "^(?:A(?<A>\\d+))?(?:Sg(?<Sg>\\d+))?(?:S(?<S>\\d+))?(?:Ga(?<Ga>\\d+))?(?:G(?<G>\\d+))?(?:M(?<M>\\d+))?(?<F>F)?(?<B>B)?$");

    private static final String[] unglycosylatedNames = {"non-glycosylated", "unglycosylated", "null"};

    /**
     * @param name glycan abbreviation
     * @return the monosaccharide composition of the glycan; empty for unglycosylated forms
     * @throws NomenclatureException if the name does not follow the nomenclature
     */
    public static Composition toComposition(String name) throws NomenclatureException {
        if (name == null) {
            throw new NomenclatureException(null);
        }
        if (name.isEmpty() || StringUtils.equalsAny(name, unglycosylatedNames)) {
            return Composition.EMPTY;
        }
        Matcher m = zhangPattern.matcher(name);
        if (!m.matches()) {
            throw new NomenclatureException(name);
        }

        int antennas = count(m, "A", 0);
        int neu5gc = count(m, "Sg", 0);
        int neu5ac = count(m, "S", 0);
        int alphaGal = count(m, "Ga", 0);
        int gal = count(m, "G", 0);
        int man;
        if (m.group("M") == null) {
            man = 3;
            if (m.group("A") == null) {
                antennas = 2;
            }
        } else {
            man = count(m, "M", 0);
        }
        boolean fucose = m.group("F") != null;
        boolean bisecting = m.group("B") != null;

        Map<String, Integer> units = new LinkedHashMap<>();
        units.put(HEX, neu5gc + neu5ac + 2 * alphaGal + gal + man);
        units.put(HEXNAC, antennas + 2 + (bisecting ? 1 : 0));
        units.put(NEU5AC, neu5ac);
        units.put(NEU5GC, neu5gc);
        units.put(FUC, fucose ? 1 : 0);
        return Composition.of(units);
    }

    /**
     * @return true if the name can be converted by {@link #toComposition(String)}
     */
    public static boolean isValidName(String name) {
        try {
            toComposition(name);
            return true;
        } catch (NomenclatureException e) {
            return false;
        }
    }

    private static int count(Matcher m, String group, int defaultValue) {
        String s = m.group(group);
        return s == null ? defaultValue : Integer.parseInt(s);
    }
}
