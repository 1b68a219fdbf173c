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

package edu.umich.andykong.glycocorrect.composition;

import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable multiset of named units (monosaccharides, atoms, or any other PTM building block) with signed counts.
 * Zero counts are never stored, so two compositions are equal exactly when their non-zero entries agree. Entries are
 * kept in a canonical sorted order, which makes the composition safe to use as a map key.
 */
public final class Composition {

    public static final Composition EMPTY = new Composition(ImmutableSortedMap.of());

    // one "[count] name" item of a list like "4 Hex, 3 HexNAc, Fuc"
    private static final Pattern itemPattern = Pattern.compile("^(-?\\d+)?\\s*([\\w-]+)$");

    private final ImmutableSortedMap<String, Integer> counts;
    private final int hash;

    private Composition(ImmutableSortedMap<String, Integer> counts) {
        this.counts = counts;
        this.hash = counts.hashCode();
    }

    public static Composition of(@NotNull Map<String, Integer> units) {
        TreeMap<String, Integer> nonZero = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : units.entrySet()) {
            if (entry.getValue() != null && entry.getValue() != 0) {
                nonZero.put(entry.getKey(), entry.getValue());
            }
        }
        if (nonZero.isEmpty()) {
            return EMPTY;
        }
        return new Composition(ImmutableSortedMap.copyOfSorted(nonZero));
    }

    public static Composition of(@NotNull String unit, int count) {
        if (count == 0) {
            return EMPTY;
        }
        return new Composition(ImmutableSortedMap.of(unit, count));
    }

    /**
     * Parse a comma separated composition string such as "4 Hex, 3 HexNAc, 1 Fuc". A missing count means 1, repeated
     * units are summed, and an empty (or blank) string is the empty composition.
     * @param composition composition string
     * @return parsed composition
     * @throws IllegalArgumentException if an item is not of the form "[count] name"
     */
    public static Composition parse(@NotNull String composition) {
        Map<String, Integer> units = new HashMap<>();
        for (String item : composition.split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher m = itemPattern.matcher(trimmed);
            if (!m.matches()) {
                throw new IllegalArgumentException(String.format("Invalid composition item '%s' in '%s'", trimmed, composition));
            }
            int count = m.group(1) == null ? 1 : Integer.parseInt(m.group(1));
            units.merge(m.group(2), count, Integer::sum);
        }
        return of(units);
    }

    public Composition add(@NotNull Composition other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<String, Integer> sum = new HashMap<>(counts);
        for (Map.Entry<String, Integer> entry : other.counts.entrySet()) {
            sum.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
        return of(sum);
    }

    public Composition subtract(@NotNull Composition other) {
        return add(other.negate());
    }

    public Composition negate() {
        return multiply(-1);
    }

    public Composition multiply(int factor) {
        if (factor == 0) {
            return EMPTY;
        }
        Map<String, Integer> scaled = new HashMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            scaled.put(entry.getKey(), entry.getValue() * factor);
        }
        return of(scaled);
    }

    /** @return count of the unit, 0 if absent */
    public int get(String unit) {
        return counts.getOrDefault(unit, 0);
    }

    public Set<String> units() {
        return counts.keySet();
    }

    /** Sum of all signed counts. */
    public int totalCount() {
        int total = 0;
        for (int c : counts.values()) {
            total += c;
        }
        return total;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Map<String, Integer> asMap() {
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Composition)) {
            return false;
        }
        Composition other = (Composition) o;
        return hash == other.hash && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * @return a string like "1 Hex, 2 HexNAc", or "[no PTMs]" for the empty composition
     */
    @Override
    public String toString() {
        if (counts.isEmpty()) {
            return "[no PTMs]";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getValue()).append(' ').append(entry.getKey());
        }
        return sb.toString();
    }
}
