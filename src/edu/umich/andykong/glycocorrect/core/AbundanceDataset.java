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

package edu.umich.andykong.glycocorrect.core;

import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered collection of labelled abundances with uncertainty, one per glycoform or per glycation extent.
 */
public class AbundanceDataset {
    private final String name;
    private final LinkedHashMap<String, ValueWithUncertainty> abundances;

    public AbundanceDataset(String name) {
        this.name = name;
        this.abundances = new LinkedHashMap<>();
    }

    public AbundanceDataset() {
        this("");
    }

    /**
     * @throws InputFormatException if the label is already present
     */
    public void add(String label, ValueWithUncertainty abundance) throws InputFormatException {
        if (abundances.containsKey(label)) {
            throw new InputFormatException(String.format("Duplicate label '%s' in dataset %s", label, name));
        }
        abundances.put(label, abundance);
    }

    public void add(String label, double value, double error) throws InputFormatException {
        add(label, new ValueWithUncertainty(value, error));
    }

    /** @return abundance for the label, or null */
    public ValueWithUncertainty get(String label) {
        return abundances.get(label);
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(abundances.keySet());
    }

    public Map<String, ValueWithUncertainty> asMap() {
        return Collections.unmodifiableMap(abundances);
    }

    public List<ValueWithUncertainty> values() {
        return new ArrayList<>(abundances.values());
    }

    public String getName() {
        return name;
    }

    public int size() {
        return abundances.size();
    }

    public boolean isEmpty() {
        return abundances.isEmpty();
    }
}
