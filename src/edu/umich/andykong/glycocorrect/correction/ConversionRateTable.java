package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.core.AbundanceDataset;
import edu.umich.andykong.glycocorrect.core.InputFormatException;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup from a composition difference to the fraction of a glycoform that is converted by it.
 *
 * Every delta must have a strictly positive total unit count, so conversions always point towards more modified
 * glycoforms, and a delta and its negation never appear together. Both are checked when the table is created.
 */
public class ConversionRateTable {
    private final ImmutableMap<Composition, ValueWithUncertainty> rates;

    public ConversionRateTable(Map<Composition, ValueWithUncertainty> rates) {
        for (Composition delta : rates.keySet()) {
            if (delta.totalCount() <= 0) {
                throw new IllegalArgumentException(String.format("Conversion delta must add units: %s", delta));
            }
            if (rates.containsKey(delta.negate())) {
                throw new IllegalArgumentException(String.format("Conversion table contains both %s and its negation", delta));
            }
        }
        this.rates = ImmutableMap.copyOf(rates);
    }

    /**
     * Build the table from a glycation dataset whose labels count the added units, e.g. "0", "1", "2" extra hexoses,
     * and whose abundances are percentages. Counts of zero or less do not convert anything and are dropped.
     * @param glycation glycation abundances in percent
     * @param unit name of the unit added by glycation, e.g. "Hex"
     * @throws InputFormatException if a label is not an integer
     */
    public static ConversionRateTable fromGlycation(AbundanceDataset glycation, String unit) throws InputFormatException {
        Map<Composition, ValueWithUncertainty> rates = new LinkedHashMap<>();
        for (Map.Entry<String, ValueWithUncertainty> entry : glycation.asMap().entrySet()) {
            int count;
            try {
                count = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new InputFormatException(String.format("Glycation label '%s' in %s is not a count of %s units",
                        entry.getKey(), glycation.getName(), unit), e);
            }
            if (count > 0) {
                if (rates.containsKey(Composition.of(unit, count))) {
                    throw new InputFormatException(String.format("Glycation count %d appears twice in %s", count, glycation.getName()));
                }
                rates.put(Composition.of(unit, count), entry.getValue().divide(100));
            }
        }
        return new ConversionRateTable(rates);
    }

    /**
     * @return the conversion rate for the delta, or null if the delta does not convert
     */
    public ValueWithUncertainty lookup(Composition delta) {
        return rates.get(delta);
    }

    public Map<Composition, ValueWithUncertainty> asMap() {
        return rates;
    }

    public int size() {
        return rates.size();
    }

    public String toString() {
        return "ConversionRateTable" + rates;
    }
}
