package edu.umich.andykong.glycocorrect.paramhandling;

import java.util.Arrays;
import java.util.List;

public class StringParameter implements Parameter<String> {
    private String key;
    private String value;
    private List<String> allowedValues;     // null means any value
    private String description;

    public StringParameter(String key, String value, String description) {
        this(key, value, null, description);
    }

    public StringParameter(String key, String value, String[] allowedValues, String description) {
        this.key = key;
        this.value = value;
        this.allowedValues = allowedValues == null ? null : Arrays.asList(allowedValues);
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public void setValue(String value) throws IllegalArgumentException {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format("%s received an invalid argument: '%s' (allowed: %s)", key, value, allowedValues));
        }
        this.value = value;
    }

    @Override
    public void setValueFromString(String value) throws IllegalArgumentException {
        setValue(value.trim());
    }

    @Override
    public boolean isValid(String value) {
        return value != null && (allowedValues == null || allowedValues.contains(value));
    }

    @Override
    public String getDescription() {
        return description;
    }
}
