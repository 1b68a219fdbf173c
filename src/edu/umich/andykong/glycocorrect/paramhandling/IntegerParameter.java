package edu.umich.andykong.glycocorrect.paramhandling;


public class IntegerParameter implements Parameter<Integer> {
    private String key;
    private int value;
    private int min;
    private int max;
    private String description;

    public IntegerParameter(String key, int min, int max, int value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.value = value;
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Integer getValue() {
        return value;
    }

    @Override
    public void setValue(Integer value) throws IllegalArgumentException {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format("%s received an invalid argument: %d (allowed %d to %d)", key, value, min, max));
        }
        this.value = value;
    }

    @Override
    public void setValueFromString(String value) throws IllegalArgumentException {
        try {
            setValue(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s expects an integer, got '%s'", key, value), e);
        }
    }

    @Override
    public boolean isValid(Integer value) {
        return value != null && ((value >= min) && (value <= max));
    }

    @Override
    public String getDescription() {
        return description;
    }
}
