package edu.umich.andykong.glycocorrect.paramhandling;


public class BooleanParameter implements Parameter<Boolean> {
    private String key;
    private boolean value;
    private String description;

    public BooleanParameter(String key, boolean value, String description) {
        this.key = key;
        this.value = value;
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Boolean getValue() {
        return value;
    }

    @Override
    public void setValue(Boolean value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(key + " received an invalid argument.");
        }
        this.value = value;
    }

    // true/false or 1/0
    @Override
    public void setValueFromString(String value) throws IllegalArgumentException {
        String v = value.trim().toLowerCase();
        if (v.equals("true") || v.equals("1")) {
            setValue(true);
        } else if (v.equals("false") || v.equals("0")) {
            setValue(false);
        } else {
            throw new IllegalArgumentException(String.format("%s expects true or false, got '%s'", key, value));
        }
    }

    @Override
    public boolean isValid(Boolean value) {
        return value != null;
    }

    @Override
    public String getDescription() {
        return description;
    }
}
