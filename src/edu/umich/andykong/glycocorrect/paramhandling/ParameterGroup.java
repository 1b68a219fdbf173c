package edu.umich.andykong.glycocorrect.paramhandling;

import java.util.LinkedHashMap;
import java.util.Map;

public class ParameterGroup {
    private String name;
    private Map<String, Parameter<?>> parameters;


    public ParameterGroup(String name) {
        this.name = name;
        this.parameters = new LinkedHashMap<>();
    }

    public void addParam(Parameter<?> parameter) {
        if (parameters.containsKey(parameter.getKey())) {
            throw new IllegalArgumentException("Parameter already exists: " + parameter.getKey());
        }
        parameters.put(parameter.getKey(), parameter);
    }


    public Parameter<?> getParam(String key) {
        Parameter<?> parameter = parameters.get(key);
        if (parameter == null)
            throw new IllegalArgumentException("Parameter not found: " + key);
        return parameter;
    }

    public boolean hasParam(String key) {
        return parameters.containsKey(key);
    }


    @SuppressWarnings("unchecked")
    public <T> void setParamValue(String key, T value) {
        Parameter<T> parameter = (Parameter<T>) getParam(key);
        parameter.setValue(value);
    }

    public void setParamValueFromString(String key, String value) {
        getParam(key).setValueFromString(value);
    }

    public String getString(String key) {
        return (String) getParam(key).getValue();
    }

    public int getInt(String key) {
        return (Integer) getParam(key).getValue();
    }

    public boolean getBoolean(String key) {
        return (Boolean) getParam(key).getValue();
    }

    public String getName() {
        return name;
    }
}
