package edu.umich.andykong.glycocorrect.paramhandling;

public interface Parameter<T> {
    String getKey();
    T getValue();
    void setValue(T value) throws IllegalArgumentException;
    void setValueFromString(String value) throws IllegalArgumentException;
    boolean isValid(T value);
    String getDescription();

}
