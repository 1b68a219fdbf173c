package edu.umich.andykong.glycocorrect.glyco;

/**
 * Thrown when a glycan name cannot be converted to a composition with the shorthand nomenclature.
 */
public class NomenclatureException extends Exception {
    private final String glycanName;

    public NomenclatureException(String glycanName) {
        super(String.format("Invalid glycan name: '%s'", glycanName));
        this.glycanName = glycanName;
    }

    public String getGlycanName() {
        return glycanName;
    }
}
