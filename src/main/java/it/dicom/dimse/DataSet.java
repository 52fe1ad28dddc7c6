package it.dicom.dimse;

import java.util.Arrays;

public record DataSet(byte[] bytes, String transferSyntax) {

    public DataSet {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DataSet dataSet
            && Arrays.equals(bytes, dataSet.bytes)
            && transferSyntax.equals(dataSet.transferSyntax);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + transferSyntax.hashCode();
    }

    @Override
    public String toString() {
        return "DataSet[" + bytes.length + " bytes, ts=" + transferSyntax + "]";
    }
}
