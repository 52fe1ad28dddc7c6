package it.dicom.codec;

public class FramingException extends IllegalArgumentException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
