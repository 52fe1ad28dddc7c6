package it.dicom.dimse;

public class DimseServiceException extends RuntimeException {

    private final int status;

    public DimseServiceException(int status, String message) {
        super(message);
        this.status = status;
    }

    public DimseServiceException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
