package it.dicom.dimse;

@FunctionalInterface
public interface DimseServiceHandler {

    DimseResponseStream handle(DimseRequest request) throws Exception;
}
