package it.dicom.dimse;

import java.util.Set;

import it.dicom.domain.DimseStatus;
import it.dicom.domain.InvokedService;

public interface DimseServiceProvider {

    Set<InvokedService> services();

    default DimseResponseStream onCEcho(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onCFind(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onCStore(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onCGet(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onCMove(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNEventReport(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNGet(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNSet(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNAction(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNCreate(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    default DimseResponseStream onNDelete(DimseRequest request) throws Exception {
        throw unsupported(request);
    }

    private static DimseServiceException unsupported(DimseRequest request) {
        return new DimseServiceException(DimseStatus.UNRECOGNIZED_OPERATION, request.service() + " is not implemented");
    }
}
