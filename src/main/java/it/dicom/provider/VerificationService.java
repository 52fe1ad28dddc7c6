package it.dicom.provider;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import it.dicom.dimse.DimseRequest;
import it.dicom.dimse.DimseResponse;
import it.dicom.dimse.DimseResponseStream;
import it.dicom.dimse.DimseServiceProvider;
import it.dicom.domain.InvokedService;

@Service
public class VerificationService implements DimseServiceProvider {

    private static final Logger logger = LoggerFactory.getLogger(VerificationService.class);

    @Override
    public Set<InvokedService> services() {
        return Set.of(InvokedService.C_ECHO);
    }

    @Override
    public DimseResponseStream onCEcho(DimseRequest request) {
        logger.debug("C-ECHO from {} (message ID {})", request.callingAeTitle(), request.messageId());
        return DimseResponseStream.of(DimseResponse.success(request));
    }
}
