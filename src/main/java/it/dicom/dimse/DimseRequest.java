package it.dicom.dimse;

import java.util.Optional;

import it.dicom.domain.InvokedService;

public record DimseRequest(
    InvokedService service,
    AcceptedContext context,
    CommandSet command,
    Optional<DataSet> dataSet,
    String callingAeTitle
) {

    public int messageId() {
        return command.messageId();
    }

    public Optional<String> sopClassUid() {
        return command.sopClassUid();
    }
}
