package it.dicom.dimse;

import java.util.Optional;

public record DimseMessage(int presentationContextId, CommandSet command, Optional<DataSet> dataSet) {

    public DimseMessage {
        if (command.hasDataSet() != dataSet.isPresent()) {
            throw new IllegalArgumentException("Command data set type does not match the presence of a data set: " + command);
        }
    }
}
