package it.dicom.dimse;

import java.util.Optional;

import it.dicom.domain.DimseStatus;

public record DimseResponse(CommandSet command, Optional<DataSet> dataSet) {

    public DimseResponse {
        if (command.status().isEmpty()) {
            throw new IllegalArgumentException("A response command needs a status");
        }
    }

    public int status() {
        return command.status().getAsInt();
    }

    public boolean isPending() {
        return DimseStatus.isPending(status());
    }

    public boolean isTerminal() {
        return !isPending();
    }

    public int messageIdBeingRespondedTo() {
        return command.messageIdBeingRespondedTo();
    }

    public static DimseResponse success(DimseRequest request) {
        return of(request, DimseStatus.SUCCESS, Optional.empty());
    }

    public static DimseResponse pending(DimseRequest request, DataSet identifier) {
        return of(request, DimseStatus.PENDING, Optional.of(identifier));
    }

    public static DimseResponse failure(DimseRequest request, int status, String comment) {
        CommandSet.Builder builder = responseCommand(request, status, false);
        if (comment != null && !comment.isBlank()) {
            String text = comment.length() > 64 ? comment.substring(0, 64) : comment;
            builder.putString(CommandTags.ERROR_COMMENT, text);
        }
        return new DimseResponse(builder.build(), Optional.empty());
    }

    public static DimseResponse of(DimseRequest request, int status, Optional<DataSet> dataSet) {
        return new DimseResponse(responseCommand(request, status, dataSet.isPresent()).build(), dataSet);
    }

    public static CommandSet.Builder responseCommand(DimseRequest request, int status, boolean dataSetPresent) {
        CommandSet command = request.command();
        CommandSet.Builder builder = CommandSet.builder()
            .commandField(request.service().responseField())
            .messageIdBeingRespondedTo(command.messageId())
            .dataSetPresent(dataSetPresent)
            .status(status);
        command.sopClassUid().ifPresent(builder::affectedSopClassUid);
        Optional<String> instance = command.string(CommandTags.AFFECTED_SOP_INSTANCE_UID)
            .or(() -> command.string(CommandTags.REQUESTED_SOP_INSTANCE_UID));
        instance.ifPresent(uid -> builder.putString(CommandTags.AFFECTED_SOP_INSTANCE_UID, uid));
        return builder;
    }
}
