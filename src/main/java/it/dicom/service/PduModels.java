package it.dicom.service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import it.dicom.codec.UlItem;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.PduType;
import it.dicom.domain.PresentationContextResult;

public final class PduModels {

    public static final int PROTOCOL_VERSION = 1;
    public static final String DICOM_APPLICATION_CONTEXT = "1.2.840.10008.3.1.1.1";

    public static final int ABORT_SOURCE_SERVICE_USER = 0;
    public static final int ABORT_SOURCE_SERVICE_PROVIDER = 2;

    public static final int ABORT_REASON_NOT_SPECIFIED = 0;
    public static final int ABORT_REASON_UNRECOGNIZED_PDU = 1;
    public static final int ABORT_REASON_UNEXPECTED_PDU = 2;
    public static final int ABORT_REASON_UNRECOGNIZED_PDU_PARAMETER = 4;
    public static final int ABORT_REASON_UNEXPECTED_PDU_PARAMETER = 5;
    public static final int ABORT_REASON_INVALID_PDU_PARAMETER_VALUE = 6;

    private PduModels() {
    }

    public sealed interface Pdu permits AssociateRequest, AssociateAccept, AssociateReject, PDataTf, ReleaseRequest, ReleaseResponse, Abort {

        PduType type();
    }

    public record AssociateRequest(
        int protocolVersion,
        String calledAeTitle,
        String callingAeTitle,
        String applicationContextName,
        List<PresentationContext> presentationContexts,
        UserInformation userInformation
    ) implements Pdu {

        public AssociateRequest {
            presentationContexts = List.copyOf(presentationContexts);
        }

        @Override
        public PduType type() {
            return PduType.A_ASSOCIATE_RQ;
        }
    }

    public record AssociateAccept(
        int protocolVersion,
        String calledAeTitle,
        String callingAeTitle,
        String applicationContextName,
        List<PresentationContextReply> presentationContexts,
        UserInformation userInformation
    ) implements Pdu {

        public AssociateAccept {
            presentationContexts = List.copyOf(presentationContexts);
        }

        @Override
        public PduType type() {
            return PduType.A_ASSOCIATE_AC;
        }
    }

    public record AssociateReject(AssociateRejection rejection) implements Pdu {

        @Override
        public PduType type() {
            return PduType.A_ASSOCIATE_RJ;
        }
    }

    public record PDataTf(List<PresentationDataValue> values) implements Pdu {

        public PDataTf {
            values = List.copyOf(values);
        }

        @Override
        public PduType type() {
            return PduType.P_DATA_TF;
        }
    }

    public record ReleaseRequest() implements Pdu {

        @Override
        public PduType type() {
            return PduType.A_RELEASE_RQ;
        }
    }

    public record ReleaseResponse() implements Pdu {

        @Override
        public PduType type() {
            return PduType.A_RELEASE_RP;
        }
    }

    public record Abort(int source, int reason) implements Pdu {

        @Override
        public PduType type() {
            return PduType.A_ABORT;
        }
    }

    public record PresentationContextReply(int identifier, PresentationContextResult result, String transferSyntax) {

        public static PresentationContextReply accepted(int identifier, String transferSyntax) {
            return new PresentationContextReply(identifier, PresentationContextResult.ACCEPTANCE, transferSyntax);
        }

        public static PresentationContextReply rejected(int identifier, PresentationContextResult result) {
            return new PresentationContextReply(identifier, result, "");
        }
    }

    public record UserInformation(
        long maxPduLength,
        Optional<String> implementationClassUid,
        Optional<String> implementationVersionName,
        Optional<AsyncOperationsWindow> asyncOperationsWindow,
        List<RoleSelection> roleSelections,
        List<UlItem> extendedItems
    ) {

        public UserInformation {
            roleSelections = List.copyOf(roleSelections);
            extendedItems = List.copyOf(extendedItems);
        }

        public static UserInformation of(long maxPduLength, String implementationClassUid, String implementationVersionName) {
            return new UserInformation(
                maxPduLength,
                Optional.ofNullable(implementationClassUid),
                Optional.ofNullable(implementationVersionName),
                Optional.empty(),
                List.of(),
                List.of()
            );
        }
    }

    public record AsyncOperationsWindow(int maxOperationsInvoked, int maxOperationsPerformed) {
    }

    public record RoleSelection(String sopClassUid, boolean scuRole, boolean scpRole) {
    }

    public record PresentationDataValue(int presentationContextId, boolean command, boolean last, byte[] data) {

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof PresentationDataValue pdv)) {
                return false;
            }
            return presentationContextId == pdv.presentationContextId
                && command == pdv.command
                && last == pdv.last
                && Arrays.equals(data, pdv.data);
        }

        @Override
        public int hashCode() {
            int result = presentationContextId;
            result = 31 * result + (command ? 1 : 0);
            result = 31 * result + (last ? 1 : 0);
            return 31 * result + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "PDV[pc=" + presentationContextId + ", " + (command ? "command" : "data") + (last ? ", last" : "") + ", " + data.length + " bytes]";
        }

        int messageControlHeader() {
            return (command ? 0x01 : 0x00) | (last ? 0x02 : 0x00);
        }
    }
}
