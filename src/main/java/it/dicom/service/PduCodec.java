package it.dicom.service;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.dicom.codec.FramingException;
import it.dicom.codec.UlItem;
import it.dicom.codec.UlItemCodec;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.PduType;
import it.dicom.domain.PresentationContextResult;
import it.dicom.service.PduModels.Abort;
import it.dicom.service.PduModels.AssociateAccept;
import it.dicom.service.PduModels.AssociateReject;
import it.dicom.service.PduModels.AssociateRequest;
import it.dicom.service.PduModels.AsyncOperationsWindow;
import it.dicom.service.PduModels.PDataTf;
import it.dicom.service.PduModels.Pdu;
import it.dicom.service.PduModels.PresentationContextReply;
import it.dicom.service.PduModels.PresentationDataValue;
import it.dicom.service.PduModels.ReleaseRequest;
import it.dicom.service.PduModels.ReleaseResponse;
import it.dicom.service.PduModels.RoleSelection;
import it.dicom.service.PduModels.UserInformation;

@Component
public class PduCodec {

    public static final int HEADER_LENGTH = 6;
    public static final int DEFAULT_MAX_DECODE_LENGTH = 1 << 20;

    static final int ITEM_APPLICATION_CONTEXT = 0x10;
    static final int ITEM_PRESENTATION_CONTEXT_RQ = 0x20;
    static final int ITEM_PRESENTATION_CONTEXT_AC = 0x21;
    static final int ITEM_ABSTRACT_SYNTAX = 0x30;
    static final int ITEM_TRANSFER_SYNTAX = 0x40;
    static final int ITEM_USER_INFORMATION = 0x50;
    static final int SUB_ITEM_MAX_LENGTH = 0x51;
    static final int SUB_ITEM_IMPLEMENTATION_CLASS_UID = 0x52;
    static final int SUB_ITEM_ASYNC_OPERATIONS_WINDOW = 0x53;
    static final int SUB_ITEM_ROLE_SELECTION = 0x54;
    static final int SUB_ITEM_IMPLEMENTATION_VERSION_NAME = 0x55;

    private static final int ASSOCIATE_FIXED_LENGTH = 68;

    private final int maxDecodeLength;

    public PduCodec(@Value("${dicom.pdu.max-decode-length:1048576}") int maxDecodeLength) {
        if (maxDecodeLength < HEADER_LENGTH) {
            throw new IllegalArgumentException("PDU decode limit too small: " + maxDecodeLength);
        }
        this.maxDecodeLength = maxDecodeLength;
    }

    public int maxDecodeLength() {
        return maxDecodeLength;
    }

    public byte[] encode(Pdu pdu) {
        byte[] body = encodeBody(pdu);
        byte[] framed = new byte[HEADER_LENGTH + body.length];
        framed[0] = (byte) pdu.type().code();
        UlItemCodec.writeUnsignedInt(framed, 2, body.length);
        System.arraycopy(body, 0, framed, HEADER_LENGTH, body.length);
        return framed;
    }

    public Pdu decode(byte[] pdu) {
        if (pdu.length < HEADER_LENGTH) {
            throw new FramingException("Truncated PDU header: " + pdu.length + " bytes");
        }
        long declared = UlItemCodec.readUnsignedInt(pdu, 2);
        if (declared != pdu.length - HEADER_LENGTH) {
            throw new FramingException("PDU length " + declared + " does not match body length " + (pdu.length - HEADER_LENGTH));
        }
        checkLimit(declared);
        return decodeBody(pdu[0] & 0xFF, Arrays.copyOfRange(pdu, HEADER_LENGTH, pdu.length));
    }

    public Pdu read(InputStream in) throws IOException {
        int first = in.read();
        if (first == -1) {
            return null;
        }
        byte[] rest = in.readNBytes(HEADER_LENGTH - 1);
        if (rest.length != HEADER_LENGTH - 1) {
            throw new FramingException("Connection closed while reading PDU header");
        }
        long length = ((long) (rest[1] & 0xFF) << 24) | ((rest[2] & 0xFF) << 16) | ((rest[3] & 0xFF) << 8) | (rest[4] & 0xFF);
        checkLimit(length);
        byte[] body = in.readNBytes((int) length);
        if (body.length != length) {
            throw new FramingException("Connection closed after " + body.length + " of " + length + " PDU body bytes", new EOFException());
        }
        return decodeBody(first, body);
    }

    public void write(OutputStream out, Pdu pdu) throws IOException {
        out.write(encode(pdu));
        out.flush();
    }

    private void checkLimit(long length) {
        if (length > maxDecodeLength) {
            throw new FramingException("PDU length " + length + " exceeds limit " + maxDecodeLength);
        }
    }

    private Pdu decodeBody(int typeCode, byte[] body) {
        PduType type = PduType.fromCode(typeCode)
            .orElseThrow(() -> new FramingException("Unrecognized PDU type 0x" + Integer.toHexString(typeCode)));
        return switch (type) {
            case A_ASSOCIATE_RQ -> decodeAssociateRequest(body);
            case A_ASSOCIATE_AC -> decodeAssociateAccept(body);
            case A_ASSOCIATE_RJ -> {
                requireLength(body, 4, type);
                yield new AssociateReject(new AssociateRejection(body[1] & 0xFF, body[2] & 0xFF, body[3] & 0xFF));
            }
            case P_DATA_TF -> decodePData(body);
            case A_RELEASE_RQ -> {
                requireLength(body, 4, type);
                yield new ReleaseRequest();
            }
            case A_RELEASE_RP -> {
                requireLength(body, 4, type);
                yield new ReleaseResponse();
            }
            case A_ABORT -> {
                requireLength(body, 4, type);
                yield new Abort(body[2] & 0xFF, body[3] & 0xFF);
            }
        };
    }

    private byte[] encodeBody(Pdu pdu) {
        if (pdu instanceof AssociateRequest rq) {
            return encodeAssociate(rq.protocolVersion(), rq.calledAeTitle(), rq.callingAeTitle(), encodeAssociateRequestItems(rq));
        }
        if (pdu instanceof AssociateAccept ac) {
            return encodeAssociate(ac.protocolVersion(), ac.calledAeTitle(), ac.callingAeTitle(), encodeAssociateAcceptItems(ac));
        }
        if (pdu instanceof AssociateReject rj) {
            AssociateRejection rejection = rj.rejection();
            return new byte[] {0, (byte) rejection.result(), (byte) rejection.source(), (byte) rejection.reason()};
        }
        if (pdu instanceof PDataTf data) {
            return encodePData(data);
        }
        if (pdu instanceof ReleaseRequest || pdu instanceof ReleaseResponse) {
            return new byte[4];
        }
        if (pdu instanceof Abort abort) {
            return new byte[] {0, 0, (byte) abort.source(), (byte) abort.reason()};
        }
        throw new IllegalArgumentException("Unsupported PDU type: " + pdu.getClass().getSimpleName());
    }

    private void requireLength(byte[] body, int expected, PduType type) {
        if (body.length != expected) {
            throw new FramingException(type + " body must be " + expected + " bytes, got " + body.length);
        }
    }

    private byte[] encodeAssociate(int protocolVersion, String calledAeTitle, String callingAeTitle, byte[] items) {
        byte[] fixed = new byte[ASSOCIATE_FIXED_LENGTH];
        UlItemCodec.writeUnsignedShort(fixed, 0, protocolVersion);
        UlItemCodec.encodeAeTitle(fixed, 4, calledAeTitle);
        UlItemCodec.encodeAeTitle(fixed, 20, callingAeTitle);
        return UlItemCodec.concat(fixed, items);
    }

    private byte[] encodeAssociateRequestItems(AssociateRequest rq) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(UlItemCodec.encode(ITEM_APPLICATION_CONTEXT, UlItemCodec.encodeUid(rq.applicationContextName())));
        for (PresentationContext context : rq.presentationContexts()) {
            ByteArrayOutputStream value = new ByteArrayOutputStream();
            value.writeBytes(new byte[] {(byte) context.identifier(), 0, 0, 0});
            value.writeBytes(UlItemCodec.encode(ITEM_ABSTRACT_SYNTAX, UlItemCodec.encodeUid(context.abstractSyntax())));
            for (String transferSyntax : context.transferSyntaxes()) {
                value.writeBytes(UlItemCodec.encode(ITEM_TRANSFER_SYNTAX, UlItemCodec.encodeUid(transferSyntax)));
            }
            out.writeBytes(UlItemCodec.encode(ITEM_PRESENTATION_CONTEXT_RQ, value.toByteArray()));
        }
        out.writeBytes(encodeUserInformation(rq.userInformation()));
        return out.toByteArray();
    }

    private byte[] encodeAssociateAcceptItems(AssociateAccept ac) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(UlItemCodec.encode(ITEM_APPLICATION_CONTEXT, UlItemCodec.encodeUid(ac.applicationContextName())));
        for (PresentationContextReply reply : ac.presentationContexts()) {
            byte[] header = new byte[] {(byte) reply.identifier(), 0, (byte) reply.result().code(), 0};
            String transferSyntax = reply.transferSyntax() == null ? "" : reply.transferSyntax();
            byte[] value = UlItemCodec.concat(header, UlItemCodec.encode(ITEM_TRANSFER_SYNTAX, UlItemCodec.encodeUid(transferSyntax)));
            out.writeBytes(UlItemCodec.encode(ITEM_PRESENTATION_CONTEXT_AC, value));
        }
        out.writeBytes(encodeUserInformation(ac.userInformation()));
        return out.toByteArray();
    }

    private byte[] encodeUserInformation(UserInformation userInformation) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] maxLength = new byte[4];
        UlItemCodec.writeUnsignedInt(maxLength, 0, userInformation.maxPduLength());
        out.writeBytes(UlItemCodec.encode(SUB_ITEM_MAX_LENGTH, maxLength));
        userInformation.implementationClassUid()
            .ifPresent(uid -> out.writeBytes(UlItemCodec.encode(SUB_ITEM_IMPLEMENTATION_CLASS_UID, UlItemCodec.encodeUid(uid))));
        userInformation.asyncOperationsWindow().ifPresent(window -> {
            byte[] value = new byte[4];
            UlItemCodec.writeUnsignedShort(value, 0, window.maxOperationsInvoked());
            UlItemCodec.writeUnsignedShort(value, 2, window.maxOperationsPerformed());
            out.writeBytes(UlItemCodec.encode(SUB_ITEM_ASYNC_OPERATIONS_WINDOW, value));
        });
        for (RoleSelection role : userInformation.roleSelections()) {
            byte[] uid = UlItemCodec.encodeUid(role.sopClassUid());
            byte[] value = new byte[uid.length + 4];
            UlItemCodec.writeUnsignedShort(value, 0, uid.length);
            System.arraycopy(uid, 0, value, 2, uid.length);
            value[uid.length + 2] = (byte) (role.scuRole() ? 1 : 0);
            value[uid.length + 3] = (byte) (role.scpRole() ? 1 : 0);
            out.writeBytes(UlItemCodec.encode(SUB_ITEM_ROLE_SELECTION, value));
        }
        userInformation.implementationVersionName()
            .ifPresent(name -> out.writeBytes(UlItemCodec.encode(SUB_ITEM_IMPLEMENTATION_VERSION_NAME, UlItemCodec.encodeUid(name))));
        for (UlItem extended : userInformation.extendedItems()) {
            out.writeBytes(UlItemCodec.encode(extended));
        }
        return UlItemCodec.encode(ITEM_USER_INFORMATION, out.toByteArray());
    }

    private AssociateRequest decodeAssociateRequest(byte[] body) {
        AssociateHeader header = decodeAssociateHeader(body, PduType.A_ASSOCIATE_RQ);
        List<PresentationContext> contexts = new ArrayList<>();
        for (UlItem item : header.items()) {
            if (item.type() == ITEM_PRESENTATION_CONTEXT_RQ) {
                contexts.add(decodeProposedContext(item));
            } else if (item.type() != ITEM_APPLICATION_CONTEXT && item.type() != ITEM_USER_INFORMATION) {
                throw new FramingException("Unexpected item 0x" + Integer.toHexString(item.type()) + " in A-ASSOCIATE-RQ");
            }
        }
        if (contexts.isEmpty()) {
            throw new FramingException("A-ASSOCIATE-RQ carries no presentation context");
        }
        return new AssociateRequest(header.protocolVersion(), header.calledAeTitle(), header.callingAeTitle(),
            header.applicationContextName(), contexts, header.userInformation());
    }

    private AssociateAccept decodeAssociateAccept(byte[] body) {
        AssociateHeader header = decodeAssociateHeader(body, PduType.A_ASSOCIATE_AC);
        List<PresentationContextReply> replies = new ArrayList<>();
        for (UlItem item : header.items()) {
            if (item.type() == ITEM_PRESENTATION_CONTEXT_AC) {
                replies.add(decodeContextReply(item));
            } else if (item.type() != ITEM_APPLICATION_CONTEXT && item.type() != ITEM_USER_INFORMATION) {
                throw new FramingException("Unexpected item 0x" + Integer.toHexString(item.type()) + " in A-ASSOCIATE-AC");
            }
        }
        return new AssociateAccept(header.protocolVersion(), header.calledAeTitle(), header.callingAeTitle(),
            header.applicationContextName(), replies, header.userInformation());
    }

    private AssociateHeader decodeAssociateHeader(byte[] body, PduType type) {
        if (body.length < ASSOCIATE_FIXED_LENGTH) {
            throw new FramingException(type + " shorter than its fixed fields: " + body.length + " bytes");
        }
        int protocolVersion = UlItemCodec.readUnsignedShort(body, 0);
        String called = UlItemCodec.decodeAeTitle(body, 4);
        String calling = UlItemCodec.decodeAeTitle(body, 20);
        List<UlItem> items = UlItemCodec.decodeAll(body, ASSOCIATE_FIXED_LENGTH, body.length);

        List<UlItem> applicationContexts = UlItemCodec.findAll(items, ITEM_APPLICATION_CONTEXT);
        if (applicationContexts.size() != 1) {
            throw new FramingException(type + " must carry exactly one application context item, found " + applicationContexts.size());
        }
        List<UlItem> userInformation = UlItemCodec.findAll(items, ITEM_USER_INFORMATION);
        if (userInformation.size() != 1) {
            throw new FramingException(type + " must carry exactly one user information item, found " + userInformation.size());
        }
        return new AssociateHeader(
            protocolVersion,
            called,
            calling,
            UlItemCodec.decodeUid(applicationContexts.get(0).value()),
            decodeUserInformation(userInformation.get(0)),
            items
        );
    }

    private PresentationContext decodeProposedContext(UlItem item) {
        byte[] value = item.value();
        if (value.length < 4) {
            throw new FramingException("Truncated presentation-context item");
        }
        int identifier = value[0] & 0xFF;
        String abstractSyntax = null;
        List<String> transferSyntaxes = new ArrayList<>();
        for (UlItem subItem : UlItemCodec.decodeAll(value, 4, value.length)) {
            if (subItem.type() == ITEM_ABSTRACT_SYNTAX) {
                if (abstractSyntax != null) {
                    throw new FramingException("Presentation-context " + identifier + " carries more than one abstract syntax");
                }
                abstractSyntax = UlItemCodec.decodeUid(subItem.value());
            } else if (subItem.type() == ITEM_TRANSFER_SYNTAX) {
                transferSyntaxes.add(UlItemCodec.decodeUid(subItem.value()));
            } else {
                throw new FramingException("Unexpected sub-item 0x" + Integer.toHexString(subItem.type()) + " in presentation-context " + identifier);
            }
        }
        if (abstractSyntax == null) {
            throw new FramingException("Presentation-context " + identifier + " carries no abstract syntax");
        }
        if (transferSyntaxes.isEmpty()) {
            throw new FramingException("Presentation-context " + identifier + " carries no transfer syntax");
        }
        return new PresentationContext(identifier, abstractSyntax, transferSyntaxes);
    }

    private PresentationContextReply decodeContextReply(UlItem item) {
        byte[] value = item.value();
        if (value.length < 4) {
            throw new FramingException("Truncated presentation-context item");
        }
        int identifier = value[0] & 0xFF;
        PresentationContextResult result;
        try {
            result = PresentationContextResult.fromCode(value[2] & 0xFF);
        } catch (IllegalArgumentException ex) {
            throw new FramingException("Presentation-context " + identifier + ": " + ex.getMessage());
        }
        List<UlItem> subItems = UlItemCodec.decodeAll(value, 4, value.length);
        for (UlItem subItem : subItems) {
            if (subItem.type() != ITEM_TRANSFER_SYNTAX) {
                throw new FramingException("Unexpected sub-item 0x" + Integer.toHexString(subItem.type()) + " in presentation-context " + identifier);
            }
        }
        if (subItems.size() > 1) {
            throw new FramingException("Presentation-context " + identifier + " answers with more than one transfer syntax");
        }
        Optional<UlItem> transferSyntax = subItems.stream().findFirst();
        if (result.isAccepted()) {
            String uid = UlItemCodec.decodeUid(transferSyntax
                .orElseThrow(() -> new FramingException("Accepted presentation-context " + identifier + " carries no transfer syntax"))
                .value());
            return PresentationContextReply.accepted(identifier, uid);
        }
        // not significant when rejected, tolerated empty
        String uid = transferSyntax.filter(ts -> ts.length() > 0).map(ts -> UlItemCodec.decodeUid(ts.value())).orElse("");
        return new PresentationContextReply(identifier, result, uid);
    }

    private UserInformation decodeUserInformation(UlItem item) {
        Long maxLength = null;
        Optional<String> implementationClassUid = Optional.empty();
        Optional<String> implementationVersionName = Optional.empty();
        Optional<AsyncOperationsWindow> asyncWindow = Optional.empty();
        List<RoleSelection> roles = new ArrayList<>();
        List<UlItem> extended = new ArrayList<>();

        for (UlItem subItem : UlItemCodec.decodeAll(item.value())) {
            byte[] value = subItem.value();
            switch (subItem.type()) {
                case SUB_ITEM_MAX_LENGTH -> {
                    if (value.length != 4) {
                        throw new FramingException("Maximum length sub-item must be 4 bytes");
                    }
                    maxLength = UlItemCodec.readUnsignedInt(value, 0);
                }
                case SUB_ITEM_IMPLEMENTATION_CLASS_UID -> implementationClassUid = Optional.of(UlItemCodec.decodeUid(value));
                case SUB_ITEM_IMPLEMENTATION_VERSION_NAME -> implementationVersionName = Optional.of(UlItemCodec.decodeAscii(value));
                case SUB_ITEM_ASYNC_OPERATIONS_WINDOW -> {
                    if (value.length != 4) {
                        throw new FramingException("Asynchronous operations window sub-item must be 4 bytes");
                    }
                    asyncWindow = Optional.of(new AsyncOperationsWindow(
                        UlItemCodec.readUnsignedShort(value, 0),
                        UlItemCodec.readUnsignedShort(value, 2)
                    ));
                }
                case SUB_ITEM_ROLE_SELECTION -> roles.add(decodeRoleSelection(value));
                default -> {
                    if (!subItem.isUserInformationSubItem()) {
                        throw new FramingException("Unexpected sub-item 0x" + Integer.toHexString(subItem.type()) + " in user information");
                    }
                    extended.add(subItem);
                }
            }
        }
        if (maxLength == null) {
            throw new FramingException("User information carries no maximum length sub-item");
        }
        return new UserInformation(maxLength, implementationClassUid, implementationVersionName, asyncWindow, roles, extended);
    }

    private RoleSelection decodeRoleSelection(byte[] value) {
        if (value.length < 4) {
            throw new FramingException("Truncated role selection sub-item");
        }
        int uidLength = UlItemCodec.readUnsignedShort(value, 0);
        if (uidLength + 4 != value.length) {
            throw new FramingException("Role selection UID length " + uidLength + " inconsistent with sub-item length " + value.length);
        }
        String uid = UlItemCodec.decodeUid(Arrays.copyOfRange(value, 2, 2 + uidLength));
        return new RoleSelection(uid, value[2 + uidLength] != 0, value[3 + uidLength] != 0);
    }

    private byte[] encodePData(PDataTf data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (PresentationDataValue pdv : data.values()) {
            byte[] header = new byte[6];
            UlItemCodec.writeUnsignedInt(header, 0, pdv.data().length + 2L);
            header[4] = (byte) pdv.presentationContextId();
            header[5] = (byte) pdv.messageControlHeader();
            out.writeBytes(header);
            out.writeBytes(pdv.data());
        }
        return out.toByteArray();
    }

    private PDataTf decodePData(byte[] body) {
        List<PresentationDataValue> values = new ArrayList<>();
        int offset = 0;
        while (offset < body.length) {
            if (offset + 6 > body.length) {
                throw new FramingException("Truncated PDV item header at offset " + offset);
            }
            long itemLength = UlItemCodec.readUnsignedInt(body, offset);
            if (itemLength < 2 || offset + 4 + itemLength > body.length) {
                throw new FramingException("Invalid PDV item length " + itemLength + " at offset " + offset);
            }
            int contextId = body[offset + 4] & 0xFF;
            int control = body[offset + 5] & 0xFF;
            if ((control & 0xFC) != 0) {
                throw new FramingException("Reserved bits set in PDV message control header: " + String.format("0x%02X", control));
            }
            int dataStart = offset + 6;
            int dataEnd = offset + 4 + (int) itemLength;
            values.add(new PresentationDataValue(contextId, (control & 0x01) != 0, (control & 0x02) != 0,
                Arrays.copyOfRange(body, dataStart, dataEnd)));
            offset = dataEnd;
        }
        if (values.isEmpty()) {
            throw new FramingException("P-DATA-TF carries no PDV item");
        }
        return new PDataTf(values);
    }

    private record AssociateHeader(
        int protocolVersion,
        String calledAeTitle,
        String callingAeTitle,
        String applicationContextName,
        UserInformation userInformation,
        List<UlItem> items
    ) {
    }
}
