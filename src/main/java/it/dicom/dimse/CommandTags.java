package it.dicom.dimse;

import java.util.Map;

public final class CommandTags {

    public static final int COMMAND_GROUP_LENGTH = 0x0000_0000;
    public static final int AFFECTED_SOP_CLASS_UID = 0x0000_0002;
    public static final int REQUESTED_SOP_CLASS_UID = 0x0000_0003;
    public static final int COMMAND_FIELD = 0x0000_0100;
    public static final int MESSAGE_ID = 0x0000_0110;
    public static final int MESSAGE_ID_BEING_RESPONDED_TO = 0x0000_0120;
    public static final int MOVE_DESTINATION = 0x0000_0600;
    public static final int PRIORITY = 0x0000_0700;
    public static final int COMMAND_DATA_SET_TYPE = 0x0000_0800;
    public static final int STATUS = 0x0000_0900;
    public static final int OFFENDING_ELEMENT = 0x0000_0901;
    public static final int ERROR_COMMENT = 0x0000_0902;
    public static final int ERROR_ID = 0x0000_0903;
    public static final int AFFECTED_SOP_INSTANCE_UID = 0x0000_1000;
    public static final int REQUESTED_SOP_INSTANCE_UID = 0x0000_1001;
    public static final int EVENT_TYPE_ID = 0x0000_1002;
    public static final int ATTRIBUTE_IDENTIFIER_LIST = 0x0000_1005;
    public static final int ACTION_TYPE_ID = 0x0000_1008;
    public static final int NUMBER_OF_REMAINING_SUB_OPERATIONS = 0x0000_1020;
    public static final int NUMBER_OF_COMPLETED_SUB_OPERATIONS = 0x0000_1021;
    public static final int NUMBER_OF_FAILED_SUB_OPERATIONS = 0x0000_1022;
    public static final int NUMBER_OF_WARNING_SUB_OPERATIONS = 0x0000_1023;
    public static final int MOVE_ORIGINATOR_AE_TITLE = 0x0000_1030;
    public static final int MOVE_ORIGINATOR_MESSAGE_ID = 0x0000_1031;

    public static final int DATA_SET_ABSENT = 0x0101;
    public static final int DATA_SET_PRESENT = 0x0000;

    public static final int PRIORITY_MEDIUM = 0x0000;
    public static final int PRIORITY_HIGH = 0x0001;
    public static final int PRIORITY_LOW = 0x0002;

    public enum Vr {
        UL, US, UI, AE, LO, AT, UN
    }

    private static final Map<Integer, Vr> VRS = Map.ofEntries(
        Map.entry(COMMAND_GROUP_LENGTH, Vr.UL),
        Map.entry(AFFECTED_SOP_CLASS_UID, Vr.UI),
        Map.entry(REQUESTED_SOP_CLASS_UID, Vr.UI),
        Map.entry(COMMAND_FIELD, Vr.US),
        Map.entry(MESSAGE_ID, Vr.US),
        Map.entry(MESSAGE_ID_BEING_RESPONDED_TO, Vr.US),
        Map.entry(MOVE_DESTINATION, Vr.AE),
        Map.entry(PRIORITY, Vr.US),
        Map.entry(COMMAND_DATA_SET_TYPE, Vr.US),
        Map.entry(STATUS, Vr.US),
        Map.entry(OFFENDING_ELEMENT, Vr.AT),
        Map.entry(ERROR_COMMENT, Vr.LO),
        Map.entry(ERROR_ID, Vr.US),
        Map.entry(AFFECTED_SOP_INSTANCE_UID, Vr.UI),
        Map.entry(REQUESTED_SOP_INSTANCE_UID, Vr.UI),
        Map.entry(EVENT_TYPE_ID, Vr.US),
        Map.entry(ATTRIBUTE_IDENTIFIER_LIST, Vr.AT),
        Map.entry(ACTION_TYPE_ID, Vr.US),
        Map.entry(NUMBER_OF_REMAINING_SUB_OPERATIONS, Vr.US),
        Map.entry(NUMBER_OF_COMPLETED_SUB_OPERATIONS, Vr.US),
        Map.entry(NUMBER_OF_FAILED_SUB_OPERATIONS, Vr.US),
        Map.entry(NUMBER_OF_WARNING_SUB_OPERATIONS, Vr.US),
        Map.entry(MOVE_ORIGINATOR_AE_TITLE, Vr.AE),
        Map.entry(MOVE_ORIGINATOR_MESSAGE_ID, Vr.US)
    );

    private CommandTags() {
    }

    public static Vr vrOf(int tag) {
        return VRS.getOrDefault(tag, Vr.UN);
    }

    public static int group(int tag) {
        return tag >>> 16;
    }

    public static int element(int tag) {
        return tag & 0xFFFF;
    }

    public static String toString(int tag) {
        return String.format("(%04X,%04X)", group(tag), element(tag));
    }
}
