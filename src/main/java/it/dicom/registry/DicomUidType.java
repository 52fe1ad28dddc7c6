package it.dicom.registry;

public enum DicomUidType {
    TRANSFER_SYNTAX,
    SOP_CLASS,
    META_SOP_CLASS,
    SERVICE_CLASS,
    SOP_INSTANCE,
    APPLICATION_CONTEXT_NAME,
    APPLICATION_HOSTING_MODEL,
    CODING_SCHEME,
    FRAME_OF_REFERENCE,
    LDAP,
    MAPPING_RESOURCE,
    CONTEXT_GROUP_NAME,
    UNKNOWN
}
