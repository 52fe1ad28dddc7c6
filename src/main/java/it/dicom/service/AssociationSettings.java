package it.dicom.service;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AssociationSettings {

    public static final String IMPLEMENTATION_CLASS_UID = "2.25.86198493218837312485212385461862493405";
    public static final String IMPLEMENTATION_VERSION_NAME = "DICOM_UL_010";

    private String aeTitle = "DICOM-UL";
    private boolean acceptAnyCalledAeTitle = true;
    private long maxPduLength = 16384;
    private long artimTimeoutMillis = 30_000;
    private long idleTimeoutMillis = 60_000;
    private long releaseDrainTimeoutMillis = 30_000;
    private String implementationClassUid = IMPLEMENTATION_CLASS_UID;
    private String implementationVersionName = IMPLEMENTATION_VERSION_NAME;
}
