package it.dicom.registry;

public enum DicomStorageCategory {
    NONE,
    IMAGE,
    PRESENTATION_STATE,
    STRUCTURED_REPORT,
    WAVEFORM,
    DOCUMENT,
    RAW,
    OTHER,
    PRIVATE,
    VOLUME
}
