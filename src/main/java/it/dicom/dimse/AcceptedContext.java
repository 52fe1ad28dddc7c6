package it.dicom.dimse;

public record AcceptedContext(int identifier, String abstractSyntax, String transferSyntax) {
}
