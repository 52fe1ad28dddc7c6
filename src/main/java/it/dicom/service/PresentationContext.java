package it.dicom.service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record PresentationContext(int identifier, String abstractSyntax, List<String> transferSyntaxes) {

    public PresentationContext {
        transferSyntaxes = List.copyOf(transferSyntaxes);
    }

    public void validate() {
        if (identifier < 1 || identifier > 255 || identifier % 2 == 0) {
            throw new IllegalArgumentException("Presentation-context identifier must be an odd integer between 1 and 255: " + identifier);
        }
        if (abstractSyntax == null || abstractSyntax.isBlank()) {
            throw new IllegalArgumentException("Presentation-context " + identifier + " has no abstract syntax");
        }
        if (transferSyntaxes.isEmpty()) {
            throw new IllegalArgumentException("Presentation-context " + identifier + " proposes no transfer syntax");
        }
    }

    public static void validateProposal(List<PresentationContext> proposed) {
        if (proposed == null || proposed.isEmpty()) {
            throw new IllegalArgumentException("At least one presentation-context proposal is required");
        }
        Set<Integer> seen = new HashSet<>();
        for (PresentationContext context : proposed) {
            context.validate();
            if (!seen.add(context.identifier())) {
                throw new IllegalArgumentException("Duplicate presentation-context identifier " + context.identifier());
            }
        }
    }
}
