package it.dicom.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.dicom.domain.PresentationContextResult;
import it.dicom.registry.DicomUid;
import it.dicom.registry.DicomUidType;
import it.dicom.registry.UidRegistry;
import it.dicom.service.PduModels.PresentationContextReply;

public class PresentationContextNegotiator {

    private static final Logger logger = LoggerFactory.getLogger(PresentationContextNegotiator.class);

    private final UidRegistry registry;
    private final TransferSyntaxPolicy policy;

    public PresentationContextNegotiator(UidRegistry registry, TransferSyntaxPolicy policy) {
        this.registry = registry;
        this.policy = policy;
    }

    public NegotiationResult negotiate(List<PresentationContext> proposed) {
        try {
            PresentationContext.validateProposal(proposed);
        } catch (IllegalArgumentException ex) {
            logger.warn("Malformed presentation-context proposal: {}", ex.getMessage());
            return NegotiationResult.invalid(ex.getMessage());
        }

        List<PresentationContextReply> replies = new ArrayList<>(proposed.size());
        for (PresentationContext context : proposed) {
            PresentationContextReply reply = decide(context);
            logger.debug("Presentation-context {} {} -> {} {}", context.identifier(), registry.lookup(context.abstractSyntax()),
                reply.result(), reply.transferSyntax());
            replies.add(reply);
        }
        return NegotiationResult.of(replies);
    }

    private PresentationContextReply decide(PresentationContext context) {
        if (!UidRegistry.isValid(context.abstractSyntax())) {
            return PresentationContextReply.rejected(context.identifier(), PresentationContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED);
        }
        Optional<List<String>> supported = policy.transferSyntaxesFor(context.abstractSyntax());
        if (supported.isEmpty()) {
            return PresentationContextReply.rejected(context.identifier(), PresentationContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED);
        }
        for (String transferSyntax : context.transferSyntaxes()) {
            if (supported.get().contains(transferSyntax) && isUsableTransferSyntax(transferSyntax)) {
                return PresentationContextReply.accepted(context.identifier(), transferSyntax);
            }
        }
        return PresentationContextReply.rejected(context.identifier(), PresentationContextResult.TRANSFER_SYNTAXES_NOT_SUPPORTED);
    }

    private boolean isUsableTransferSyntax(String transferSyntax) {
        DicomUid descriptor = registry.lookup(transferSyntax);
        return descriptor.type() == DicomUidType.TRANSFER_SYNTAX || descriptor.type() == DicomUidType.UNKNOWN;
    }

    public record NegotiationResult(boolean valid, String diagnostic, List<PresentationContextReply> replies) {

        public NegotiationResult {
            replies = List.copyOf(replies);
        }

        static NegotiationResult of(List<PresentationContextReply> replies) {
            return new NegotiationResult(true, "", replies);
        }

        static NegotiationResult invalid(String diagnostic) {
            return new NegotiationResult(false, diagnostic, List.of());
        }

        public boolean hasAcceptedContext() {
            return replies.stream().anyMatch(reply -> reply.result().isAccepted());
        }
    }
}
