package it.dicom.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import it.dicom.dimse.AcceptedContext;
import it.dicom.domain.AssociateRejection;
import it.dicom.service.PduModels.AssociateAccept;
import it.dicom.service.PduModels.AssociateRequest;
import it.dicom.service.PduModels.AsyncOperationsWindow;
import it.dicom.service.PduModels.PresentationContextReply;
import it.dicom.service.PduModels.UserInformation;

@Component
public class AssociationAcceptor implements AcceptancePolicy {

    private static final Logger logger = LoggerFactory.getLogger(AssociationAcceptor.class);

    private final AssociationSettings settings;
    private final PresentationContextNegotiator negotiator;

    public AssociationAcceptor(AssociationSettings settings, PresentationContextNegotiator negotiator) {
        this.settings = settings;
        this.negotiator = negotiator;
    }

    @Override
    public Decision evaluate(AssociateRequest request) {
        if ((request.protocolVersion() & PduModels.PROTOCOL_VERSION) == 0) {
            return reject(request, AssociateRejection.protocolVersionNotSupported(), "protocol version " + request.protocolVersion());
        }
        if (!PduModels.DICOM_APPLICATION_CONTEXT.equals(request.applicationContextName())) {
            return reject(request, AssociateRejection.applicationContextNotSupported(), "application context " + request.applicationContextName());
        }
        if (!settings.isAcceptAnyCalledAeTitle() && !settings.getAeTitle().equals(request.calledAeTitle())) {
            return reject(request, AssociateRejection.calledAeTitleNotRecognized(), "called AE title " + request.calledAeTitle());
        }

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(request.presentationContexts());
        if (!result.valid()) {
            return reject(request, AssociateRejection.invalidPresentationContexts(), result.diagnostic());
        }
        if (!result.hasAcceptedContext()) {
            return reject(request, AssociateRejection.noAcceptablePresentationContext(), "no presentation context accepted");
        }

        Map<Integer, AcceptedContext> contexts = acceptedContexts(request.presentationContexts(), result.replies());
        AssociateAccept accept = new AssociateAccept(
            PduModels.PROTOCOL_VERSION,
            request.calledAeTitle(),
            request.callingAeTitle(),
            PduModels.DICOM_APPLICATION_CONTEXT,
            result.replies(),
            new UserInformation(
                settings.getMaxPduLength(),
                Optional.of(settings.getImplementationClassUid()),
                Optional.ofNullable(settings.getImplementationVersionName()),
                request.userInformation().asyncOperationsWindow().map(window -> new AsyncOperationsWindow(1, 1)),
                List.of(),
                List.of()
            )
        );
        return Decision.accept(accept, contexts);
    }

    static Map<Integer, AcceptedContext> acceptedContexts(List<PresentationContext> proposed, List<PresentationContextReply> replies) {
        Map<Integer, String> abstractSyntaxes = new LinkedHashMap<>();
        proposed.forEach(context -> abstractSyntaxes.put(context.identifier(), context.abstractSyntax()));
        Map<Integer, AcceptedContext> contexts = new LinkedHashMap<>();
        for (PresentationContextReply reply : replies) {
            if (!reply.result().isAccepted()) {
                continue;
            }
            String abstractSyntax = abstractSyntaxes.get(reply.identifier());
            if (abstractSyntax == null) {
                throw new ProtocolStateException("Accepted presentation context " + reply.identifier() + " was never proposed");
            }
            contexts.put(reply.identifier(), new AcceptedContext(reply.identifier(), abstractSyntax, reply.transferSyntax()));
        }
        return contexts;
    }

    private Decision reject(AssociateRequest request, AssociateRejection rejection, String detail) {
        logger.info("Rejecting association {} -> {}: {} ({})", request.callingAeTitle(), request.calledAeTitle(), detail, rejection.describe());
        return Decision.reject(rejection);
    }
}
