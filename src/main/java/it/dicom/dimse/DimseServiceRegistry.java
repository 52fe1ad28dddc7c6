package it.dicom.dimse;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import it.dicom.domain.InvokedService;

@Component
public class DimseServiceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DimseServiceRegistry.class);

    private final Map<InvokedService, DimseServiceHandler> handlers;

    @Autowired
    public DimseServiceRegistry(List<DimseServiceProvider> providers) {
        this(bindAll(providers));
    }

    private DimseServiceRegistry(EnumMap<InvokedService, DimseServiceHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
        logger.info("DIMSE services registered: {}", this.handlers.keySet());
    }

    public static DimseServiceRegistry of(DimseServiceProvider... providers) {
        return new DimseServiceRegistry(List.of(providers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DimseServiceHandler> handlerFor(InvokedService service) {
        return Optional.ofNullable(handlers.get(service));
    }

    public Set<InvokedService> services() {
        return handlers.keySet();
    }

    private static EnumMap<InvokedService, DimseServiceHandler> bindAll(List<DimseServiceProvider> providers) {
        EnumMap<InvokedService, DimseServiceHandler> handlers = new EnumMap<>(InvokedService.class);
        for (DimseServiceProvider provider : providers) {
            for (InvokedService service : provider.services()) {
                DimseServiceHandler previous = handlers.putIfAbsent(service, bind(provider, service));
                if (previous != null) {
                    throw new IllegalStateException("More than one provider registered for " + service);
                }
            }
        }
        return handlers;
    }

    static DimseServiceHandler bind(DimseServiceProvider provider, InvokedService service) {
        return switch (service) {
            case C_ECHO -> provider::onCEcho;
            case C_FIND -> provider::onCFind;
            case C_STORE -> provider::onCStore;
            case C_GET -> provider::onCGet;
            case C_MOVE -> provider::onCMove;
            case N_EVENT_REPORT -> provider::onNEventReport;
            case N_GET -> provider::onNGet;
            case N_SET -> provider::onNSet;
            case N_ACTION -> provider::onNAction;
            case N_CREATE -> provider::onNCreate;
            case N_DELETE -> provider::onNDelete;
        };
    }

    public static final class Builder {

        private final EnumMap<InvokedService, DimseServiceHandler> handlers = new EnumMap<>(InvokedService.class);

        private Builder() {
        }

        public Builder handler(InvokedService service, DimseServiceHandler handler) {
            if (handlers.putIfAbsent(service, handler) != null) {
                throw new IllegalStateException("More than one handler registered for " + service);
            }
            return this;
        }

        public Builder provider(DimseServiceProvider provider) {
            provider.services().forEach(service -> handler(service, bind(provider, service)));
            return this;
        }

        public DimseServiceRegistry build() {
            return new DimseServiceRegistry(new EnumMap<InvokedService, DimseServiceHandler>(handlers));
        }
    }
}
