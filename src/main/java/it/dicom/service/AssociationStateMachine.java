package it.dicom.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import it.dicom.domain.AssociationEvent;
import it.dicom.domain.AssociationState;

public class AssociationStateMachine {

    private static final Map<AssociationState, Map<AssociationEvent, AssociationState>> ALLOWED_TRANSITIONS = new EnumMap<>(AssociationState.class);

    static {
        ALLOWED_TRANSITIONS.put(AssociationState.IDLE, transitions(
            AssociationEvent.ISSUE_ASSOCIATE_RQ, AssociationState.REQUEST_SENT,
            AssociationEvent.RECEIVE_ASSOCIATE_RQ, AssociationState.WAITING_FOR_RESPONSE
        ));
        ALLOWED_TRANSITIONS.put(AssociationState.REQUEST_SENT, transitions(
            AssociationEvent.RECEIVE_ASSOCIATE_AC, AssociationState.ESTABLISHED,
            AssociationEvent.RECEIVE_ASSOCIATE_RJ, AssociationState.CLOSED
        ));
        ALLOWED_TRANSITIONS.put(AssociationState.WAITING_FOR_RESPONSE, transitions(
            AssociationEvent.LOCAL_ACCEPT, AssociationState.ESTABLISHED,
            AssociationEvent.LOCAL_REJECT, AssociationState.CLOSED
        ));
        ALLOWED_TRANSITIONS.put(AssociationState.ESTABLISHED, transitions(
            AssociationEvent.SEND_P_DATA, AssociationState.ESTABLISHED,
            AssociationEvent.RECEIVE_P_DATA, AssociationState.ESTABLISHED,
            AssociationEvent.ISSUE_RELEASE_RQ, AssociationState.RELEASING,
            AssociationEvent.RECEIVE_RELEASE_RQ, AssociationState.RELEASING
        ));
        // RELEASE_RQ while RELEASING is a release collision; the caller answers it with an RP.
        ALLOWED_TRANSITIONS.put(AssociationState.RELEASING, transitions(
            AssociationEvent.SEND_P_DATA, AssociationState.RELEASING,
            AssociationEvent.RECEIVE_P_DATA, AssociationState.RELEASING,
            AssociationEvent.RECEIVE_RELEASE_RQ, AssociationState.RELEASING,
            AssociationEvent.RECEIVE_RELEASE_RP, AssociationState.CLOSED,
            AssociationEvent.SEND_RELEASE_RP, AssociationState.CLOSED
        ));
        ALLOWED_TRANSITIONS.put(AssociationState.CLOSED, Map.of());
        ALLOWED_TRANSITIONS.put(AssociationState.ABORTED, Map.of());
    }

    private AssociationState state = AssociationState.IDLE;

    public synchronized AssociationState state() {
        return state;
    }

    public synchronized Transition fire(AssociationEvent event) {
        Transition transition = next(state, event);
        state = transition.to();
        return transition;
    }

    public Transition fireOrThrow(AssociationEvent event) {
        Transition transition = fire(event);
        if (transition.illegal()) {
            throw new ProtocolStateException(transition.from(), event);
        }
        return transition;
    }

    public synchronized boolean isIn(AssociationState... states) {
        for (AssociationState candidate : states) {
            if (state == candidate) {
                return true;
            }
        }
        return false;
    }

    public static Transition next(AssociationState state, AssociationEvent event) {
        if (state.isTerminal()) {
            return new Transition(state, event, state, Outcome.ABSORBED);
        }
        if (isAbortEvent(event)) {
            return new Transition(state, event, AssociationState.ABORTED, Outcome.MOVED);
        }
        AssociationState target = ALLOWED_TRANSITIONS.get(state).get(event);
        if (target == null) {
            return new Transition(state, event, AssociationState.ABORTED, Outcome.ILLEGAL);
        }
        return new Transition(state, event, target, Outcome.MOVED);
    }

    public static Map<AssociationEvent, AssociationState> allowedTransitions(AssociationState state) {
        return ALLOWED_TRANSITIONS.get(state);
    }

    private static boolean isAbortEvent(AssociationEvent event) {
        return event == AssociationEvent.RECEIVE_ABORT
            || event == AssociationEvent.LOCAL_ABORT
            || event == AssociationEvent.TRANSPORT_ERROR
            || event == AssociationEvent.TIMER_EXPIRED;
    }

    private static Map<AssociationEvent, AssociationState> transitions(Object... pairs) {
        EnumMap<AssociationEvent, AssociationState> map = new EnumMap<>(AssociationEvent.class);
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((AssociationEvent) pairs[i], (AssociationState) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    public enum Outcome {
        MOVED,
        ABSORBED,
        ILLEGAL
    }

    public record Transition(AssociationState from, AssociationEvent event, AssociationState to, Outcome outcome) {

        public boolean illegal() {
            return outcome == Outcome.ILLEGAL;
        }

        public boolean absorbed() {
            return outcome == Outcome.ABSORBED;
        }

        public boolean changed() {
            return from != to;
        }
    }
}
