package it.dicom.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import it.dicom.domain.AssociationEvent;
import it.dicom.domain.AssociationState;
import it.dicom.service.AssociationStateMachine.Outcome;
import it.dicom.service.AssociationStateMachine.Transition;

class AssociationStateMachineTest {

    @Test
    void shouldDefineOutcomeForEveryStateAndEvent() {
        for (AssociationState state : AssociationState.values()) {
            for (AssociationEvent event : AssociationEvent.values()) {
                Transition transition = AssociationStateMachine.next(state, event);

                assertNotNull(transition.to(), state + " x " + event);
                if (state.isTerminal()) {
                    assertEquals(Outcome.ABSORBED, transition.outcome());
                    assertEquals(state, transition.to());
                } else if (transition.illegal()) {
                    assertEquals(AssociationState.ABORTED, transition.to());
                }
            }
        }
    }

    @Test
    void shouldFollowAcceptorHappyPath() {
        AssociationStateMachine machine = new AssociationStateMachine();

        machine.fireOrThrow(AssociationEvent.RECEIVE_ASSOCIATE_RQ);
        machine.fireOrThrow(AssociationEvent.LOCAL_ACCEPT);
        machine.fireOrThrow(AssociationEvent.RECEIVE_P_DATA);
        machine.fireOrThrow(AssociationEvent.SEND_P_DATA);
        machine.fireOrThrow(AssociationEvent.RECEIVE_RELEASE_RQ);
        machine.fireOrThrow(AssociationEvent.SEND_RELEASE_RP);

        assertEquals(AssociationState.CLOSED, machine.state());
    }

    @Test
    void shouldFollowRequestorHappyPath() {
        AssociationStateMachine machine = new AssociationStateMachine();

        machine.fireOrThrow(AssociationEvent.ISSUE_ASSOCIATE_RQ);
        assertEquals(AssociationState.REQUEST_SENT, machine.state());
        machine.fireOrThrow(AssociationEvent.RECEIVE_ASSOCIATE_AC);
        machine.fireOrThrow(AssociationEvent.ISSUE_RELEASE_RQ);
        machine.fireOrThrow(AssociationEvent.RECEIVE_P_DATA);
        machine.fireOrThrow(AssociationEvent.RECEIVE_RELEASE_RP);

        assertEquals(AssociationState.CLOSED, machine.state());
    }

    @Test
    void shouldCloseOnRejection() {
        AssociationStateMachine machine = new AssociationStateMachine();

        machine.fire(AssociationEvent.ISSUE_ASSOCIATE_RQ);
        machine.fire(AssociationEvent.RECEIVE_ASSOCIATE_RJ);

        assertEquals(AssociationState.CLOSED, machine.state());
    }

    @Test
    void shouldAbortOnPDataBeforeEstablishment() {
        AssociationStateMachine machine = new AssociationStateMachine();
        machine.fire(AssociationEvent.RECEIVE_ASSOCIATE_RQ);

        ProtocolStateException error = assertThrows(ProtocolStateException.class, () -> machine.fireOrThrow(AssociationEvent.RECEIVE_P_DATA));

        assertEquals(AssociationState.WAITING_FOR_RESPONSE, error.getState());
        assertEquals(AssociationEvent.RECEIVE_P_DATA, error.getEvent());
        assertEquals(AssociationState.ABORTED, machine.state());
    }

    @Test
    void shouldAbortFromAnyLiveStateOnTimerExpiry() {
        for (AssociationState state : AssociationState.values()) {
            if (!state.isTerminal()) {
                Transition transition = AssociationStateMachine.next(state, AssociationEvent.TIMER_EXPIRED);

                assertEquals(AssociationState.ABORTED, transition.to());
                assertFalse(transition.illegal());
            }
        }
    }

    @Test
    void shouldAbsorbEventsOnceTerminal() {
        AssociationStateMachine machine = new AssociationStateMachine();
        machine.fire(AssociationEvent.LOCAL_ABORT);

        Transition transition = machine.fire(AssociationEvent.RECEIVE_ASSOCIATE_RQ);

        assertTrue(transition.absorbed());
        assertFalse(transition.changed());
        assertEquals(AssociationState.ABORTED, machine.state());
    }

    @Test
    void shouldTreatReleaseCollisionAsLegal() {
        AssociationStateMachine machine = new AssociationStateMachine();
        machine.fire(AssociationEvent.ISSUE_ASSOCIATE_RQ);
        machine.fire(AssociationEvent.RECEIVE_ASSOCIATE_AC);
        machine.fire(AssociationEvent.ISSUE_RELEASE_RQ);

        Transition collision = machine.fireOrThrow(AssociationEvent.RECEIVE_RELEASE_RQ);

        assertEquals(AssociationState.RELEASING, collision.to());
        assertTrue(machine.isIn(AssociationState.RELEASING, AssociationState.CLOSED));
    }
}
