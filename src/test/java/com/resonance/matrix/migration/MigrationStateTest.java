package com.resonance.matrix.migration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MigrationState Tests")
class MigrationStateTest {

    @Test
    @DisplayName("Happy path should move through every stage")
    void happyPath() {
        MigrationState state = MigrationState.IDLE
                .transitionTo(MigrationState.LOADING)
                .transitionTo(MigrationState.PROCESSING)
                .transitionTo(MigrationState.CHECKPOINTING)
                .transitionTo(MigrationState.PROCESSING)
                .transitionTo(MigrationState.COMPLETED);

        assertTrue(state.isTerminal());
    }

    @Test
    @DisplayName("Illegal transitions should throw")
    void illegalTransitions() {
        assertThrows(IllegalStateException.class, () -> MigrationState.IDLE.transitionTo(MigrationState.PROCESSING));
        assertThrows(IllegalStateException.class, () -> MigrationState.COMPLETED.transitionTo(MigrationState.LOADING));
        assertThrows(IllegalStateException.class, () -> MigrationState.ABORTED.transitionTo(MigrationState.PROCESSING));
    }

    @Test
    @DisplayName("Every active state should be able to abort")
    void abortFromActiveStates() {
        assertEquals(MigrationState.ABORTED, MigrationState.LOADING.transitionTo(MigrationState.ABORTED));
        assertEquals(MigrationState.ABORTED, MigrationState.PROCESSING.transitionTo(MigrationState.ABORTED));
        assertEquals(MigrationState.ABORTED, MigrationState.CHECKPOINTING.transitionTo(MigrationState.ABORTED));
        assertFalse(MigrationState.PROCESSING.isTerminal());
    }
}
