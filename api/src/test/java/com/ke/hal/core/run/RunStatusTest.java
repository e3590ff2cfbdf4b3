package com.ke.hal.core.run;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunStatusTest {

    @Test
    @DisplayName("终止状态不可再转换")
    void terminalStatusesAreFinal() {
        for (RunStatus terminal : new RunStatus[] { RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.CANCELLED, RunStatus.EXPIRED }) {
            assertTrue(terminal.isTerminal());
            for (RunStatus target : RunStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void queuedTransitions() {
        assertTrue(RunStatus.QUEUED.canTransitionTo(RunStatus.IN_PROGRESS));
        assertTrue(RunStatus.QUEUED.canTransitionTo(RunStatus.CANCELLING));
        assertTrue(RunStatus.QUEUED.canTransitionTo(RunStatus.EXPIRED));
        assertFalse(RunStatus.QUEUED.canTransitionTo(RunStatus.COMPLETED));
        assertFalse(RunStatus.QUEUED.canTransitionTo(RunStatus.REQUIRES_ACTION));
    }

    @Test
    void inProgressTransitions() {
        assertTrue(RunStatus.IN_PROGRESS.canTransitionTo(RunStatus.IN_PROGRESS));
        assertTrue(RunStatus.IN_PROGRESS.canTransitionTo(RunStatus.REQUIRES_ACTION));
        assertTrue(RunStatus.IN_PROGRESS.canTransitionTo(RunStatus.COMPLETED));
        assertTrue(RunStatus.IN_PROGRESS.canTransitionTo(RunStatus.FAILED));
        assertFalse(RunStatus.IN_PROGRESS.canTransitionTo(RunStatus.QUEUED));
    }

    @Test
    @DisplayName("等待提交的 run 只能回到队列或结束")
    void requiresActionTransitions() {
        assertTrue(RunStatus.REQUIRES_ACTION.canTransitionTo(RunStatus.QUEUED));
        assertTrue(RunStatus.REQUIRES_ACTION.canTransitionTo(RunStatus.EXPIRED));
        assertFalse(RunStatus.REQUIRES_ACTION.canTransitionTo(RunStatus.IN_PROGRESS));
        assertFalse(RunStatus.REQUIRES_ACTION.canTransitionTo(RunStatus.COMPLETED));
    }

    @Test
    void cancellingOnlyEnds() {
        assertTrue(RunStatus.CANCELLING.canTransitionTo(RunStatus.CANCELLED));
        assertFalse(RunStatus.CANCELLING.canTransitionTo(RunStatus.IN_PROGRESS));
        assertFalse(RunStatus.CANCELLING.canTransitionTo(RunStatus.COMPLETED));
    }

    @Test
    void fromValue() {
        assertEquals(RunStatus.REQUIRES_ACTION, RunStatus.fromValue("requires_action"));
        assertThrows(IllegalArgumentException.class, () -> RunStatus.fromValue("running"));
        assertEquals(4, RunStatus.nonTerminalValues().size());
    }
}
