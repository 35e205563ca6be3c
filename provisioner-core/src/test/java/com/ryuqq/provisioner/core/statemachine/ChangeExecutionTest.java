package com.ryuqq.provisioner.core.statemachine;

import com.ryuqq.provisioner.core.executor.ApplyPhase;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.provisioner.core.statemachine.ChangeState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ChangeExecution 테스트.
 *
 * <ul>
 *   <li>PENDING → APPLYING → APPLIED / FAILED 정상 전이와 진행 알림</li>
 *   <li>종료 상태에서의 전이는 IllegalStateException</li>
 *   <li>단계를 건너뛰는 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class ChangeExecutionTest {

    private final List<ApplyPhase> phases = new ArrayList<>();
    private final ProgressListener recorder = (change, phase) -> phases.add(phase);

    private static ResourceChange createChange() {
        return ResourceChange.create(Resource.of("dss_dataset", "a", Map.of("format", "csv")), Set.of());
    }

    // ========== 정상 전이 테스트 ==========

    @Test
    void complete_AfterStart_ReachesAppliedAndAnnouncesStartThenDone() {
        // Given
        ChangeExecution execution = new ChangeExecution(createChange(), recorder);
        assertEquals(PENDING, execution.state());

        // When
        execution.start();
        execution.complete();

        // Then
        assertEquals(APPLIED, execution.state());
        assertTrue(execution.state().isTerminal());
        assertEquals(List.of(ApplyPhase.START, ApplyPhase.DONE), phases);
    }

    @Test
    void fail_AfterStart_ReachesFailedAndAnnouncesFailed() {
        // Given
        ChangeExecution execution = new ChangeExecution(createChange(), recorder);
        execution.start();

        // When
        execution.fail();

        // Then
        assertEquals(FAILED, execution.state());
        assertEquals(List.of(ApplyPhase.START, ApplyPhase.FAILED), phases);
    }

    // ========== 잘못된 전이 테스트 ==========

    @Test
    void complete_WithoutStart_ThrowsAndAnnouncesNothing() {
        // Given
        ChangeExecution execution = new ChangeExecution(createChange(), recorder);

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class, execution::complete);

        // Then
        assertTrue(exception.getMessage().contains("Invalid transition for dss_dataset.a"));
        assertEquals(PENDING, execution.state());
        assertTrue(phases.isEmpty());
    }

    @Test
    void complete_AfterFail_ThrowsFromTerminalState() {
        // Given
        ChangeExecution execution = new ChangeExecution(createChange(), recorder);
        execution.start();
        execution.fail();

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class, execution::complete);

        // Then
        assertTrue(exception.getMessage().contains("terminal state"));
        assertEquals(FAILED, execution.state());
        assertThrows(IllegalStateException.class, execution::start);
    }

    @Test
    void constructor_Null_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new ChangeExecution(null, recorder));
        assertThrows(IllegalArgumentException.class, () -> new ChangeExecution(createChange(), null));
    }

    @Test
    void isTerminal_OnlyAppliedAndFailed() {
        assertFalse(PENDING.isTerminal());
        assertFalse(APPLYING.isTerminal());
        assertTrue(APPLIED.isTerminal());
        assertTrue(FAILED.isTerminal());
    }
}
