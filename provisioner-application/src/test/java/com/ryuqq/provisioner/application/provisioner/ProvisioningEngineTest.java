package com.ryuqq.provisioner.application.provisioner;

import com.ryuqq.provisioner.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.provisioner.application.drift.DriftReport;
import com.ryuqq.provisioner.application.planner.PlanOptions;
import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.error.DuplicateAddressException;
import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.error.StateProjectMismatchException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.ApplyResult;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.spi.ResourceHandler;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistration;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ProvisioningEngine 유닛 테스트.
 *
 * <p>잠금 범위와 refresh 저장 규칙을 검증합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ProvisioningEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
    private static final Address DATASET_A = Address.parse("dss_dataset.a");

    @Mock
    private ResourceHandler handler;

    private ProvisioningEngine engine(InMemoryStateStore store, EngineConfig config) {
        ResourceTypeRegistry registry = new ResourceTypeRegistry()
            .register(ResourceTypeRegistration.of("dss_dataset", handler));
        return new ProvisioningEngine(store, registry, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ProvisioningEngine engine(InMemoryStateStore store) {
        return engine(store, new EngineConfig("PROJ"));
    }

    private static Resource dataset(String format) {
        return Resource.of(DATASET_A, Map.of("format", format));
    }

    private static State trackedCsv() {
        return State.empty("PROJ").withEntry(DATASET_A,
            StateEntry.created(Map.of("format", "csv"), Set.of(), 100, NOW));
    }

    private static Optional<Map<String, Object>> observed(Map<String, Object> attributes) {
        return Optional.of(attributes);
    }

    @Test
    void refresh_없는_plan은_잠금_없이_동작하고_refresh_plan은_잠금을_요구() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();
        ProvisioningEngine engine = engine(store);

        // when & then
        store.withLock(() -> {
            Plan plan = engine.plan(List.of(dataset("csv")), new PlanOptions(false, false));
            assertThat(plan.changes()).hasSize(1);
            assertThatThrownBy(() -> engine.plan(List.of(dataset("csv")), new PlanOptions()))
                .isInstanceOf(StateLockException.class);
            return null;
        });
    }

    @Test
    void plan_중_refresh가_drift를_저장하고_그_State를_기준으로_계획() {
        // given
        InMemoryStateStore store = new InMemoryStateStore(trackedCsv());
        when(handler.read(any(), eq(DATASET_A))).thenReturn(observed(Map.of("format", "parquet")));

        // when
        Plan plan = engine(store).plan(List.of(dataset("csv")), new PlanOptions());

        // then
        assertThat(store.history()).hasSize(1);
        assertThat(store.load().orElseThrow().entry(DATASET_A).orElseThrow().attributes())
            .containsEntry("format", "parquet");
        assertThat(plan.metadata().refresh()).isTrue();
        assertThat(plan.metadata().stateSerial()).isEqualTo(1L);
        assertThat(plan.metadata().stateDigest()).isEqualTo(store.load().orElseThrow().digest());
        assertThat(plan.changeFor(DATASET_A).orElseThrow().action()).isEqualTo(Action.UPDATE);
    }

    @Test
    void 계획이_검증에_실패하면_refresh로_관측한_drift를_저장하지_않음() {
        // given
        State tracked = trackedCsv();
        InMemoryStateStore store = new InMemoryStateStore(tracked);
        when(handler.read(any(), eq(DATASET_A))).thenReturn(observed(Map.of("format", "parquet")));
        List<Resource> duplicated = List.of(dataset("csv"), dataset("json"));

        // when & then
        assertThatThrownBy(() -> engine(store).plan(duplicated, new PlanOptions()))
            .isInstanceOf(DuplicateAddressException.class);
        assertThat(store.history()).isEmpty();
        assertThat(store.load().orElseThrow()).isEqualTo(tracked);
        assertThat(store.isLocked()).isFalse();
    }

    @Test
    void drift가_없으면_refresh는_저장하지_않음() {
        // given
        InMemoryStateStore store = new InMemoryStateStore(trackedCsv());
        when(handler.read(any(), eq(DATASET_A))).thenReturn(observed(Map.of("format", "csv")));

        // when
        State refreshed = engine(store).refresh();

        // then
        assertThat(refreshed).isEqualTo(store.load().orElseThrow());
        assertThat(refreshed.serial()).isZero();
        assertThat(store.history()).isEmpty();
    }

    @Test
    void drift_조회는_State를_저장하지_않음() {
        // given
        InMemoryStateStore store = new InMemoryStateStore(trackedCsv());
        when(handler.read(any(), eq(DATASET_A))).thenReturn(Optional.empty());

        // when
        DriftReport report = engine(store).drift();

        // then
        assertThat(report.deleted()).containsExactly(DATASET_A);
        assertThat(store.history()).isEmpty();
        assertThat(store.load().orElseThrow().contains(DATASET_A)).isTrue();
    }

    @Test
    void 옵션이_없으면_설정의_refresh_기본값을_따름() {
        // given
        InMemoryStateStore store = new InMemoryStateStore(trackedCsv());
        ProvisioningEngine engine = engine(store, new EngineConfig("PROJ").withRefresh(false));

        // when
        Plan plan = engine.plan(List.of(dataset("csv")), null);

        // then
        assertThat(plan.metadata().refresh()).isFalse();
        verify(handler, never()).read(any(), any());
    }

    @Test
    void ResourceProvider로_계획() {
        // when
        Plan plan = engine(new InMemoryStateStore()).plan(() -> List.of(dataset("csv")), new PlanOptions(false, false));

        // then
        assertThat(plan.changeFor(DATASET_A).orElseThrow().action()).isEqualTo(Action.CREATE);
    }

    @Test
    void planAndApply는_계획_후_바로_적용하고_잠금을_해제() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();
        when(handler.create(any(), eq(DATASET_A), any())).thenAnswer(invocation -> invocation.getArgument(2));

        // when
        ApplyResult result = engine(store).planAndApply(List.of(dataset("csv")), new PlanOptions(), null, null);

        // then
        assertThat(result.completedAddresses()).containsExactly(DATASET_A);
        assertThat(store.load().orElseThrow().contains(DATASET_A)).isTrue();
        assertThat(store.isLocked()).isFalse();
    }

    @Test
    void 다른_프로젝트의_State는_조회부터_거부() {
        // given
        InMemoryStateStore store = new InMemoryStateStore(State.empty("OTHER"));

        // when & then
        assertThatThrownBy(() -> engine(store).state())
            .isInstanceOf(StateProjectMismatchException.class);
    }
}
