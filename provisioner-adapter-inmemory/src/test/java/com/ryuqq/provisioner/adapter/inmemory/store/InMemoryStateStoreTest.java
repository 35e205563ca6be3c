package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryStateStore 테스트.
 *
 * <p>공통 계약은 testkit의 contract 테스트가 검증하며, 여기서는 테스트 보조 기능만 다룹니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class InMemoryStateStoreTest {

    private static final Address DATASET_A = Address.parse("dss_dataset.a");

    @Test
    @DisplayName("초기 State로 생성하면 serial을 올리지 않고 그대로 로드한다")
    void initialStateIsLoadedAsIs() {
        // given
        State initial = State.empty("PROJ").withSerial(4L);

        // when
        InMemoryStateStore store = new InMemoryStateStore(initial);

        // then
        assertThat(store.load()).contains(initial);
        assertThat(store.history()).isEmpty();
        assertThat(store.backup()).isEmpty();
    }

    @Test
    @DisplayName("저장할 때마다 이전 State가 백업으로 남고 이력이 쌓인다")
    void saveKeepsBackupAndHistory() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();
        State first = store.save(State.empty("PROJ"));

        // when
        State second = store.save(first.withEntry(DATASET_A,
            StateEntry.created(Map.of("format", "csv"), Set.of(), 100, Instant.EPOCH)));

        // then
        assertThat(store.backup()).contains(first);
        assertThat(store.history()).containsExactly(first, second);
        assertThat(second.serial()).isEqualTo(first.serial() + 1);
    }

    @Test
    @DisplayName("overwrite는 save를 거치지 않으므로 serial과 이력이 바뀌지 않는다")
    void overwriteBypassesSave() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();
        State replacement = State.empty("OTHER");

        // when
        store.overwrite(replacement);

        // then
        assertThat(store.load()).contains(replacement);
        assertThat(store.history()).isEmpty();
    }

    @Test
    @DisplayName("clear 이후에는 저장된 State가 없다")
    void clearRemovesEverything() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();
        store.save(State.empty("PROJ"));
        store.save(State.empty("PROJ"));

        // when
        store.clear();

        // then
        assertThat(store.exists()).isFalse();
        assertThat(store.backup()).isEmpty();
        assertThat(store.history()).isEmpty();
    }

    @Test
    @DisplayName("잠금은 재진입할 수 없고, 해제 후에는 다시 잡을 수 있다")
    void lockIsNotReentrant() {
        // given
        InMemoryStateStore store = new InMemoryStateStore();

        // when & then
        store.withLock(() -> {
            assertThat(store.isLocked()).isTrue();
            assertThatThrownBy(() -> store.withLock(() -> "nested"))
                .isInstanceOf(StateLockException.class)
                .hasMessageContaining(Thread.currentThread().getName());
            return null;
        });
        assertThat(store.isLocked()).isFalse();
        assertThat(store.withLock(() -> "again")).isEqualTo("again");
    }
}
