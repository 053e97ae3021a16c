package io.plinth.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.plinth.core.exception.NotFoundException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.Test;

class InstanceLocksTest {

    private final InstanceLocks locks = new InstanceLocks(List.of("web_2", "db_1", "web_1"));

    @Test
    void shouldHandOutOneLockPerInstance() {
        assertThat(locks.lockFor("web_1")).isSameAs(locks.lockFor("web_1"));
        assertThat(locks.lockFor("web_1")).isNotSameAs(locks.lockFor("web_2"));
    }

    @Test
    void shouldAllowReentrantAcquisition() {
        // Given
        ReentrantLock lock = locks.lockFor("db_1");
        lock.lock();
        try {
            // When
            boolean reacquired = lock.tryLock();

            // Then
            assertThat(reacquired).isTrue();
            assertThat(lock.getHoldCount()).isEqualTo(2);
            lock.unlock();
        } finally {
            lock.unlock();
        }
        assertThat(lock.isLocked()).isFalse();
    }

    @Test
    void shouldListIdsInAscendingOrder() {
        assertThat(locks.ids()).containsExactly("db_1", "web_1", "web_2");
        assertThat(locks.contains("db_1")).isTrue();
        assertThat(locks.contains("db_2")).isFalse();
    }

    @Test
    void shouldFailForUnknownId() {
        assertThatThrownBy(() -> locks.lockFor("db_2"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("db_2");
    }
}
