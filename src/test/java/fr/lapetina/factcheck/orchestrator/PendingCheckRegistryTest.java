package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.queue.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingCheckRegistryTest {

    private final PendingCheckRegistry registry = new PendingCheckRegistry(10);

    @Nested
    @DisplayName("fingerprint")
    class Fingerprint {

        @Test
        @DisplayName("should match texts sharing the same prefix")
        void shouldIgnoreTextPastPrefix() {
            assertThat(registry.fingerprint("0123456789 tail one"))
                    .isEqualTo(registry.fingerprint("0123456789 tail two"))
                    .hasSize(64);
        }

        @Test
        @DisplayName("should differ when the prefix differs")
        void shouldDifferOnPrefix() {
            assertThat(registry.fingerprint("short a")).isNotEqualTo(registry.fingerprint("short b"));
        }

        @Test
        @DisplayName("should reject a prefix length below one")
        void shouldRejectInvalidPrefix() {
            assertThatThrownBy(() -> new PendingCheckRegistry(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("shared execution")
    class SharedExecution {

        @Test
        @DisplayName("should make the first caller owner and share its entry with later callers")
        void shouldShareEntry() {
            PendingCheckRegistry.Registration first = registry.register("fp", CancellationToken.create());
            PendingCheckRegistry.Registration second = registry.register("fp", CancellationToken.create());

            assertThat(first.owner()).isTrue();
            assertThat(second.owner()).isFalse();
            assertThat(second.entry()).isSameAs(first.entry());
            assertThat(first.entry().activeParticipants()).isEqualTo(2);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should cancel the shared token only after every participant cancels")
        void shouldCancelWhenAllLeave() {
            CancellationToken owner = CancellationToken.create();
            CancellationToken joiner = CancellationToken.create();
            PendingCheckRegistry.Entry entry = registry.register("fp", owner).entry();
            registry.register("fp", joiner);

            owner.cancel();
            assertThat(entry.token().isCancelled()).isFalse();
            assertThat(entry.activeParticipants()).isEqualTo(1);

            joiner.cancel();
            assertThat(entry.token().isCancelled()).isTrue();
        }

        @Test
        @DisplayName("should never cancel while a participant holds an uncancellable token")
        void shouldKeepRunningForUncancellableParticipant() {
            CancellationToken owner = CancellationToken.create();
            PendingCheckRegistry.Entry entry = registry.register("fp", owner).entry();
            registry.register("fp", CancellationToken.none());

            owner.cancel();

            assertThat(entry.token().isCancelled()).isFalse();
        }

        @Test
        @DisplayName("should start a new entry once the settled one is removed")
        void shouldStartFreshAfterRemove() {
            PendingCheckRegistry.Entry settled = registry.register("fp", CancellationToken.create()).entry();
            registry.remove("fp", settled);

            PendingCheckRegistry.Registration next = registry.register("fp", CancellationToken.create());

            assertThat(next.owner()).isTrue();
            assertThat(next.entry()).isNotSameAs(settled);
        }

        @Test
        @DisplayName("should leave a newer entry alone when removing a stale one")
        void shouldNotRemoveNewerEntry() {
            PendingCheckRegistry.Entry stale = registry.register("fp", CancellationToken.create()).entry();
            registry.remove("fp", stale);
            PendingCheckRegistry.Entry current = registry.register("fp", CancellationToken.create()).entry();

            registry.remove("fp", stale);

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.register("fp", CancellationToken.create()).entry()).isSameAs(current);
        }
    }
}
