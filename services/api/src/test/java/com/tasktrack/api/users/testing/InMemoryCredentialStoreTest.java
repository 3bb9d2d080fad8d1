package com.tasktrack.api.users.testing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tasktrack.api.errors.ConflictException;
import com.tasktrack.api.users.Identity;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryCredentialStore")
class InMemoryCredentialStoreTest {

    private final InMemoryCredentialStore store = new InMemoryCredentialStore();

    @Test
    @DisplayName("normalizes email and finds by username or email")
    void normalizesAndFinds() {
        Identity alice = store.create("  A@X.com ", "alice", "hash");

        assertThat(alice.email()).isEqualTo("a@x.com");
        assertThat(store.findByUsernameOrEmail("alice")).contains(alice);
        assertThat(store.findByUsernameOrEmail("A@x.COM")).contains(alice);
        assertThat(store.findById(alice.id())).contains(alice);
        assertThat(store.findByUsernameOrEmail("Alice")).isEmpty();
    }

    @Test
    @DisplayName("resolves a key containing '@' by email only")
    void emailKeyIgnoresUsernames() {
        store.create("m@x.com", "b@x.com", "hash");
        Identity bob = store.create("b@x.com", "bob", "hash");

        assertThat(store.findByUsernameOrEmail("b@x.com")).contains(bob);
    }

    @Test
    @DisplayName("rejects duplicate email and duplicate username")
    void rejectsDuplicates() {
        store.create("a@x.com", "alice", "hash");

        assertThatThrownBy(() -> store.create("A@X.COM", "alice2", "hash"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("Email");
        assertThatThrownBy(() -> store.create("b@x.com", "alice", "hash"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("Username");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent registrations of one email produce exactly one winner")
    void concurrentRegistrations() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Identity>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String username = "user" + i;
                Callable<Identity> register = () -> {
                    start.await();
                    return store.create("same@x.com", username, "hash");
                };
                results.add(pool.submit(register));
            }
            start.countDown();

            int winners = 0;
            int conflicts = 0;
            for (Future<Identity> result : results) {
                try {
                    result.get(10, TimeUnit.SECONDS);
                    winners++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConflictException.class);
                    conflicts++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threads - 1);
            assertThat(store.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
