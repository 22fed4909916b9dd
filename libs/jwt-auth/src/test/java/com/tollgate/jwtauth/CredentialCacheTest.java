package com.tollgate.jwtauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CredentialCache")
class CredentialCacheTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final UserProfile ALICE = new UserProfile("alice", "alice", "JWT");
    private static final UserProfile BOB = new UserProfile("bob", "bob", "JWT");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
    }

    /** Behaviour shared by every implementation. */
    abstract class Contract {

        abstract CredentialCache newCache();

        @Test
        @DisplayName("returns empty for an unknown token")
        void miss() {
            assertThat(newCache().lookup("a.b.c")).isEmpty();
        }

        @Test
        @DisplayName("stores the profile with the current time")
        void storeStampsCreatedAt() {
            CredentialCache cache = newCache();

            cache.store("a.b.c", ALICE);

            assertThat(cache.lookup("a.b.c")).contains(new CachedCredential(ALICE, T0));
        }

        @Test
        @DisplayName("overwrites the entry and its timestamp")
        void overwrite() {
            CredentialCache cache = newCache();
            cache.store("a.b.c", ALICE);
            clock.advance(Duration.ofSeconds(10));

            cache.store("a.b.c", BOB);

            assertThat(cache.lookup("a.b.c")).contains(new CachedCredential(BOB, T0.plusSeconds(10)));
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("keys are case-sensitive")
        void caseSensitiveKeys() {
            CredentialCache cache = newCache();
            cache.store("a.b.c", ALICE);

            assertThat(cache.lookup("A.B.C")).isEmpty();
        }

        @Test
        @DisplayName("keeps entries regardless of age")
        void noTimeExpiry() {
            CredentialCache cache = newCache();
            cache.store("a.b.c", ALICE);
            clock.advance(Duration.ofDays(3650));

            assertThat(cache.lookup("a.b.c")).isPresent();
        }

        @Test
        @DisplayName("concurrent stores for one token leave a single entry")
        void concurrentStores() {
            CredentialCache cache = newCache();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<CompletableFuture<Void>> futures = new ArrayList<>();
                for (int i = 0; i < 100; i++) {
                    UserProfile profile = i % 2 == 0 ? ALICE : BOB;
                    futures.add(CompletableFuture.runAsync(() -> cache.store("same", profile), executor));
                }
                CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
            } finally {
                executor.shutdownNow();
            }

            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.lookup("same").orElseThrow().profile()).isIn(ALICE, BOB);
        }
    }

    @Nested
    @DisplayName("ConcurrentMapCredentialCache")
    class ConcurrentMapBacked extends Contract {

        @Override
        CredentialCache newCache() {
            return new ConcurrentMapCredentialCache(clock);
        }
    }

    @Nested
    @DisplayName("CaffeineCredentialCache")
    class CaffeineBacked extends Contract {

        @Override
        CredentialCache newCache() {
            return new CaffeineCredentialCache(1_000, clock);
        }

        @Test
        @DisplayName("evicts beyond its maximum size")
        void boundedBySize() {
            var cache = new CaffeineCredentialCache(10, clock);
            for (int i = 0; i < 100; i++) {
                cache.store("token-" + i, ALICE);
            }
            cache.cleanUp();

            assertThat(cache.size()).isLessThanOrEqualTo(10);
        }

        @Test
        @DisplayName("rejects a non-positive maximum size")
        void invalidSize() {
            assertThatThrownBy(() -> new CaffeineCredentialCache(0, clock))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maximumSize");
        }
    }

    @Nested
    @DisplayName("CachedCredential.isFresh()")
    class Freshness {

        private final CachedCredential entry = new CachedCredential(ALICE, T0);

        @Test
        @DisplayName("is always fresh without a TTL")
        void noTtl() {
            assertThat(entry.isFresh(T0.plus(Duration.ofDays(10_000)), null)).isTrue();
        }

        @Test
        @DisplayName("is fresh strictly before createdAt + ttl")
        void boundary() {
            Duration ttl = Duration.ofSeconds(5);
            assertThat(entry.isFresh(T0.plusSeconds(4), ttl)).isTrue();
            assertThat(entry.isFresh(T0.plusMillis(4_999), ttl)).isTrue();
            assertThat(entry.isFresh(T0.plusSeconds(5), ttl)).isFalse();
            assertThat(entry.isFresh(T0.plusSeconds(6), ttl)).isFalse();
        }
    }
}
