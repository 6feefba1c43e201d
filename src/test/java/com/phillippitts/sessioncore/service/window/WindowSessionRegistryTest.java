package com.phillippitts.sessioncore.service.window;

import com.phillippitts.sessioncore.domain.SessionWindow;
import com.phillippitts.sessioncore.service.window.event.DetachedSessionsChangedEvent;
import com.phillippitts.sessioncore.testutil.EventCapturingPublisher;
import com.phillippitts.sessioncore.testutil.FakeSessionWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WindowSessionRegistryTest {

    private EventCapturingPublisher publisher;
    private WindowSessionRegistry registry;

    private final FakeSessionWindow main = new FakeSessionWindow("main");
    private final FakeSessionWindow second = new FakeSessionWindow("second");
    private final UUID session = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        registry = new WindowSessionRegistry(publisher);
        registry.setMainWindow(main);
    }

    @Test
    void conflictingClaimIsRedirectedToHolder() {
        assertThat(registry.claim(session, second).isClaimed()).isTrue();

        ClaimResult result = registry.claim(session, main);

        assertThat(result.status()).isEqualTo(ClaimResult.Status.REDIRECTED);
        assertThat(result.holder()).isSameAs(second);
        assertThat(registry.windowFor(session)).containsSame(second);
        assertThat(registry.isDetached(session)).isTrue();
    }

    @Test
    void reclaimBySameWindowIsIdempotent() {
        registry.claim(session, main);
        publisher.clear();

        assertThat(registry.claim(session, main).isClaimed()).isTrue();

        assertThat(registry.claimedSessions()).containsExactly(session);
        assertThat(publisher.count()).isZero();
    }

    @Test
    void trySelectBringsHolderForward() {
        registry.claim(session, second);

        assertThat(registry.trySelect(session, main)).isFalse();
        assertThat(second.timesBroughtToFront()).isEqualTo(1);

        assertThat(registry.trySelect(UUID.randomUUID(), main)).isTrue();
        assertThat(main.timesBroughtToFront()).isZero();
    }

    @Test
    void sessionInMainWindowIsNotDetached() {
        registry.claim(session, main);

        assertThat(registry.isDetached(session)).isFalse();
        assertThat(registry.detachedSessions()).isEmpty();
        assertThat(registry.isDetached(UUID.randomUUID())).isFalse();
    }

    @Test
    void releaseFreesSessionForOtherWindows() {
        registry.claim(session, second);

        registry.release(session);

        assertThat(registry.isClaimed(session)).isFalse();
        assertThat(registry.claim(session, main).isClaimed()).isTrue();
    }

    @Test
    void closingWindowReleasesAllItsClaims() {
        UUID other = UUID.randomUUID();
        UUID kept = UUID.randomUUID();
        registry.claim(session, second);
        registry.claim(other, second);
        registry.claim(kept, main);

        List<UUID> released = registry.releaseAll(second);

        assertThat(released).containsExactlyInAnyOrder(session, other);
        assertThat(registry.claimedSessions()).containsExactly(kept);
        assertThat(registry.detachedSessions()).isEmpty();
    }

    @Test
    void closingMainWindowClearsDesignation() {
        registry.claim(session, second);
        registry.releaseAll(main);

        assertThat(registry.mainWindow()).isEmpty();
        // With no main window every claimed session counts as detached
        assertThat(registry.isDetached(session)).isTrue();
    }

    @Test
    void firstClaimingWindowBecomesMainWhenNoneDesignated() {
        WindowSessionRegistry fresh = new WindowSessionRegistry(publisher);

        fresh.claim(session, second);

        assertThat(fresh.mainWindow()).containsSame(second);
        assertThat(fresh.isDetached(session)).isFalse();
    }

    @Test
    void publishesDetachedSetOnlyWhenItChanges() {
        registry.claim(session, main);
        assertThat(publisher.count()).isZero();

        registry.claim(UUID.randomUUID(), second);
        registry.release(UUID.randomUUID());

        List<DetachedSessionsChangedEvent> events = publisher.eventsOf(DetachedSessionsChangedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).detachedSessions()).hasSize(1);
    }

    @Test
    void changingMainWindowRecomputesDetached() {
        registry.claim(session, second);

        registry.setMainWindow(second);

        assertThat(registry.isDetached(session)).isFalse();
        assertThat(publisher.eventsOf(DetachedSessionsChangedEvent.class))
                .extracting(DetachedSessionsChangedEvent::detachedSessions)
                .containsExactly(Set.of(session), Set.of());
    }

    @Test
    void claimsSnapshotListsHolders() {
        registry.claim(session, second);

        assertThat(registry.claims()).singleElement().satisfies(c -> {
            assertThat(c.sessionId()).isEqualTo(session);
            assertThat(c.window()).isSameAs(second);
        });
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        int windows = 8;
        ExecutorService pool = Executors.newFixedThreadPool(windows);
        try {
            for (int round = 0; round < 100; round++) {
                UUID contested = UUID.randomUUID();
                CountDownLatch start = new CountDownLatch(1);
                List<SessionWindow> claimers = new ArrayList<>();
                List<Future<ClaimResult>> results = new ArrayList<>();
                for (int w = 0; w < windows; w++) {
                    SessionWindow window = new FakeSessionWindow("w" + w);
                    claimers.add(window);
                    results.add(pool.submit(() -> {
                        start.await();
                        return registry.claim(contested, window);
                    }));
                }
                start.countDown();

                List<ClaimResult> outcomes = new ArrayList<>();
                for (Future<ClaimResult> f : results) {
                    outcomes.add(f.get(5, TimeUnit.SECONDS));
                }
                SessionWindow holder = registry.windowFor(contested).orElseThrow();
                int winners = 0;
                for (ClaimResult r : outcomes) {
                    if (r.isClaimed()) {
                        winners++;
                    }
                    assertThat(r.holder()).isSameAs(holder);
                }
                assertThat(winners).isEqualTo(1);
                assertThat(claimers).contains(holder);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void lastDeliveredDetachedSetMatchesStateWhenPublishersOverlap() throws Exception {
        List<Set<UUID>> delivered = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch claimerPublishing = new CountDownLatch(1);
        CountDownLatch releaseClaimer = new CountDownLatch(1);
        WindowSessionRegistry overlapping = new WindowSessionRegistry(event -> {
            if (Thread.currentThread().getName().equals("claimer")) {
                claimerPublishing.countDown();
                awaitQuietly(releaseClaimer);
            }
            delivered.add(((DetachedSessionsChangedEvent) event).detachedSessions());
        });
        overlapping.setMainWindow(main);

        Thread claimer = new Thread(() -> overlapping.claim(session, second), "claimer");
        claimer.start();
        assertThat(claimerPublishing.await(5, TimeUnit.SECONDS)).isTrue();

        Thread releaser = new Thread(() -> overlapping.release(session), "releaser");
        releaser.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> !overlapping.isClaimed(session));
        releaseClaimer.countDown();
        claimer.join(5_000);
        releaser.join(5_000);

        assertThat(overlapping.detachedSessions()).isEmpty();
        assertThat(delivered).isNotEmpty();
        assertThat(delivered.get(delivered.size() - 1)).isEqualTo(overlapping.detachedSessions());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
