package com.gt.linker.reconcile;

import com.gt.linker.exception.RemoteRejectedException;
import com.gt.linker.exception.RemoteUnreachableException;
import com.gt.linker.identity.IdentityResolver;
import com.gt.linker.knowledgePoint.KeyedMutationQueue;
import com.gt.linker.local.LocalKnowledgePointService;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.Origin;
import com.gt.linker.reconcile.model.ConflictReason;
import com.gt.linker.reconcile.model.ReconciliationResult;
import com.gt.linker.reconcile.model.SyncStatus;
import com.gt.linker.remote.RemoteKnowledgePointService;
import com.gt.linker.session.AuthSession;
import com.gt.linker.util.FakeRemoteKnowledgePointStore;
import com.gt.linker.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class ReconciliationServiceTests {

    private static final long OWNER_ID = 7;

    @TempDir
    Path tempDir;

    @Mock private ApplicationEventPublisher eventPublisher;

    private FakeRemoteKnowledgePointStore remoteStore;
    private LocalKnowledgePointService localKnowledgePointService;
    private ReconciliationService reconciliationService;

    @BeforeEach
    public void setup() {
        AuthSession authSession = new AuthSession(eventPublisher);
        authSession.login("token", OWNER_ID);

        remoteStore = new FakeRemoteKnowledgePointStore(OWNER_ID);
        localKnowledgePointService = new LocalKnowledgePointService(TestUtils.createLocalDao(tempDir.resolve("linker.db")), 20);

        reconciliationService = new ReconciliationService(
                localKnowledgePointService,
                new RemoteKnowledgePointService(remoteStore, authSession),
                new IdentityResolver(),
                new KeyedMutationQueue(Runnable::run),
                Clock.fixed(TestUtils.TEST_NOW, ZoneOffset.UTC),
                5);
    }

    @Test
    public void testPromotesGuestPoints() {
        KnowledgePoint guest = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));

        ReconciliationResult result = reconciliationService.reconcile(localKnowledgePointService.loadAll(), List.of());

        assertEquals(1, result.promoted().size());
        assertFalse(result.hasConflicts());

        KnowledgePoint promoted = result.promoted().get(0);
        assertEquals(new CompositeKnowledgePointId(OWNER_ID, 1), promoted.compositeId());
        assertEquals(Origin.Remote, promoted.origin());
        assertEquals(guest.correctPhrase(), promoted.correctPhrase());

        assertEquals(0, localKnowledgePointService.countLocalOnly());
        assertEquals(1, remoteStore.all().size());
    }

    @Test
    public void testRunningTwiceCreatesOneRemoteRecord() {
        localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));

        reconciliationService.reconcileNow();
        Optional<ReconciliationResult> second = reconciliationService.reconcileNow();

        assertTrue(second.isPresent());
        assertTrue(second.get().promoted().isEmpty());
        assertEquals(1, remoteStore.getCreateCalls());
        assertEquals(1, remoteStore.all().size());
    }

    @Test
    public void testLeftoverGuestCopyIsAdoptedNotDuplicated() {
        // a previous run created the remote point but did not get to delete the guest copy
        KnowledgePoint guest = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        KnowledgePoint existing = TestUtils.remotePoint(OWNER_ID, 4, "grammar", "went", false);

        ReconciliationResult result = reconciliationService.reconcile(List.of(guest), List.of(existing));

        assertEquals(List.of(existing), result.promoted());
        assertEquals(0, remoteStore.getCreateCalls());
        assertEquals(0, localKnowledgePointService.countLocalOnly());
    }

    @Test
    public void testSamePhraseInOtherCategoryIsNotAdopted() {
        KnowledgePoint guest = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));

        ReconciliationResult result = reconciliationService.reconcile(List.of(guest),
                List.of(TestUtils.remotePoint(OWNER_ID, 4, "vocabulary", "went", false)));

        assertEquals(1, result.promoted().size());
        assertEquals(1, remoteStore.getCreateCalls());
    }

    @Test
    public void testUnreachableServerKeepsGuestPoint() {
        KnowledgePoint guest = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        remoteStore.failNextMutation(new RemoteUnreachableException("timeout"));

        ReconciliationResult result = reconciliationService.reconcile(List.of(guest), List.of());

        assertTrue(result.promoted().isEmpty());
        assertEquals(1, result.conflicts().size());
        assertEquals(ConflictReason.RemoteUnreachable, result.conflicts().get(0).reason());
        assertEquals(guest, result.conflicts().get(0).point());
        assertEquals(1, localKnowledgePointService.countLocalOnly());

        ReconciliationResult retry = reconciliationService.reconcile(localKnowledgePointService.loadAll(), remoteStore.all());
        assertEquals(1, retry.promoted().size());
        assertEquals(0, localKnowledgePointService.countLocalOnly());
    }

    @Test
    public void testRejectionDoesNotStopOtherPoints() {
        KnowledgePoint first = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        KnowledgePoint second = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "gone"));
        remoteStore.failNextMutation(new RemoteRejectedException("invalid", 422));

        ReconciliationResult result = reconciliationService.reconcile(List.of(first, second), List.of());

        assertEquals(1, result.promoted().size());
        assertEquals("gone", result.promoted().get(0).correctPhrase());
        assertEquals(ConflictReason.RemoteRejected, result.conflicts().get(0).reason());
        assertEquals(List.of(first), localKnowledgePointService.loadLocalOnly());
    }

    @Test
    public void testGuestPointDeletedAfterSnapshotIsNotPromoted() {
        localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        List<KnowledgePoint> snapshot = localKnowledgePointService.loadAll();

        localKnowledgePointService.removeByContentKey("grammar", "went");
        ReconciliationResult result = reconciliationService.reconcile(snapshot, List.of());

        assertTrue(result.promoted().isEmpty());
        assertFalse(result.hasConflicts());
        assertEquals(0, remoteStore.getCreateCalls());
        assertTrue(remoteStore.all().isEmpty());
    }

    @Test
    public void testPromotionSendsLatestGuestMastery() {
        KnowledgePoint guest = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        List<KnowledgePoint> snapshot = localKnowledgePointService.loadAll();

        localKnowledgePointService.update(TestUtils.withMastery(guest, 2.0));
        ReconciliationResult result = reconciliationService.reconcile(snapshot, List.of());

        assertEquals(1, result.promoted().size());
        assertEquals(2.0, result.promoted().get(0).masteryLevel(), 0.0001);
        assertEquals(2.0, remoteStore.all().get(0).masteryLevel(), 0.0001);
        assertEquals(0, localKnowledgePointService.countLocalOnly());
    }

    @Test
    public void testRemotePointsPassThrough() {
        KnowledgePoint cached = TestUtils.remotePoint(OWNER_ID, 2, "grammar", "gone", false);

        ReconciliationResult result = reconciliationService.reconcile(List.of(cached), List.of());

        assertEquals(List.of(cached), result.passedThrough());
        assertTrue(result.promoted().isEmpty());
        assertEquals(0, remoteStore.getCreateCalls());
    }

    @Test
    public void testInterruptedRunStopsBetweenPoints() {
        KnowledgePoint first = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        KnowledgePoint second = localKnowledgePointService.save(TestUtils.guestPoint("grammar", "gone"));

        Thread.currentThread().interrupt();
        try {
            ReconciliationResult result = reconciliationService.reconcile(List.of(first, second), List.of());

            assertTrue(result.promoted().isEmpty());
            assertEquals(2, result.conflicts().size());
            assertEquals(ConflictReason.Cancelled, result.conflicts().get(0).reason());
            assertEquals(0, remoteStore.getCreateCalls());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testStatusReportsPendingAndErrors() {
        localKnowledgePointService.save(TestUtils.guestPoint("grammar", "went"));
        remoteStore.setUnreachable(true);

        assertThrows(RemoteUnreachableException.class, () -> reconciliationService.reconcileNow());

        SyncStatus status = reconciliationService.getStatus();
        assertFalse(status.syncing());
        assertEquals(1, status.pendingCount());
        assertNull(status.lastSyncInstant());
        assertEquals(1, status.recentErrors().size());

        remoteStore.setUnreachable(false);
        reconciliationService.reconcileNow();

        status = reconciliationService.getStatus();
        assertEquals(0, status.pendingCount());
        assertEquals(TestUtils.TEST_NOW, status.lastSyncInstant());
    }
}
