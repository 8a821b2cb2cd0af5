package com.gt.linker.local;

import com.gt.linker.exception.GuestLimitExceededException;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.Origin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * On-device store for guest points and the offline copy of remote points.
 * <p>
 * Guest points have no server identity, so a record is addressed by its exact (category, correct phrase)
 * pair. Writes are serialized through a single write lock since the UI and background reconciliation
 * both touch the store.
 */
@Component
public class LocalKnowledgePointService {

    private static final Logger log = LoggerFactory.getLogger(LocalKnowledgePointService.class);

    private final LocalKnowledgePointDao localKnowledgePointDao;
    private final int maxGuestKnowledgePoints;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public LocalKnowledgePointService(LocalKnowledgePointDao localKnowledgePointDao,
                                      @Value("${linker.guest.maxKnowledgePoints:20}") int maxGuestKnowledgePoints) {
        this.localKnowledgePointDao = localKnowledgePointDao;
        this.maxGuestKnowledgePoints = maxGuestKnowledgePoints;
    }

    public List<KnowledgePoint> loadAll() {
        return read(() -> localKnowledgePointDao.loadAll()
                .stream()
                .map(LocalKnowledgePointRow::point)
                .toList());
    }

    public List<KnowledgePoint> loadLocalOnly() {
        return loadAll().stream().filter(KnowledgePoint::isLocalOnly).toList();
    }

    public Optional<KnowledgePoint> findLocalOnly(String category, String correctPhrase) {
        return loadLocalOnly().stream()
                .filter(point -> point.hasSameContentKey(category, correctPhrase))
                .findFirst();
    }

    public List<KnowledgePoint> loadCachedRemote(boolean archived) {
        return loadAll().stream()
                .filter(point -> point.origin() == Origin.Remote && point.archived() == archived)
                .toList();
    }

    public int countLocalOnly() {
        return read(() -> localKnowledgePointDao.countByOrigin(Origin.Local));
    }

    // Saving an existing (category, correct phrase) pair overwrites it, duplicates are not kept.
    public KnowledgePoint save(KnowledgePoint point) {
        KnowledgePoint localPoint = stampLocal(point);

        return write(() -> {
            if (localKnowledgePointDao.updateLocalByContentKey(localPoint) > 0) {
                return localPoint;
            }

            if (localKnowledgePointDao.countByOrigin(Origin.Local) >= maxGuestKnowledgePoints) {
                log.warn("Guest knowledge point limit of {} reached", maxGuestKnowledgePoints);
                throw new GuestLimitExceededException(maxGuestKnowledgePoints);
            }

            localKnowledgePointDao.insert(localPoint);
            log.info("Saved guest knowledge point in category {}", localPoint.category());

            return localPoint;
        });
    }

    public Optional<KnowledgePoint> update(KnowledgePoint point) {
        KnowledgePoint localPoint = stampLocal(point);

        return write(() -> localKnowledgePointDao.updateLocalByContentKey(localPoint) > 0
                ? Optional.of(localPoint)
                : Optional.<KnowledgePoint>empty());
    }

    // Removes every row the predicate accepts. Matching nothing is not an error.
    public int remove(Predicate<KnowledgePoint> predicate) {
        return write(() -> {
            List<Long> rowIds = localKnowledgePointDao.loadAll()
                    .stream()
                    .filter(row -> predicate.test(row.point()))
                    .map(LocalKnowledgePointRow::rowId)
                    .toList();

            return localKnowledgePointDao.deleteRows(rowIds);
        });
    }

    public int removeByContentKey(String category, String correctPhrase) {
        return remove(point -> point.isLocalOnly() && point.hasSameContentKey(category, correctPhrase));
    }

    public void replaceCachedRemotePoints(boolean archived, List<KnowledgePoint> remotePoints) {
        List<KnowledgePoint> cachedPoints = remotePoints.stream()
                .map(point -> point.withOrigin(Origin.Remote, point.aiReviewNotes()))
                .toList();

        write(() -> {
            localKnowledgePointDao.replaceCachedRemotePoints(archived, cachedPoints);
            return null;
        });
    }

    public int clearCachedRemotePoints() {
        int removed = write(() -> localKnowledgePointDao.deleteByOrigin(Origin.Remote));
        log.info("Cleared {} cached remote knowledge points", removed);

        return removed;
    }

    private KnowledgePoint stampLocal(KnowledgePoint point) {
        String notes = LocalKnowledgePointDao.LEGACY_LOCAL_MARKER.equals(point.aiReviewNotes()) ? null : point.aiReviewNotes();
        return point.withOrigin(Origin.Local, notes);
    }

    private <T> T read(Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
