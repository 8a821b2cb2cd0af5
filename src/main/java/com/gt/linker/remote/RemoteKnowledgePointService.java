package com.gt.linker.remote;

import com.gt.linker.conf.CachingConfig;
import com.gt.linker.exception.NotAuthenticatedException;
import com.gt.linker.model.BatchAction;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.session.AuthSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Session-aware entry point to the remote store. Fetched lists are cached until the next mutation,
 * login or logout.
 */
@Component
public class RemoteKnowledgePointService {

    private static final Logger log = LoggerFactory.getLogger(RemoteKnowledgePointService.class);

    private final RemoteKnowledgePointStore remoteKnowledgePointStore;
    private final AuthSession authSession;

    @Autowired
    public RemoteKnowledgePointService(RemoteKnowledgePointStore remoteKnowledgePointStore, AuthSession authSession) {
        this.remoteKnowledgePointStore = remoteKnowledgePointStore;
        this.authSession = authSession;
    }

    public boolean isAvailable() {
        return authSession.isAuthenticated();
    }

    @Cacheable(CachingConfig.REMOTE_ACTIVE)
    public List<KnowledgePoint> fetchActive() {
        requireAuthenticated("fetch active knowledge points");
        return remoteKnowledgePointStore.fetchActive();
    }

    @Cacheable(CachingConfig.REMOTE_ARCHIVED)
    public List<KnowledgePoint> fetchArchived() {
        requireAuthenticated("fetch archived knowledge points");
        return remoteKnowledgePointStore.fetchArchived();
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public CompositeKnowledgePointId create(KnowledgePoint point) {
        requireAuthenticated("create knowledge point");

        CompositeKnowledgePointId compositeId = remoteKnowledgePointStore.create(point);
        log.info("Created remote knowledge point {}", compositeId);

        return compositeId;
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void archive(RemoteKnowledgePointKey key) {
        requireAuthenticated("archive knowledge point");
        remoteKnowledgePointStore.archive(key);
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void unarchive(RemoteKnowledgePointKey key) {
        requireAuthenticated("unarchive knowledge point");
        remoteKnowledgePointStore.unarchive(key);
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void delete(RemoteKnowledgePointKey key) {
        requireAuthenticated("delete knowledge point");
        remoteKnowledgePointStore.delete(key);
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void updateMastery(RemoteKnowledgePointKey key, KnowledgePoint updatedPoint) {
        requireAuthenticated("update knowledge point mastery");
        remoteKnowledgePointStore.updateMastery(key, updatedPoint);
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void batchAction(BatchAction action, List<RemoteKnowledgePointKey> keys) {
        requireAuthenticated(action.getCode() + " knowledge points");
        remoteKnowledgePointStore.batchAction(action, keys);
    }

    @CacheEvict(allEntries = true, value = {CachingConfig.REMOTE_ACTIVE, CachingConfig.REMOTE_ARCHIVED})
    public void evictAll() {
        log.debug("Evicted cached remote knowledge point lists");
    }

    private void requireAuthenticated(String operation) {
        if (!authSession.isAuthenticated()) {
            throw new NotAuthenticatedException("Unable to " + operation + " without an authenticated session");
        }
    }
}
