package com.gt.linker.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Configuration
@EnableCaching
@EnableScheduling
public class CachingConfig {

    private static final Logger log = LoggerFactory.getLogger(CachingConfig.class);

    public static final String REMOTE_ACTIVE = "remote_active_knowledge_points";
    public static final String REMOTE_ARCHIVED = "remote_archived_knowledge_points";
    private static final long CACHE_EVICT_SCHEDULE_MS = 5 * 60 * 1000;

    @Bean
    public CacheManager getRemoteKnowledgePointCacheManager() {
        return new ConcurrentMapCacheManager(REMOTE_ACTIVE, REMOTE_ARCHIVED);
    }

    @CacheEvict(allEntries = true, value = {REMOTE_ACTIVE, REMOTE_ARCHIVED})
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS, initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportRemoteKnowledgePointCacheEvict() {
        log.info("Flushing " + REMOTE_ACTIVE + " and " + REMOTE_ARCHIVED + " caches.");
    }
}
