package com.gt.linker.conf;

import com.gt.linker.local.LocalKnowledgePointDao;
import com.gt.linker.local.impl.LocalKnowledgePointDaoSqlite;
import com.gt.linker.remote.RemoteKnowledgePointStore;
import com.gt.linker.remote.impl.RemoteKnowledgePointStoreHttp;
import com.gt.linker.session.AuthSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    public static final String RECONCILIATION_EXECUTOR = "reconciliationExecutor";
    public static final String MUTATION_EXECUTOR = "mutationExecutor";

    @Bean
    public DataSource getDataSource(@Value("${linker.local.databasePath}") String databasePath) throws IOException {
        Path parent = Path.of(databasePath).toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        log.info("Using local knowledge point database at {}", databasePath);

        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + databasePath);
        dataSource.setDriverClassName("org.sqlite.JDBC");

        return dataSource;
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public LocalKnowledgePointDao getLocalKnowledgePointDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate,
                                                            PlatformTransactionManager transactionManager) {
        return new LocalKnowledgePointDaoSqlite(namedParameterJdbcTemplate, new TransactionTemplate(transactionManager));
    }

    @Bean
    public RestClient getRemoteRestClient(RestClient.Builder restClientBuilder,
                                          @Value("${linker.remote.baseUrl}") String baseUrl,
                                          @Value("${linker.remote.connectTimeoutMs:5000}") int connectTimeoutMs,
                                          @Value("${linker.remote.readTimeoutMs:15000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        return restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public RemoteKnowledgePointStore getRemoteKnowledgePointStore(RestClient remoteRestClient, AuthSession authSession, Clock clock) {
        return new RemoteKnowledgePointStoreHttp(remoteRestClient, authSession, clock);
    }

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    // A single thread so at most one reconciliation run is ever in flight
    @Bean(name = RECONCILIATION_EXECUTOR)
    public ThreadPoolTaskExecutor getReconciliationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("linker-reconcile-");

        return executor;
    }

    @Bean(name = MUTATION_EXECUTOR)
    public ThreadPoolTaskExecutor getMutationExecutor(@Value("${linker.executor.corePoolSize:2}") int corePoolSize,
                                                      @Value("${linker.executor.maxPoolSize:4}") int maxPoolSize,
                                                      @Value("${linker.executor.queueCapacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("linker-mutation-");

        return executor;
    }
}
