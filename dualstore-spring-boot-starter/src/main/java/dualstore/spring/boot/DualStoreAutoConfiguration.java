package dualstore.spring.boot;

import dualstore.jdbc.local.DurableLocalStore;
import dualstore.jdbc.remote.CachedRemoteStore;
import dualstore.manager.ResilientManager;
import dualstore.spi.MetricsExporter;
import dualstore.spi.RemoteStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for the dualstore resilient manager.
 *
 * <p>Opens a {@link DurableLocalStore} at {@code dualstore.local.path} and, when the context
 * has a {@link DataSource}, wraps it in a {@link CachedRemoteStore}. The
 * {@link ResilientManager} is started when the bean is created, so a local store that cannot
 * be opened fails the context. Without a DataSource the manager runs in DISABLED mode.
 *
 * @see DualStoreProperties
 * @see DualStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ResilientManager.class)
@EnableConfigurationProperties(DualStoreProperties.class)
public class DualStoreAutoConfiguration {

  /**
   * The DataSource stays owned by Spring; the manager closes the store itself on shutdown.
   */
  @Bean(destroyMethod = "")
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnMissingBean(RemoteStore.class)
  @ConditionalOnProperty(prefix = "dualstore.remote", name = "enabled", matchIfMissing = true)
  public CachedRemoteStore dualStoreRemoteStore(
      DataSource dataSource,
      DualStoreProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    DualStoreProperties.Cache cache = props.getCache();
    return CachedRemoteStore.builder()
        .dataSource(dataSource)
        .ownsDataSource(false)
        .guildSettingsCache(cache.getGuildSettings().toSpec())
        .userSettingsCache(cache.getUserSettings().toSpec())
        .economyCache(cache.getEconomy().toSpec())
        .levelsCache(cache.getLevels().toSpec())
        .cacheCleanupInterval(props.getRemote().getCacheCleanupInterval())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public ResilientManager dualStoreManager(
      DualStoreProperties props,
      ObjectProvider<RemoteStore> remoteProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    DualStoreProperties.Queue queue = props.getQueue();
    Path localPath = Path.of(props.getLocal().getPath());
    return ResilientManager.builder()
        .localStore(() -> DurableLocalStore.builder()
            .path(localPath)
            .maxRetries(queue.getMaxRetries())
            .retention(queue.getRetention())
            .open())
        .remoteStore(remoteProvider.getIfAvailable())
        .forceOffline(props.isForceOffline())
        .queueFailedRemoteWrites(props.isQueueFailedRemoteWrites())
        .initialHealthCheckTimeout(props.getInitialHealthCheckTimeout())
        .healthCheckTimeout(props.getHealthCheckTimeout())
        .readTimeout(props.getReadTimeout())
        .writeTimeout(props.getWriteTimeout())
        .healthCheckInterval(props.getHealthCheckInterval())
        .reconnectDelay(props.getReconnectDelay())
        .syncInterval(props.getSync().getInterval())
        .syncBatchSize(props.getSync().getBatchSize())
        .queueRetention(queue.getRetention())
        .queuePurgeInterval(queue.getPurgeInterval())
        .remoteWorkers(props.getRemoteWorkers())
        .remoteQueueCapacity(props.getRemoteQueueCapacity())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }
}
