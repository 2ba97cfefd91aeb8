package dualstore.spring.boot;

import dualstore.manager.ResilientManager;
import dualstore.micrometer.MicrometerMetricsExporter;
import dualstore.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DualStoreMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(DualStoreMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @TempDir
  Path tempDir;

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
      assertNotNull(ctx.getBean(MeterRegistry.class).find("dualstore.sync.success").counter());
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("dualstore.metrics.name-prefix=bot.store").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("bot.store.remote.read.fallback").counter());
      assertNull(registry.find("dualstore.remote.read.fallback").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("dualstore.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void notCreatedWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(DualStoreMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      MetricsExporter exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Test
  void managerReportsModeThroughExporter() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DualStoreMicrometerAutoConfiguration.class,
            DualStoreAutoConfiguration.class))
        .withUserConfiguration(MeterRegistryConfig.class)
        .withPropertyValues("dualstore.local.path=" + tempDir.resolve("metrics"))
        .run(ctx -> {
          assertNotNull(ctx.getBean(ResilientManager.class));
          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertEquals(1.0,
              registry.get("dualstore.mode").tag("mode", "disabled").gauge().value());
          assertEquals(1.0, registry.get("dualstore.mode.transitions")
              .tag("from", "unknown").tag("to", "disabled").counter().count());
        });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
