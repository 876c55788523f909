package xyz.firestige.engine.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.firestige.engine.application.transaction.EngineSession;
import xyz.firestige.engine.config.properties.EngineProperties;
import xyz.firestige.engine.domain.service.StartTimeoutPolicy;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;
import xyz.firestige.engine.facade.EnvironmentDeploymentFacade;
import xyz.firestige.engine.infrastructure.chart.LeveledChartInstaller;
import xyz.firestige.engine.infrastructure.dns.DomainReadinessProber;
import xyz.firestige.engine.infrastructure.dns.JndiDnsResolver;
import xyz.firestige.engine.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.engine.infrastructure.execution.EnvironmentExecutor;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.engine.testutil.FakeDnsResolver;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class EngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EngineAutoConfiguration.class));

    @Test
    void registersEngineBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(EnvironmentDeploymentFacade.class);
            assertThat(context).hasSingleBean(EngineSession.class);
            assertThat(context).hasSingleBean(EnvironmentExecutor.class);
            assertThat(context).hasSingleBean(LeveledChartInstaller.class);
            assertThat(context).getBean(MetricsRegistry.class).isInstanceOf(NoopMetricsRegistry.class);
            assertThat(context).getBean(DomainEventPublisher.class).isInstanceOf(SpringDomainEventPublisher.class);
            assertThat(context).hasBean("engineProgressExecutor");
            assertThat(context).hasBean("engineHeartbeatExecutor");
        });
    }

    @Test
    void defaultResolversComeFromProperties() {
        contextRunner.run(context -> {
            DomainReadinessProber prober = context.getBean(DomainReadinessProber.class);
            assertThat(prober.getResolvers()).hasSize(4).allMatch(r -> r instanceof JndiDnsResolver);
            assertThat(prober.getResolvers()).extracting(r -> r.getName())
                    .containsExactly("google", "cloudflare", "quad9", "system");
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "engine.service.start-timeout-margin=5s",
                        "engine.service.start-timeout-multiplier=2",
                        "engine.readiness.cname.max-attempts=10")
                .run(context -> {
                    EngineProperties properties = context.getBean(EngineProperties.class);
                    assertThat(properties.getReadiness().getCname().getMaxAttempts()).isEqualTo(10);
                    StartTimeoutPolicy policy = context.getBean(StartTimeoutPolicy.class);
                    assertThat(policy.compute(Duration.ofSeconds(15))).isEqualTo(Duration.ofSeconds(40));
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        contextRunner
                .withPropertyValues("engine.charts.level-parallelism=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void userBeansReplaceDefaults() {
        MetricsRegistry custom = new NoopMetricsRegistry();
        contextRunner
                .withBean("customMetrics", MetricsRegistry.class, () -> custom)
                .withBean(FakeDnsResolver.class, () -> new FakeDnsResolver("internal"))
                .run(context -> {
                    assertThat(context).getBean(MetricsRegistry.class).isSameAs(custom);
                    assertThat(context.getBean(DomainReadinessProber.class).getResolvers())
                            .singleElement()
                            .extracting(r -> r.getName())
                            .isEqualTo("internal");
                });
    }

    @Test
    void meterRegistrySelectsMicrometerMetrics() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        contextRunner
                .withBean(MeterRegistry.class, () -> meterRegistry)
                .run(context -> {
                    MetricsRegistry metrics = context.getBean(MetricsRegistry.class);
                    assertThat(metrics).isInstanceOf(MicrometerMetricsRegistry.class);

                    metrics.incrementCounter("chart_installed");
                    metrics.setGauge("long_task_elapsed_seconds", 12.0);

                    assertThat(meterRegistry.counter("chart_installed").count()).isEqualTo(1.0);
                    assertThat(meterRegistry.get("long_task_elapsed_seconds").gauge().value()).isEqualTo(12.0);
                });
    }

    @Test
    void chartExecutorOnlyExistsForParallelLevels() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean("engineChartExecutor"));
        contextRunner
                .withPropertyValues("engine.charts.level-parallelism=3")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasBean("engineChartExecutor");
                    assertThat(context).hasSingleBean(LeveledChartInstaller.class);
                });
    }

    @Test
    void chartExecutorIsShutDownWithContext() {
        AtomicReference<ExecutorService> executor = new AtomicReference<>();
        contextRunner
                .withPropertyValues("engine.charts.level-parallelism=2")
                .run(context -> executor.set(context.getBean("engineChartExecutor", ExecutorService.class)));

        assertThat(executor.get().isShutdown()).isTrue();
    }

    @Test
    void heartbeatExecutorCanBeDisabled() {
        contextRunner
                .withPropertyValues("engine.heartbeat.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean("engineHeartbeatExecutor");
                });
    }

    @Test
    void engineCanBeSwitchedOff() {
        contextRunner
                .withPropertyValues("engine.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(EnvironmentDeploymentFacade.class));
    }
}
