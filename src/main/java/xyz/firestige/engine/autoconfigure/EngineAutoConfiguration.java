package xyz.firestige.engine.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.engine.application.bootstrap.ClusterBootstrapService;
import xyz.firestige.engine.application.bootstrap.ClusterChartsPlanner;
import xyz.firestige.engine.application.transaction.EngineSession;
import xyz.firestige.engine.config.properties.EngineProperties;
import xyz.firestige.engine.domain.environment.EngineContext;
import xyz.firestige.engine.domain.service.StartTimeoutPolicy;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;
import xyz.firestige.engine.domain.template.TemplateRenderer;
import xyz.firestige.engine.domain.version.SupportedVersionLookup;
import xyz.firestige.engine.domain.version.TableSupportedVersionLookup;
import xyz.firestige.engine.facade.EnvironmentDeploymentFacade;
import xyz.firestige.engine.infrastructure.chart.ChartBackupService;
import xyz.firestige.engine.infrastructure.chart.LeveledChartInstaller;
import xyz.firestige.engine.infrastructure.dns.DnsResolver;
import xyz.firestige.engine.infrastructure.dns.DomainReadinessProber;
import xyz.firestige.engine.infrastructure.dns.JndiDnsResolver;
import xyz.firestige.engine.infrastructure.dns.ProbeBudget;
import xyz.firestige.engine.infrastructure.event.ProgressNotifier;
import xyz.firestige.engine.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.engine.infrastructure.execution.EnvironmentExecutor;
import xyz.firestige.engine.infrastructure.execution.HeartbeatScheduler;
import xyz.firestige.engine.infrastructure.execution.LongTaskProgressDecorator;
import xyz.firestige.engine.infrastructure.execution.ServiceReadinessWaiter;
import xyz.firestige.engine.infrastructure.external.CliClusterClientFactory;
import xyz.firestige.engine.infrastructure.external.command.CommandRunner;
import xyz.firestige.engine.infrastructure.external.command.ProcessCommandRunner;
import xyz.firestige.engine.infrastructure.external.template.PlaceholderTemplateRenderer;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.engine.infrastructure.retry.RetryExecutor;
import xyz.firestige.engine.infrastructure.retry.Sleeper;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 部署引擎自动配置
 * <p>
 * 所有协作者都可以由宿主应用替换（@ConditionalOnMissingBean）。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "engine", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EngineProperties.class)
public class EngineAutoConfiguration {

    // ========== 基础 ==========

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper engineObjectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry engineMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        if (meterRegistry != null) {
            return new MicrometerMetricsRegistry(meterRegistry);
        }
        return new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    // ========== 进度 ==========

    @Bean(name = "engineProgressExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "engineProgressExecutor")
    public ExecutorService engineProgressExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("engine-progress-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressNotifier progressNotifier(DomainEventPublisher domainEventPublisher,
                                             @Qualifier("engineProgressExecutor") ExecutorService executor) {
        return new ProgressNotifier(domainEventPublisher, executor);
    }

    @Bean(name = "engineHeartbeatExecutor", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "engine.heartbeat", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean(name = "engineHeartbeatExecutor")
    public ScheduledExecutorService engineHeartbeatExecutor() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("engine-heartbeat-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public HeartbeatScheduler heartbeatScheduler(@Qualifier("engineHeartbeatExecutor") ObjectProvider<ScheduledExecutorService> schedulers,
                                                 ProgressNotifier progressNotifier,
                                                 EngineProperties properties,
                                                 MetricsRegistry metrics) {
        ScheduledExecutorService scheduler = schedulers.getIfAvailable();
        if (scheduler == null || !properties.getHeartbeat().isEnabled()) {
            return HeartbeatScheduler.disabled(progressNotifier);
        }
        return new HeartbeatScheduler(scheduler, progressNotifier, properties.getHeartbeat().getInterval(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public LongTaskProgressDecorator longTaskProgressDecorator(ProgressNotifier progressNotifier,
                                                               HeartbeatScheduler heartbeatScheduler) {
        return new LongTaskProgressDecorator(progressNotifier, heartbeatScheduler);
    }

    // ========== 重试与就绪探测 ==========

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(ObjectProvider<Sleeper> sleeper) {
        return new RetryExecutor(sleeper.getIfAvailable(() -> Sleeper.THREAD));
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainReadinessProber domainReadinessProber(ObjectProvider<DnsResolver> resolverBeans,
                                                       RetryExecutor retryExecutor,
                                                       ProgressNotifier progressNotifier,
                                                       EngineProperties properties) {
        EngineProperties.Readiness readiness = properties.getReadiness();
        List<DnsResolver> resolvers = resolverBeans.orderedStream().collect(Collectors.toList());
        if (resolvers.isEmpty()) {
            resolvers = readiness.getResolvers().stream()
                    .map(r -> (DnsResolver) new JndiDnsResolver(r.getName(), r.getServer(), readiness.getLookupTimeout()))
                    .collect(Collectors.toList());
        }
        return new DomainReadinessProber(resolvers, retryExecutor, progressNotifier,
                new ProbeBudget(readiness.getCname().getMaxAttempts(), readiness.getCname().getInterval()),
                new ProbeBudget(readiness.getDomain().getMaxAttempts(), readiness.getDomain().getInterval()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceReadinessWaiter serviceReadinessWaiter(RetryExecutor retryExecutor,
                                                         DomainReadinessProber domainReadinessProber,
                                                         EngineProperties properties) {
        return new ServiceReadinessWaiter(retryExecutor, domainReadinessProber,
                properties.getService().getReadinessPollInterval());
    }

    // ========== 服务 ==========

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer(ObjectMapper objectMapper) {
        return new PlaceholderTemplateRenderer(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineContext engineContext(EngineProperties properties, TemplateRenderer templateRenderer) {
        return new EngineContext(properties.getWorkspaceRoot(), properties.getLibRoot(), properties.isTestCluster(), templateRenderer);
    }

    @Bean
    @ConditionalOnMissingBean
    public StartTimeoutPolicy startTimeoutPolicy(EngineProperties properties) {
        return new StartTimeoutPolicy(properties.getService().getStartTimeoutMargin(),
                properties.getService().getStartTimeoutMultiplier());
    }

    @Bean
    @ConditionalOnMissingBean
    public SupportedVersionLookup supportedVersionLookup() {
        return new TableSupportedVersionLookup();
    }

    // ========== 外部进程 ==========

    @Bean
    @ConditionalOnMissingBean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public CliClusterClientFactory cliClusterClientFactory(CommandRunner commandRunner,
                                                           ObjectMapper objectMapper,
                                                           EngineProperties properties) {
        EngineProperties.Commands commands = properties.getCommands();
        return new CliClusterClientFactory(commandRunner, objectMapper,
                commands.getHelmBinary(), commands.getKubectlBinary(), commands.getTimeoutBuffer());
    }

    // ========== chart 安装 ==========

    @Bean
    @ConditionalOnMissingBean
    public ChartBackupService chartBackupService() {
        // 不注册为 ObjectMapper 类型的 bean，避免与 JSON mapper 冲突
        YAMLMapper yamlMapper = new YAMLMapper();
        yamlMapper.findAndRegisterModules();
        return new ChartBackupService(yamlMapper);
    }

    @Bean(name = "engineChartExecutor", destroyMethod = "shutdown")
    @ConditionalOnExpression("${engine.charts.level-parallelism:1} > 1")
    @ConditionalOnMissingBean(name = "engineChartExecutor")
    public ExecutorService engineChartExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(properties.getCharts().getLevelParallelism(), daemonThreads("engine-chart-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public LeveledChartInstaller leveledChartInstaller(ChartBackupService chartBackupService,
                                                       LongTaskProgressDecorator longTaskProgressDecorator,
                                                       @Qualifier("engineChartExecutor") ObjectProvider<ExecutorService> chartExecutors,
                                                       MetricsRegistry metrics) {
        // 未配置并行时逐个安装
        return new LeveledChartInstaller(chartBackupService, longTaskProgressDecorator,
                chartExecutors.getIfAvailable(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterChartsPlanner clusterChartsPlanner(ObjectMapper objectMapper) {
        return new ClusterChartsPlanner(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterBootstrapService clusterBootstrapService(ClusterChartsPlanner clusterChartsPlanner,
                                                           LeveledChartInstaller leveledChartInstaller,
                                                           EngineContext engineContext) {
        return new ClusterBootstrapService(clusterChartsPlanner, leveledChartInstaller, engineContext);
    }

    // ========== 编排 ==========

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentExecutor environmentExecutor(LongTaskProgressDecorator longTaskProgressDecorator,
                                                   ServiceReadinessWaiter serviceReadinessWaiter,
                                                   ProgressNotifier progressNotifier,
                                                   MetricsRegistry metrics) {
        return new EnvironmentExecutor(longTaskProgressDecorator, serviceReadinessWaiter, progressNotifier, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineSession engineSession(EnvironmentExecutor environmentExecutor,
                                       ClusterBootstrapService clusterBootstrapService,
                                       DomainEventPublisher domainEventPublisher,
                                       MetricsRegistry metrics) {
        return new EngineSession(environmentExecutor, clusterBootstrapService, domainEventPublisher, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentDeploymentFacade environmentDeploymentFacade(EngineSession engineSession, EngineContext engineContext) {
        return new EnvironmentDeploymentFacade(engineSession, engineContext);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
