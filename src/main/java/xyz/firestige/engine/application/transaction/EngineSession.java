package xyz.firestige.engine.application.transaction;

import xyz.firestige.engine.application.bootstrap.ClusterBootstrapService;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.execution.EnvironmentExecutor;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;

import java.util.Objects;

/**
 * 引擎会话，事务的创建入口
 * <p>
 * 不同事务之间没有共享的可变状态，可以并发提交，只要它们不共用工作目录、命名空间或 release 名。
 */
public class EngineSession {

    private final EnvironmentExecutor environmentExecutor;
    private final ClusterBootstrapService clusterBootstrapService;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public EngineSession(EnvironmentExecutor environmentExecutor,
                         ClusterBootstrapService clusterBootstrapService,
                         DomainEventPublisher eventPublisher,
                         MetricsRegistry metrics) {
        this.environmentExecutor = Objects.requireNonNull(environmentExecutor, "environmentExecutor");
        this.clusterBootstrapService = clusterBootstrapService;
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    public Transaction transaction() {
        return new Transaction(ExecutionId.generate().getValue(), environmentExecutor, clusterBootstrapService, eventPublisher, metrics);
    }
}
