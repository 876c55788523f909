package xyz.firestige.engine.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.cluster.KubectlClient;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.service.CustomDomain;
import xyz.firestige.engine.domain.service.Router;
import xyz.firestige.engine.domain.service.Service;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.dns.DomainReadinessProber;
import xyz.firestige.engine.infrastructure.dns.ReadinessOutcome;
import xyz.firestige.engine.infrastructure.retry.FixedDelayRetryPolicy;
import xyz.firestige.engine.infrastructure.retry.RetryExecutor;
import xyz.firestige.engine.infrastructure.retry.RetryOutcome;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 创建钩子成功后等待服务就绪
 * <p>
 * 有 pod 的服务在 startTimeout 内轮询 pod 就绪状态，超时视为执行失败；
 * Router 没有 pod，只对默认域名和自定义域名做尽力而为的 DNS 检查，结果不影响部署。
 */
public class ServiceReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ServiceReadinessWaiter.class);

    private final RetryExecutor retryExecutor;
    private final DomainReadinessProber prober;
    private final Duration pollInterval;

    public ServiceReadinessWaiter(RetryExecutor retryExecutor, DomainReadinessProber prober, Duration pollInterval) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.prober = prober;
        if (pollInterval == null || pollInterval.toMillis() < 1) {
            throw new IllegalArgumentException("pollInterval must be at least 1ms");
        }
        this.pollInterval = pollInterval;
    }

    public void await(Service service, DeploymentTarget target) {
        if (service instanceof Router router) {
            probeDomains(router, target);
            return;
        }
        Optional<String> selector = service.podSelector(target);
        if (selector.isEmpty()) {
            log.debug("服务没有 pod，跳过就绪等待: service={}", service.getId());
            return;
        }
        awaitPods(service, target, selector.get());
    }

    private void awaitPods(Service service, DeploymentTarget target, String selector) {
        KubectlClient kubectl = target.getCluster().getKubectl();
        String namespace = target.getEnvironment().getNamespace();
        Duration timeout = service.getStartTimeout();
        int maxAttempts = attemptsWithin(timeout);

        log.info("等待服务就绪: service={}, selector={}, timeout={}s", service.getId(), selector, timeout.toSeconds());
        RetryOutcome<Boolean> outcome = retryExecutor.poll(
                new FixedDelayRetryPolicy(maxAttempts, pollInterval),
                () -> kubectl.arePodsReady(namespace, selector),
                Boolean.TRUE::equals);

        if (outcome.isSatisfied()) {
            log.info("服务已就绪: service={}, attempts={}", service.getId(), outcome.getAttempts());
            return;
        }
        String safe = service.getType().name().toLowerCase() + " " + service.getName()
                + " is not ready after " + timeout.toSeconds() + " seconds";
        String raw = outcome.getLastError().map(Throwable::getMessage).orElse(safe);
        throw new EngineException(FailureInfo.of(ErrorType.TIMEOUT_ERROR, safe, raw, service.getId()));
    }

    private void probeDomains(Router router, DeploymentTarget target) {
        if (prober == null) {
            return;
        }
        ExecutionId executionId = target.getEnvironment().getExecutionId();
        if (router.getDefaultDomain() != null) {
            prober.checkDomain(router.getDefaultDomain(), executionId, router.progressScope(), router.getListeners());
        }
        for (CustomDomain customDomain : router.getCustomDomains()) {
            ReadinessOutcome outcome = prober.checkCname(
                    customDomain.domain(), executionId, router.progressScope(), router.getListeners());
            if (outcome.isConfirmed() && !sameHost(outcome.getValue(), customDomain.targetDomain())) {
                log.warn("自定义域名 CNAME 指向不一致，继续部署: domain={}, expected={}, actual={}",
                        customDomain.domain(), customDomain.targetDomain(), outcome.getValue());
            }
        }
    }

    /**
     * N 次尝试之间有 N-1 次等待，使总等待时间覆盖 timeout
     */
    int attemptsWithin(Duration timeout) {
        long intervals = (timeout.toMillis() + pollInterval.toMillis() - 1) / pollInterval.toMillis();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE - 1, intervals) + 1);
    }

    private static boolean sameHost(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return stripDot(left).equalsIgnoreCase(stripDot(right));
    }

    private static String stripDot(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }
}
