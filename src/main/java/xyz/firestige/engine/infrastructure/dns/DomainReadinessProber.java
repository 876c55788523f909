package xyz.firestige.engine.infrastructure.dns;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.progress.ProgressEvent;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.progress.ProgressStep;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.event.ProgressNotifier;
import xyz.firestige.engine.infrastructure.retry.FixedDelayRetryPolicy;
import xyz.firestige.engine.infrastructure.retry.RetryExecutor;
import xyz.firestige.engine.infrastructure.retry.RetryOutcome;
import xyz.firestige.engine.infrastructure.retry.RotatingPool;

import java.util.ArrayList;
import java.util.List;

/**
 * 域名就绪探测
 * <p>
 * 每次尝试从解析器池中按轮询顺序取一个解析器，串行查询。预算耗尽只发布警告并返回原始输入，
 * DNS 传播延迟或 CDN 代理都属于预期情况，不能让部署失败或回滚。
 */
public class DomainReadinessProber {

    private static final Logger log = LoggerFactory.getLogger(DomainReadinessProber.class);

    private static final String CNAME_ACTION = "check-cname";
    private static final String DOMAIN_ACTION = "check-domain";

    private final List<DnsResolver> resolvers;
    private final RetryExecutor retryExecutor;
    private final ProgressNotifier notifier;
    private final ProbeBudget cnameBudget;
    private final ProbeBudget domainBudget;

    public DomainReadinessProber(List<DnsResolver> resolvers,
                                 RetryExecutor retryExecutor,
                                 ProgressNotifier notifier,
                                 ProbeBudget cnameBudget,
                                 ProbeBudget domainBudget) {
        if (resolvers == null || resolvers.isEmpty()) {
            throw new IllegalArgumentException("at least one resolver is required");
        }
        this.resolvers = List.copyOf(resolvers);
        this.retryExecutor = retryExecutor;
        this.notifier = notifier;
        this.cnameBudget = cnameBudget;
        this.domainBudget = domainBudget;
    }

    /**
     * 查询域名的 CNAME 目标
     *
     * @return 确认时为 CNAME 目标；未确认时为原始域名
     */
    public ReadinessOutcome checkCname(String domain, ExecutionId executionId, ProgressScope scope, ProgressListeners listeners) {
        notifier.notify(ProgressEvent.info(scope, CNAME_ACTION, ProgressStep.STARTED, executionId,
                "Checking CNAME record of " + domain), listeners);

        RetryOutcome<List<String>> outcome = retryExecutor.poll(
                new FixedDelayRetryPolicy(cnameBudget.maxAttempts(), cnameBudget.interval()),
                RotatingPool.of(resolvers),
                (resolver, attempt) -> {
                    List<String> records = resolver.lookup(domain, DnsRecordType.CNAME);
                    if (records.isEmpty()) {
                        notifier.notify(ProgressEvent.info(scope, CNAME_ACTION, ProgressStep.IN_PROGRESS, executionId,
                                "No CNAME found for " + domain + " yet (attempt " + attempt + "/" + cnameBudget.maxAttempts() + ")"), listeners);
                    }
                    return records;
                },
                records -> records != null && !records.isEmpty());

        if (outcome.isSatisfied()) {
            String target = outcome.getValue().orElseThrow().get(0);
            notifier.notify(ProgressEvent.info(scope, CNAME_ACTION, ProgressStep.SUCCEEDED, executionId,
                    "CNAME of " + domain + " resolves to " + target), listeners);
            return ReadinessOutcome.confirmed(domain, target, outcome.getAttempts());
        }

        outcome.getLastError().ifPresent(e -> log.debug("CNAME 最后一次查询失败: domain={}, error={}", domain, e.getMessage()));
        notifier.notify(ProgressEvent.warn(scope, CNAME_ACTION, ProgressStep.FAILED, executionId,
                "Could not confirm CNAME of " + domain + " after " + outcome.getAttempts()
                        + " attempts. DNS propagation can take time, deployment continues"), listeners);
        return ReadinessOutcome.unconfirmed(domain, outcome.getAttempts());
    }

    /**
     * 确认域名可以解析到 A / AAAA 记录
     *
     * @return 确认时为第一个地址；未确认时为原始域名
     */
    public ReadinessOutcome checkDomain(String domain, ExecutionId executionId, ProgressScope scope, ProgressListeners listeners) {
        notifier.notify(ProgressEvent.info(scope, DOMAIN_ACTION, ProgressStep.STARTED, executionId,
                "Checking that " + domain + " resolves"), listeners);

        RetryOutcome<List<String>> outcome = retryExecutor.poll(
                new FixedDelayRetryPolicy(domainBudget.maxAttempts(), domainBudget.interval()),
                RotatingPool.of(resolvers),
                (resolver, attempt) -> resolveAddresses(resolver, domain),
                records -> records != null && !records.isEmpty());

        if (outcome.isSatisfied()) {
            String address = outcome.getValue().orElseThrow().get(0);
            notifier.notify(ProgressEvent.info(scope, DOMAIN_ACTION, ProgressStep.SUCCEEDED, executionId,
                    "Domain " + domain + " is ready (" + address + ")"), listeners);
            return ReadinessOutcome.confirmed(domain, address, outcome.getAttempts());
        }

        notifier.notify(ProgressEvent.warn(scope, DOMAIN_ACTION, ProgressStep.FAILED, executionId,
                "Domain " + domain + " is not resolvable yet after " + outcome.getAttempts()
                        + " attempts. This is not critical, it can take a few minutes to propagate"), listeners);
        return ReadinessOutcome.unconfirmed(domain, outcome.getAttempts());
    }

    public List<ReadinessOutcome> checkDomains(List<String> domains, ExecutionId executionId, ProgressScope scope, ProgressListeners listeners) {
        List<ReadinessOutcome> outcomes = new ArrayList<>(domains.size());
        for (String domain : domains) {
            outcomes.add(checkDomain(domain, executionId, scope, listeners));
        }
        return outcomes;
    }

    private static List<String> resolveAddresses(DnsResolver resolver, String domain) throws DnsLookupException {
        List<String> addresses = resolver.lookup(domain, DnsRecordType.A);
        if (!addresses.isEmpty()) {
            return addresses;
        }
        return resolver.lookup(domain, DnsRecordType.AAAA);
    }

    public List<DnsResolver> getResolvers() {
        return resolvers;
    }
}
