package xyz.firestige.engine.testutil;

import xyz.firestige.engine.infrastructure.dns.DnsLookupException;
import xyz.firestige.engine.infrastructure.dns.DnsRecordType;
import xyz.firestige.engine.infrastructure.dns.DnsResolver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可编排应答的解析器，未配置的查询抛出 {@link DnsLookupException}
 */
public class FakeDnsResolver implements DnsResolver {

    private final String name;
    private final Map<String, List<String>> answers = new HashMap<>();
    private final AtomicInteger queries = new AtomicInteger();
    private List<String> queryLog;

    public FakeDnsResolver(String name) {
        this.name = name;
    }

    public FakeDnsResolver answer(String domain, DnsRecordType type, String... records) {
        answers.put(key(domain, type), List.of(records));
        return this;
    }

    /**
     * 每次查询把解析器名称追加到共享日志，用于校验多个解析器之间的调用顺序
     */
    public FakeDnsResolver logQueriesTo(List<String> log) {
        this.queryLog = log;
        return this;
    }

    public int queries() {
        return queries.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> lookup(String domain, DnsRecordType type) throws DnsLookupException {
        queries.incrementAndGet();
        if (queryLog != null) {
            queryLog.add(name);
        }
        List<String> records = answers.get(key(domain, type));
        if (records == null) {
            throw new DnsLookupException(name + " cannot resolve " + type + " " + domain);
        }
        return records;
    }

    private static String key(String domain, DnsRecordType type) {
        return type + ":" + domain;
    }

    @Override
    public String toString() {
        return name;
    }
}
