package xyz.firestige.engine.infrastructure.dns;

import javax.naming.Context;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

/**
 * 基于 JDK JNDI DNS 提供者的解析器
 * <p>
 * server 为空时使用系统配置的解析器。
 */
public class JndiDnsResolver implements DnsResolver {

    private static final String DNS_CONTEXT_FACTORY = "com.sun.jndi.dns.DnsContextFactory";

    private final String name;
    private final String server;
    private final Duration timeout;

    public JndiDnsResolver(String name, String server, Duration timeout) {
        this.name = name;
        this.server = server == null || server.isBlank() ? null : server;
        this.timeout = timeout;
    }

    public static JndiDnsResolver system(Duration timeout) {
        return new JndiDnsResolver("system", null, timeout);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getServer() {
        return server;
    }

    @Override
    public List<String> lookup(String domain, DnsRecordType type) throws DnsLookupException {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, DNS_CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, server == null ? "dns:" : "dns://" + server);
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(timeout.toMillis()));
        env.put("com.sun.jndi.dns.timeout.retries", "1");

        DirContext ctx = null;
        try {
            ctx = new InitialDirContext(env);
            Attributes attributes = ctx.getAttributes(domain, new String[]{type.name()});
            Attribute attribute = attributes.get(type.name());
            List<String> records = new ArrayList<>();
            if (attribute == null) {
                return records;
            }
            NamingEnumeration<?> values = attribute.getAll();
            while (values.hasMore()) {
                records.add(stripTrailingDot(String.valueOf(values.next())));
            }
            return records;
        } catch (NamingException e) {
            throw new DnsLookupException(type + " lookup of " + domain + " via " + name + " failed: " + e.getExplanation(), e);
        } finally {
            closeQuietly(ctx);
        }
    }

    private static String stripTrailingDot(String value) {
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }

    private static void closeQuietly(DirContext ctx) {
        if (ctx == null) {
            return;
        }
        try {
            ctx.close();
        } catch (NamingException ignored) {
            // 关闭失败不影响查询结果
        }
    }

    @Override
    public String toString() {
        return name + (server == null ? "" : "(" + server + ")");
    }
}
