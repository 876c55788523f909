package xyz.firestige.engine.infrastructure.dns;

import java.util.List;

/**
 * DNS 解析器
 */
public interface DnsResolver {

    String getName();

    /**
     * @return 记录值（已去掉末尾的点），没有记录时为空列表
     * @throws DnsLookupException 查询失败（超时、NXDOMAIN、服务器错误）
     */
    List<String> lookup(String name, DnsRecordType type) throws DnsLookupException;
}
