package xyz.firestige.engine.infrastructure.dns;

/**
 * 单次 DNS 查询失败
 */
public class DnsLookupException extends Exception {

    public DnsLookupException(String message) {
        super(message);
    }

    public DnsLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
