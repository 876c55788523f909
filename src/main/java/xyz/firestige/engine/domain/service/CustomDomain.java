package xyz.firestige.engine.domain.service;

/**
 * 用户自定义域名，期望其 CNAME 指向 targetDomain
 */
public record CustomDomain(String domain, String targetDomain) {
}
