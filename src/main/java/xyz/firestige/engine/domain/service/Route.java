package xyz.firestige.engine.domain.service;

/**
 * 路由规则：路径前缀转发到某个应用
 */
public record Route(String path, String applicationId) {
}
