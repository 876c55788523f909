package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 入口路由
 * <p>
 * 暴露默认域名与自定义域名。域名就绪由编排器在创建后以尽力而为的方式确认。
 */
public final class Router extends AbstractService {

    static final String CHART_DIRECTORY = "common/charts/router";

    private static final Pattern DOMAIN_PATTERN =
            Pattern.compile("^(\\*\\.)?([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,63}$");

    private final String defaultDomain;
    private final List<CustomDomain> customDomains;
    private final List<Route> routes;

    private Router(Builder b) {
        super(b.id, b.name, b.action, b.sizing, null, null, b.startTimeoutBase, b.startTimeoutPolicy);
        this.defaultDomain = b.defaultDomain;
        this.customDomains = List.copyOf(b.customDomains);
        this.routes = List.copyOf(b.routes);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    protected String namePrefix() {
        return "router";
    }

    @Override
    public ServiceType getType() {
        return ServiceType.ROUTER;
    }

    public String getDefaultDomain() {
        return defaultDomain;
    }

    public List<CustomDomain> getCustomDomains() {
        return customDomains;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    @Override
    public Optional<String> podSelector(DeploymentTarget target) {
        return Optional.empty();
    }

    @Override
    public RenderContext renderContext(DeploymentTarget target) {
        List<Map<String, String>> routeList = new ArrayList<>();
        for (Route r : routes) {
            Map<String, String> route = new LinkedHashMap<>();
            route.put("path", r.path());
            route.put("application_id", r.applicationId());
            routeList.add(route);
        }
        List<Map<String, String>> domains = new ArrayList<>();
        for (CustomDomain d : customDomains) {
            Map<String, String> domain = new LinkedHashMap<>();
            domain.put("domain", d.domain());
            domain.put("target_domain", d.targetDomain());
            domains.add(domain);
        }
        return baseContext(target)
                .put("default_domain", defaultDomain)
                .put("routes", routeList)
                .put("custom_domains", domains);
    }

    @Override
    public void onCreateCheck(DeploymentTarget target) {
        if (defaultDomain == null || !DOMAIN_PATTERN.matcher(defaultDomain).matches()) {
            throw EngineException.validation("Router " + getName() + " has an invalid default domain: " + defaultDomain);
        }
        for (CustomDomain domain : customDomains) {
            if (domain.domain() == null || !DOMAIN_PATTERN.matcher(domain.domain()).matches()) {
                throw EngineException.validation("Router " + getName() + " has an invalid custom domain: " + domain.domain());
            }
        }
        if (routes.isEmpty()) {
            throw EngineException.validation("Router " + getName() + " has no route");
        }
    }

    @Override
    public void onCreate(DeploymentTarget target) {
        Path templates = target.getEngineContext().getLibRoot().resolve(CHART_DIRECTORY);
        renderAndDeploy(target, templates);
    }

    @Override
    public void onCreateError(DeploymentTarget target) {
        rollbackRelease(target);
    }

    @Override
    public void onPauseCheck(DeploymentTarget target) {
        // 无
    }

    /**
     * 应用缩容后路由保留，恢复时无需重新签发证书
     */
    @Override
    public void onPause(DeploymentTarget target) {
        log.info("路由在暂停期间保留: service={}", getId());
    }

    @Override
    public void onPauseError(DeploymentTarget target) {
        // 无
    }

    @Override
    public void onDeleteCheck(DeploymentTarget target) {
        // 无
    }

    @Override
    public void onDelete(DeploymentTarget target) {
        uninstallRelease(target);
    }

    @Override
    public void onDeleteError(DeploymentTarget target) {
        log.warn("路由删除失败: service={}, release={}", getId(), getReleaseName());
    }

    public static final class Builder {
        private final String id;
        private String name;
        private Action action = Action.CREATE;
        private Sizing sizing = Sizing.single("200m", 128);
        private Duration startTimeoutBase = Duration.ofSeconds(120);
        private StartTimeoutPolicy startTimeoutPolicy;
        private String defaultDomain;
        private final List<CustomDomain> customDomains = new ArrayList<>();
        private final List<Route> routes = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Builder sizing(Sizing sizing) {
            this.sizing = sizing;
            return this;
        }

        public Builder startTimeout(Duration base) {
            this.startTimeoutBase = base;
            return this;
        }

        public Builder startTimeoutPolicy(StartTimeoutPolicy policy) {
            this.startTimeoutPolicy = policy;
            return this;
        }

        public Builder defaultDomain(String defaultDomain) {
            this.defaultDomain = defaultDomain;
            return this;
        }

        public Builder customDomain(String domain, String targetDomain) {
            this.customDomains.add(new CustomDomain(domain, targetDomain));
            return this;
        }

        public Builder route(String path, String applicationId) {
            this.routes.add(new Route(path, applicationId));
            return this;
        }

        public Router build() {
            return new Router(this);
        }
    }
}
