package xyz.firestige.engine.domain.chart;

/**
 * 集群基础组件使用的命名空间
 */
public final class ChartNamespaces {

    public static final String KUBE_SYSTEM = "kube-system";
    public static final String CERT_MANAGER = "cert-manager";
    public static final String PROMETHEUS = "prometheus";
    public static final String LOGGING = "logging";
    public static final String NGINX_INGRESS = "nginx-ingress";
    public static final String ENGINE_SYSTEM = "engine-system";

    private ChartNamespaces() {
    }
}
