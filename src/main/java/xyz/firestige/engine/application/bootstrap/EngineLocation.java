package xyz.firestige.engine.application.bootstrap;

import xyz.firestige.engine.domain.chart.ChartAction;

/**
 * 部署引擎运行位置：集群内运行时安装引擎 chart，托管运行时移除
 */
public enum EngineLocation {

    CLUSTER_SIDE(ChartAction.INSTALL),
    HOSTED(ChartAction.DESTROY);

    private final ChartAction chartAction;

    EngineLocation(ChartAction chartAction) {
        this.chartAction = chartAction;
    }

    public ChartAction chartAction() {
        return chartAction;
    }
}
