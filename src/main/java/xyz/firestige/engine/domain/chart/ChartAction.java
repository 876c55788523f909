package xyz.firestige.engine.domain.chart;

public enum ChartAction {
    INSTALL,
    DESTROY
}
