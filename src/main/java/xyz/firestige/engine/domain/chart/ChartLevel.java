package xyz.firestige.engine.domain.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 安装层级
 * <p>
 * 同一层内的 chart 相互无依赖，可以任意顺序（或并行）安装；必须在所有更低层级成功之后才开始。
 */
public final class ChartLevel {

    private final int number;
    private final List<ChartInfo> charts;

    public ChartLevel(int number, List<ChartInfo> charts) {
        if (number < 1) {
            throw new IllegalArgumentException("level number starts at 1");
        }
        this.number = number;
        this.charts = List.copyOf(charts);
    }

    public int getNumber() {
        return number;
    }

    public List<ChartInfo> getCharts() {
        return charts;
    }

    public boolean isEmpty() {
        return charts.isEmpty();
    }

    public List<String> chartNames() {
        List<String> names = new ArrayList<>(charts.size());
        charts.forEach(c -> names.add(c.getName()));
        return Collections.unmodifiableList(names);
    }

    /**
     * 校验层级列表中 chart 名称唯一
     */
    public static void requireUniqueNames(List<ChartLevel> levels) {
        Set<String> seen = new HashSet<>();
        for (ChartLevel level : levels) {
            for (ChartInfo chart : level.charts) {
                if (!seen.add(chart.getName())) {
                    throw new IllegalStateException("duplicate chart name in installation plan: " + chart.getName());
                }
            }
        }
    }

    @Override
    public String toString() {
        return "Level" + number + chartNames();
    }
}
