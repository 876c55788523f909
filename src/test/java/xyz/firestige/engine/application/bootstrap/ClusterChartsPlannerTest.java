package xyz.firestige.engine.application.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.engine.domain.chart.ChartAction;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.chart.ChartLevel;
import xyz.firestige.engine.domain.chart.ChartNamespaces;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.version.VersionsNumber;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ClusterChartsPlannerTest {

    private static final List<List<String>> BASE_LEVELS = List.of(
            List.of("storage-class", "coredns-config"),
            List.of("container-registry-secret", "cert-manager"),
            List.of(),
            List.of("metrics-server", "external-dns"),
            List.of("ingress-nginx", "pleco"),
            List.of("cert-manager-configs", "cluster-agent", "shell-agent", "deployment-engine", "pod-recycler", "token-rotate"));

    @TempDir
    Path tempDir;

    private ClusterChartsPlanner planner;
    private Path outputs;
    private Path libRoot;

    @BeforeEach
    void setUp() throws URISyntaxException {
        planner = new ClusterChartsPlanner(new ObjectMapper());
        outputs = fixture("infrastructure-outputs.json");
        libRoot = tempDir.resolve("lib");
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(ClusterChartsPlannerTest.class.getResource("/fixtures/" + name).toURI());
    }

    private static ChartsConfigPrerequisites.Builder prerequisites() {
        return ChartsConfigPrerequisites.builder("org-1", "z1234")
                .clusterName("qovery-z1234")
                .region("eu-west-3")
                .cloudProvider("aws")
                .managedDns("z1234.example.com", List.of("8.8.8.8", "1.1.1.1"))
                .externalDns("cloudflare", "ops@example.com", "token")
                .acme("ops@example.com", "https://acme-staging-v02.api.letsencrypt.org/directory");
    }

    private static List<List<String>> names(List<ChartLevel> levels) {
        return levels.stream().map(ChartLevel::chartNames).collect(Collectors.toList());
    }

    private static ChartInfo chart(List<ChartLevel> levels, String name) {
        return levels.stream()
                .flatMap(level -> level.getCharts().stream())
                .filter(chart -> chart.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void allFlagsOff_producesBaseCatalogue() {
        List<ChartLevel> levels = planner.plan(outputs, prerequisites().build(), libRoot, "aws");

        assertThat(levels).hasSize(ClusterChartsPlanner.LEVEL_COUNT);
        assertThat(levels).extracting(ChartLevel::getNumber).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(names(levels)).isEqualTo(BASE_LEVELS);
    }

    @Test
    void metricsToggle_addsExactlyThreeUnitsToTheirLevels() {
        ChartsConfigPrerequisites withoutMetrics = prerequisites().logHistoryEnabled(true).build();
        ChartsConfigPrerequisites withMetrics = withoutMetrics.toBuilder().metricsHistoryEnabled(true).build();

        List<List<String>> before = names(planner.plan(outputs, withoutMetrics, libRoot, "aws"));
        List<List<String>> after = names(planner.plan(outputs, withMetrics, libRoot, "aws"));
        List<List<String>> toggledBack = names(planner.plan(outputs, withMetrics.toBuilder().metricsHistoryEnabled(false).build(), libRoot, "aws"));

        List<String> added = new ArrayList<>();
        for (int i = 0; i < ClusterChartsPlanner.LEVEL_COUNT; i++) {
            assertThat(after.get(i)).containsAll(before.get(i));
            List<String> diff = new ArrayList<>(after.get(i));
            diff.removeAll(before.get(i));
            added.addAll(diff);
        }
        assertThat(added).containsExactlyInAnyOrder("kube-prometheus-stack", "prometheus-adapter", "kube-state-metrics");
        assertThat(after.get(1)).contains("kube-prometheus-stack");
        assertThat(after.get(3)).contains("prometheus-adapter", "kube-state-metrics");
        assertThat(toggledBack).isEqualTo(before);
    }

    @Test
    void logsToggle_addsShipperAndAggregator() {
        List<ChartLevel> levels = planner.plan(outputs, prerequisites().logHistoryEnabled(true).build(), libRoot, "aws");

        assertThat(levels.get(2).chartNames()).containsExactly("promtail");
        assertThat(levels.get(3).chartNames()).contains("loki");
        assertThat(levels.get(5).chartNames()).contains("grafana");

        ChartInfo promtail = chart(levels, "promtail");
        assertThat(promtail.getNamespace()).isEqualTo(ChartNamespaces.KUBE_SYSTEM);
        assertThat(promtail.getLastBreakingVersion()).contains(VersionsNumber.parse("0.24.0"));
        assertThat(chart(levels, "loki").getValues())
                .anySatisfy(v -> assertThat(v.toArgument()).isEqualTo("config.storage_config.aws.bucketnames=engine-logs-z1234"));
    }

    @Test
    void lifecycleDaemonDisabled_removesPlecoOnly() {
        List<ChartLevel> levels = planner.plan(outputs, prerequisites().lifecycleDaemonDisabled(true).build(), libRoot, "aws");

        assertThat(levels.get(4).chartNames()).containsExactly("ingress-nginx");
        assertThat(levels.get(5).chartNames()).isEqualTo(BASE_LEVELS.get(5));
    }

    @Test
    void certificateIssuerConfigIsPlacedAfterCertificateController() {
        List<ChartLevel> levels = planner.plan(outputs, prerequisites().build(), libRoot, "aws");

        int controllerLevel = levelOf(levels, "cert-manager");
        int issuerLevel = levelOf(levels, "cert-manager-configs");
        assertThat(issuerLevel).isGreaterThan(controllerLevel);
    }

    private static int levelOf(List<ChartLevel> levels, String chart) {
        return levels.stream().filter(l -> l.chartNames().contains(chart)).findFirst().orElseThrow().getNumber();
    }

    @Test
    void timeoutsAndEngineAction() {
        List<ChartLevel> hosted = planner.plan(outputs, prerequisites().build(), libRoot, "aws");
        List<ChartLevel> clusterSide = planner.plan(outputs,
                prerequisites().engineLocation(EngineLocation.CLUSTER_SIDE).metricsHistoryEnabled(true).build(), libRoot, "aws");

        assertThat(chart(hosted, "ingress-nginx").getTimeout().toSeconds()).isEqualTo(800);
        assertThat(chart(hosted, "deployment-engine").getTimeout().toSeconds()).isEqualTo(900);
        assertThat(chart(hosted, "deployment-engine").getAction()).isEqualTo(ChartAction.DESTROY);
        assertThat(chart(clusterSide, "deployment-engine").getAction()).isEqualTo(ChartAction.INSTALL);
        assertThat(chart(clusterSide, "kube-prometheus-stack").getTimeout().toSeconds()).isEqualTo(480);
        assertThat(chart(hosted, "storage-class").getPath()).isEqualTo(libRoot.resolve("aws/charts/storage-class").toString());
        assertThat(chart(hosted, "cert-manager").getPath()).isEqualTo(libRoot.resolve("common/charts/cert-manager").toString());
        assertThat(chart(hosted, "cert-manager").getBackupResources()).contains("cert", "issuer", "clusterissuer");
    }

    @Test
    void unparseableOutputs_failBeforeAnyLevel() throws URISyntaxException {
        Path invalid = fixture("infrastructure-outputs-invalid.json");

        EngineException e = catchThrowableOfType(
                () -> planner.plan(invalid, prerequisites().build(), libRoot, "aws"), EngineException.class);

        assertThat(e.getErrorType()).isEqualTo(ErrorType.CONFIGURATION_ERROR);
        assertThat(e.getFailureInfo().getSafeMessage())
                .isEqualTo("Error while parsing infrastructure outputs file infrastructure-outputs-invalid.json");
    }

    @Test
    void missingRequiredOutput_isParseFailure() throws Exception {
        Path partial = tempDir.resolve("partial.json");
        Files.writeString(partial, "{\"log_storage_region\": \"eu-west-3\"}");

        assertThatThrownBy(() -> planner.plan(partial, prerequisites().build(), libRoot, "aws"))
                .isInstanceOf(EngineException.class)
                .extracting(t -> ((EngineException) t).getErrorType())
                .isEqualTo(ErrorType.CONFIGURATION_ERROR);
    }

    @Test
    void missingOutputsFile_reportsNotRendered() {
        Path missing = tempDir.resolve("does-not-exist.json");

        assertThatThrownBy(() -> planner.plan(missing, prerequisites().build(), libRoot, "aws"))
                .isInstanceOf(EngineException.class)
                .satisfies(t -> assertThat(((EngineException) t).getFailureInfo().getSafeMessage())
                        .startsWith("Can't deploy helm charts as the infrastructure outputs file has not been rendered"));
    }
}
