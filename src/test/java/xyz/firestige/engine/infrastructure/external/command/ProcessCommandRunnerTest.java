package xyz.firestige.engine.infrastructure.external.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import xyz.firestige.engine.domain.shared.exception.CommandException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 测试目标：ProcessCommandRunner 的输出采集、退出码与超时
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesStdoutStderrAndExitCode() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"),
                null, null, Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
    }

    @Test
    void passesEnvironment() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo $KUBECONFIG"),
                Map.of("KUBECONFIG", "/tmp/kubeconfig"), null, Duration.ofSeconds(10));

        assertThat(result.stdout().trim()).isEqualTo("/tmp/kubeconfig");
    }

    @Test
    void timesOutLongRunningCommand() {
        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "sleep 30"), null, null, Duration.ofMillis(300)))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void missingBinaryCannotStart() {
        assertThatThrownBy(() -> runner.run(List.of("definitely-not-a-binary-xyz"), null, null, Duration.ofSeconds(5)))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("Unable to start");
    }

    @Test
    void largeOutputIsDrainedWhileCommonPoolIsBusy() throws InterruptedException {
        // 占满公共线程池，输出读取不能依赖它
        int parallelism = ForkJoinPool.getCommonPoolParallelism();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(parallelism);
        List<CompletableFuture<Void>> blockers = new ArrayList<>();
        for (int i = 0; i < parallelism; i++) {
            blockers.add(CompletableFuture.runAsync(() -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
        }
        try {
            started.await();

            CommandResult result = runner.run(
                    List.of("sh", "-c", "head -c 300000 /dev/zero >&2; echo done"),
                    null, null, Duration.ofSeconds(5));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.stdout().trim()).isEqualTo("done");
            assertThat(result.stderr()).hasSize(300000);
        } finally {
            release.countDown();
            blockers.forEach(CompletableFuture::join);
        }
    }
}
