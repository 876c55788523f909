package xyz.firestige.engine.infrastructure.external.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.shared.exception.CommandException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 ProcessBuilder 的命令执行
 * <p>
 * 参数以列表传入，不经过 shell；每个子进程使用独立的两个读取线程消费 stdout / stderr，
 * 不依赖公共线程池，避免缓冲区写满阻塞子进程。
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Map<String, String> environment, Path workingDirectory, Duration timeout) {
        if (log.isDebugEnabled()) {
            log.debug("执行命令: {}", String.join(" ", command));
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        if (environment != null) {
            pb.environment().putAll(environment);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new CommandException(command, "Unable to start " + command.get(0), e);
        }

        ExecutorService io = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "command-io");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<String> stdout = io.submit(() -> read(process.getInputStream()));
            Future<String> stderr = io.submit(() -> read(process.getErrorStream()));

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new CommandException(command, command.get(0) + " was interrupted", e);
            }
            if (!finished) {
                process.destroyForcibly();
                throw new CommandException(command, 124, command.get(0) + " timed out after " + timeout.toSeconds() + "s",
                        "timeout while running: " + String.join(" ", command));
            }
            return new CommandResult(process.exitValue(), await(stdout), await(stderr));
        } finally {
            shutdown(io);
        }
    }

    private static void shutdown(ExecutorService io) {
        io.shutdown();
        try {
            if (!io.awaitTermination(3, TimeUnit.SECONDS)) {
                io.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            io.shutdownNow();
        }
    }

    private static String read(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    private static String await(Future<String> future) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("读取命令输出失败: {}", e.getMessage());
            return "";
        }
    }
}
