package xyz.firestige.engine.infrastructure.external.command;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 外部命令执行端口
 */
public interface CommandRunner {

    /**
     * 执行命令并等待完成
     *
     * @throws xyz.firestige.engine.domain.shared.exception.CommandException 无法启动或超时
     */
    CommandResult run(List<String> command, Map<String, String> environment, Path workingDirectory, Duration timeout);
}
