package xyz.firestige.engine.infrastructure.external.command;

/**
 * 外部命令执行结果
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
