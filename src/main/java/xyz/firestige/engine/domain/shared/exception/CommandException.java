package xyz.firestige.engine.domain.shared.exception;

import java.util.List;

/**
 * 外部命令执行失败（helm / kubectl）
 */
public class CommandException extends EngineException {

    private final List<String> command;
    private final int exitCode;

    public CommandException(List<String> command, int exitCode, String safeMessage, String rawMessage) {
        super(FailureInfo.of(ErrorType.COMMAND_ERROR, safeMessage, rawMessage));
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }

    public CommandException(List<String> command, String safeMessage, Throwable cause) {
        super(FailureInfo.of(ErrorType.COMMAND_ERROR, safeMessage, cause.toString()), cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }

    public List<String> getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }
}
