package xyz.firestige.engine.infrastructure.dns;

/**
 * 就绪探测结果
 * <p>
 * 未确认时 value 为原始输入，调用方只能把它当作尽力而为的提示。
 */
public final class ReadinessOutcome {

    private final String input;
    private final String value;
    private final boolean confirmed;
    private final int attempts;

    private ReadinessOutcome(String input, String value, boolean confirmed, int attempts) {
        this.input = input;
        this.value = value;
        this.confirmed = confirmed;
        this.attempts = attempts;
    }

    static ReadinessOutcome confirmed(String input, String resolved, int attempts) {
        return new ReadinessOutcome(input, resolved, true, attempts);
    }

    static ReadinessOutcome unconfirmed(String input, int attempts) {
        return new ReadinessOutcome(input, input, false, attempts);
    }

    public String getInput() {
        return input;
    }

    public String getValue() {
        return value;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    /**
     * 预算耗尽仍未确认，只产生警告
     */
    public boolean isWarning() {
        return !confirmed;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "ReadinessOutcome{" + input + " -> " + value + ", confirmed=" + confirmed + ", attempts=" + attempts + "}";
    }
}
