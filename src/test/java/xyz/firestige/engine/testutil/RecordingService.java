package xyz.firestige.engine.testutil;

import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.service.Action;
import xyz.firestige.engine.domain.service.RenderContext;
import xyz.firestige.engine.domain.service.Service;
import xyz.firestige.engine.domain.service.ServiceType;
import xyz.firestige.engine.domain.service.Sizing;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 记录钩子调用的服务
 * <p>
 * 调用按 "id:hook" 追加到共享的 {@link HookJournal}，可以指定某些钩子失败。
 */
public class RecordingService implements Service {

    private final String id;
    private final ServiceType type;
    private final Action action;
    private final HookJournal journal;
    private final Set<String> failingHooks = new HashSet<>();
    private final ProgressListeners listeners = new ProgressListeners();

    public RecordingService(String id, ServiceType type, Action action, HookJournal journal) {
        this.id = id;
        this.type = type;
        this.action = action;
        this.journal = journal;
    }

    public static RecordingService application(String id, HookJournal journal) {
        return new RecordingService(id, ServiceType.APPLICATION, Action.CREATE, journal);
    }

    public static RecordingService database(String id, HookJournal journal) {
        return new RecordingService(id, ServiceType.DATABASE, Action.CREATE, journal);
    }

    /**
     * @param hook 例如 "onCreate"、"onCreateCheck"
     */
    public RecordingService failOn(String hook) {
        failingHooks.add(hook);
        return this;
    }

    public List<String> calls() {
        return journal.callsOf(id);
    }

    private void record(String hook) {
        journal.record(id, hook);
        if (failingHooks.contains(hook)) {
            throw EngineException.execution(id + " " + hook + " failed", "simulated failure of " + hook + " on " + id);
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return id;
    }

    @Override
    public String getSanitizedName() {
        return type.name().toLowerCase() + "-" + id;
    }

    @Override
    public String getReleaseName() {
        return getSanitizedName();
    }

    @Override
    public ServiceType getType() {
        return type;
    }

    @Override
    public Action getAction() {
        return action;
    }

    @Override
    public Sizing getSizing() {
        return Sizing.single("100m", 128);
    }

    @Override
    public Optional<Integer> getPrivatePort() {
        return Optional.empty();
    }

    @Override
    public Duration getStartTimeout() {
        return Duration.ofSeconds(30);
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public ProgressListeners getListeners() {
        return listeners;
    }

    @Override
    public Optional<String> podSelector(DeploymentTarget target) {
        return Optional.empty();
    }

    @Override
    public RenderContext renderContext(DeploymentTarget target) {
        return new RenderContext().put("id", id);
    }

    @Override
    public void onCreateCheck(DeploymentTarget target) {
        record("onCreateCheck");
    }

    @Override
    public void onCreate(DeploymentTarget target) {
        record("onCreate");
    }

    @Override
    public void onCreateError(DeploymentTarget target) {
        record("onCreateError");
    }

    @Override
    public void onPauseCheck(DeploymentTarget target) {
        record("onPauseCheck");
    }

    @Override
    public void onPause(DeploymentTarget target) {
        record("onPause");
    }

    @Override
    public void onPauseError(DeploymentTarget target) {
        record("onPauseError");
    }

    @Override
    public void onDeleteCheck(DeploymentTarget target) {
        record("onDeleteCheck");
    }

    @Override
    public void onDelete(DeploymentTarget target) {
        record("onDelete");
    }

    @Override
    public void onDeleteError(DeploymentTarget target) {
        record("onDeleteError");
    }
}
