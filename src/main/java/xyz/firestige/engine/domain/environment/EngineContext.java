package xyz.firestige.engine.domain.environment;

import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.domain.template.TemplateRenderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 引擎运行上下文：工作目录、模板库目录与模板渲染器
 */
public final class EngineContext {

    private final Path workspaceRoot;
    private final Path libRoot;
    private final boolean testCluster;
    private final TemplateRenderer templateRenderer;

    public EngineContext(Path workspaceRoot, Path libRoot, boolean testCluster, TemplateRenderer templateRenderer) {
        this.workspaceRoot = Objects.requireNonNull(workspaceRoot, "workspaceRoot");
        this.libRoot = Objects.requireNonNull(libRoot, "libRoot");
        this.testCluster = testCluster;
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer");
    }

    /**
     * &lt;workspace-root&gt;/&lt;execution-id&gt;/&lt;name&gt;，不同执行之间互不冲突
     */
    public Path workspaceDir(ExecutionId executionId, String name) {
        return workspaceRoot.resolve(executionId.getValue()).resolve(name);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public Path getLibRoot() {
        return libRoot;
    }

    public boolean isTestCluster() {
        return testCluster;
    }

    public TemplateRenderer getTemplateRenderer() {
        return templateRenderer;
    }
}
