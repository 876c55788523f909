package xyz.firestige.engine.domain.template;

import java.nio.file.Path;
import java.util.Map;

/**
 * 模板渲染端口
 * <p>
 * 编排逻辑只提供上下文并使用渲染结果目录，从不检查渲染内容。
 */
public interface TemplateRenderer {

    /**
     * @param templateDir 模板目录
     * @param context 渲染上下文（字符串、数字、嵌套结构）
     * @param outputDir 输出目录
     * @return 渲染结果目录
     * @throws xyz.firestige.engine.domain.shared.exception.EngineException 模板缺失或渲染失败
     */
    Path render(Path templateDir, Map<String, Object> context, Path outputDir);
}
