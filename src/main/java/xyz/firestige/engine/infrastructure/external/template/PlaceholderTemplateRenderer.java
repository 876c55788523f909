package xyz.firestige.engine.infrastructure.external.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.template.TemplateRenderer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 占位符模板渲染器
 * <p>
 * 把模板目录复制到输出目录，文本文件中的 {key} 替换为上下文中的值；嵌套 Map 的键用 "." 连接，
 * 列表和 Map 本身以 JSON 形式写入。{{ ... }} 形式的 helm 模板语法保持原样。
 * <p>
 * 示例：
 * - "replicas: {min_instances}" + {min_instances: 2} → "replicas: 2"
 * - "host: {database.host}" + {database: {host: "pg"}} → "host: pg"
 */
public class PlaceholderTemplateRenderer implements TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderTemplateRenderer.class);

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("(?<!\\{)\\{([a-zA-Z0-9_.-]+)\\}(?!\\})");

    private static final Set<String> TEXT_EXTENSIONS = Set.of("yaml", "yml", "json", "tpl", "txt", "tf", "conf", "toml");

    private final ObjectMapper objectMapper;

    public PlaceholderTemplateRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Path render(Path templateDir, Map<String, Object> context, Path outputDir) {
        if (!Files.isDirectory(templateDir)) {
            throw EngineException.configuration("Deployment templates are missing",
                    "template directory not found: " + templateDir, null);
        }
        Map<String, String> variables = flatten(context);
        try {
            Files.createDirectories(outputDir);
            try (Stream<Path> paths = Files.walk(templateDir)) {
                paths.forEach(source -> copy(templateDir, source, outputDir, variables));
            }
        } catch (IOException | UncheckedIOException e) {
            throw EngineException.configuration("Unable to render deployment templates",
                    templateDir + " -> " + outputDir + ": " + e.getMessage(), e);
        }
        log.debug("模板渲染完成: {} -> {}", templateDir, outputDir);
        return outputDir;
    }

    private void copy(Path root, Path source, Path outputDir, Map<String, String> variables) {
        Path target = outputDir.resolve(root.relativize(source).toString());
        try {
            if (Files.isDirectory(source)) {
                Files.createDirectories(target);
                return;
            }
            if (isText(source)) {
                String content = Files.readString(source, StandardCharsets.UTF_8);
                Files.writeString(target, resolveString(content, variables, source), StandardCharsets.UTF_8);
            } else {
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean isText(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && TEXT_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase());
    }

    /**
     * 解析字符串中的占位符
     */
    String resolveString(String template, Map<String, String> variables, Path source) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String varName = matcher.group(1);
            String value = variables.get(varName);
            if (value == null) {
                throw EngineException.configuration("Deployment template references an unknown value",
                        "Missing variable value for placeholder: {" + varName + "} in " + source, null);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    Map<String, String> flatten(Map<String, Object> context) {
        Map<String, String> variables = new HashMap<>();
        flattenInto("", context, variables);
        return variables;
    }

    private void flattenInto(String prefix, Map<?, ?> map, Map<String, String> variables) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey().toString() : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                variables.put(key, toJson(value));
                flattenInto(key, nested, variables);
            } else if (value instanceof List<?>) {
                variables.put(key, toJson(value));
            } else {
                variables.put(key, value == null ? "" : value.toString());
            }
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("context value is not serializable", e);
        }
    }
}
