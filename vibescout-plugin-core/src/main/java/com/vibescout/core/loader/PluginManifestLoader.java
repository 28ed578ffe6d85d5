package com.vibescout.core.loader;

import com.vibescout.api.PluginApi;
import com.vibescout.core.exception.ManifestException;
import com.vibescout.core.manifest.Capability;
import com.vibescout.core.manifest.PluginManifest;
import lombok.Getter;
import lombok.Setter;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * plugin.yml 解析器
 */
public class PluginManifestLoader {

    public static final String MANIFEST_FILE = "plugin.yml";

    private PluginManifestLoader() {
    }

    public static PluginManifest load(Path manifestFile) {
        try (InputStream in = Files.newInputStream(manifestFile)) {
            return load(in);
        } catch (IOException e) {
            throw new ManifestException("Cannot read manifest " + manifestFile + ": " + e.getMessage(), e);
        }
    }

    public static PluginManifest load(InputStream inputStream) {
        // SnakeYAML 2.x 建议显式传入 LoaderOptions
        // 不放开 TagInspector：清单来源不可信，禁止全局 tag 实例化任意类
        LoaderOptions options = new LoaderOptions();

        Constructor constructor = new Constructor(ManifestDocument.class, options);
        // 未知字段直接忽略，兼容新版本清单
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);

        ManifestDocument doc;
        try {
            doc = new Yaml(constructor).load(inputStream);
        } catch (YAMLException e) {
            throw new ManifestException("Malformed manifest: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ManifestException("Manifest is empty");
        }
        return doc.toManifest();
    }

    // ==================== 嵌套类 ====================

    /**
     * 对应 plugin.yml 的根节点 (仅用于反序列化)
     */
    @Getter
    @Setter
    public static class ManifestDocument {
        private String name;
        private String version;
        private String main;
        private String mainClass;
        private String description;
        private String author;
        private String homepage;
        private ScoutSection vibescout;

        PluginManifest toManifest() {
            if (name == null || name.isBlank()) {
                throw new ManifestException("Manifest field 'name' is required");
            }
            if (version == null || version.isBlank()) {
                throw new ManifestException("Manifest field 'version' is required");
            }

            PluginManifest.PluginManifestBuilder builder = PluginManifest.builder()
                    .name(name.trim())
                    .version(version.trim())
                    .mainClass(blankToNull(mainClass))
                    .description(description)
                    .author(author)
                    .homepage(homepage);
            if (main != null && !main.isBlank()) {
                builder.main(main.trim());
            }

            if (vibescout == null) {
                // 没有 vibescout 配置块：按当前 API 版本、仅提供 extractors 处理
                return builder.apiVersion(PluginApi.VERSION)
                        .capability(Capability.EXTRACTORS)
                        .build();
            }

            if (vibescout.getApiVersion() != null) {
                builder.apiVersion(vibescout.getApiVersion().trim());
            }
            if (vibescout.getCapabilities() != null) {
                for (String capability : vibescout.getCapabilities()) {
                    try {
                        builder.capability(Capability.parse(capability));
                    } catch (IllegalArgumentException e) {
                        throw new ManifestException("Unknown capability '" + capability + "'", e);
                    }
                }
            }
            builder.builtin(vibescout.isBuiltin());

            CompatibilitySection compat = vibescout.getCompatibility();
            if (compat != null) {
                builder.compatibility(new PluginManifest.Compatibility(
                        blankToNull(compat.getMinHostVersion()),
                        blankToNull(compat.getMaxHostVersion())));
            }

            SandboxSection sandbox = vibescout.getSandbox();
            if (sandbox != null) {
                List<String> requires = sandbox.getRequires() != null
                        ? List.copyOf(sandbox.getRequires())
                        : List.of();
                builder.sandbox(new PluginManifest.SandboxRequirements(
                        requires, sandbox.getTimeoutMs(), blankToNull(sandbox.getMaxMemory())));
            }
            return builder.build();
        }
    }

    @Getter
    @Setter
    public static class ScoutSection {
        private String apiVersion;
        private List<String> capabilities = new ArrayList<>();
        private boolean builtin;
        private CompatibilitySection compatibility;
        private SandboxSection sandbox;
    }

    @Getter
    @Setter
    public static class CompatibilitySection {
        private String minHostVersion;
        private String maxHostVersion;
    }

    @Getter
    @Setter
    public static class SandboxSection {
        private List<String> requires = new ArrayList<>();
        private Integer timeoutMs;
        private String maxMemory;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
