package com.mcpforge.wikiagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 启动前加载工作目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${PORT}、${WIKI_LANG} 等占位符能解析到 .env 里的值。
 * 已存在的环境变量或系统属性优先，不会被 .env 覆盖。
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private DotenvLoader() {
    }

    public static Map<String, String> load() {
        return load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * @return 本次实际写入系统属性的键值
     */
    public static Map<String, String> load(Path envPath) {
        Map<String, String> loaded = new LinkedHashMap<>();
        if (!Files.isRegularFile(envPath)) {
            log.debug("No .env file at {}", envPath);
            return loaded;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            log.warn("Failed to read .env at {}: {}", envPath, e.getMessage());
            return loaded;
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            var matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            String value = unquote(matcher.group(2).trim());
            if (System.getenv(key) != null || System.getProperty(key) != null) {
                continue;
            }
            System.setProperty(key, value);
            loaded.put(key, value);
            log.info("Loaded {} = {} from .env", key, isSecret(key) ? "***" : value);
        }
        return loaded;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("TOKEN") || key.contains("SECRET");
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
