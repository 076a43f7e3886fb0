package com.mcpforge.wikiagent.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 兼容 README 中的单横线启动参数（-lang de、-port=9090、-addr 127.0.0.1），
 * 转换为 Spring Boot 识别的 --key=value 形式；其他参数原样透传。
 */
public final class CommandLineFlags {

    private static final Map<String, String> FLAG_TO_PROPERTY = Map.of(
            "lang", "app.wikipedia.lang",
            "addr", "server.address",
            "port", "server.port"
    );

    private CommandLineFlags() {
    }

    public static String[] translate(String[] args) {
        if (args == null || args.length == 0) {
            return new String[0];
        }
        List<String> out = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null || !arg.startsWith("-") || arg.startsWith("--")) {
                out.add(arg);
                continue;
            }
            String flag = arg.substring(1);
            String value = null;
            int eq = flag.indexOf('=');
            if (eq >= 0) {
                value = flag.substring(eq + 1);
                flag = flag.substring(0, eq);
            }
            String property = FLAG_TO_PROPERTY.get(flag);
            if (property == null) {
                out.add(arg);
                continue;
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("flag needs an argument: -" + flag);
                }
                value = args[++i];
            }
            out.add("--" + property + "=" + value);
        }
        return out.toArray(new String[0]);
    }
}
