package com.fastdispatch.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 命令行参数 -> Spring 配置
 * 支持 "--jobs 12" 与 "--jobs=12" 两种写法，未识别的参数原样透传给 Spring
 */
public final class DispatchArgs {

    public static final String DEFAULT_DB = "dispatcher.db";

    private static final Map<String, Option> OPTIONS = new LinkedHashMap<>();

    static {
        OPTIONS.put("--jobs", new Option("dispatch.jobs", Kind.INT, ""));
        OPTIONS.put("--max-retries", new Option("dispatch.default-max-retry", Kind.INT, ""));
        OPTIONS.put("--mean-ms", new Option("dispatch.service.mean", Kind.INT, "ms"));
        OPTIONS.put("--stddev-ms", new Option("dispatch.service.stddev", Kind.INT, "ms"));
        OPTIONS.put("--base-backoff-ms", new Option("dispatch.backoff.base", Kind.INT, "ms"));
        OPTIONS.put("--seed", new Option("dispatch.random.seed", Kind.LONG, ""));
        OPTIONS.put("--jsonl", new Option("dispatch.sink.jsonl.path", Kind.TEXT, ""));
        OPTIONS.put("--db", new Option("spring.datasource.url", Kind.DB, ""));
    }

    private DispatchArgs() {
    }

    /**
     * 转换为 Spring Boot 可识别的 --key=value 参数
     * @throws IllegalArgumentException 数值参数无法解析或缺少取值
     */
    public static String[] toSpringArgs(String[] args) {
        List<String> out = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String key = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                key = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            Option opt = OPTIONS.get(key);
            if (opt == null) {
                out.add(arg);
                continue;
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + key);
                }
                value = args[++i];
            }
            out.add("--" + opt.property + "=" + opt.convert(key, value));
        }
        return out.toArray(new String[0]);
    }

    /** 从 JDBC URL 中取回数据库文件路径，用于启动输出 */
    public static String dbPath(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            return DEFAULT_DB;
        }
        return jdbcUrl.startsWith("jdbc:sqlite:") ? jdbcUrl.substring("jdbc:sqlite:".length()) : jdbcUrl;
    }

    private enum Kind { INT, LONG, TEXT, DB }

    private static final class Option {
        private final String property;
        private final Kind kind;
        private final String unit;

        private Option(String property, Kind kind, String unit) {
            this.property = property;
            this.kind = kind;
            this.unit = unit;
        }

        private String convert(String key, String raw) {
            String v = raw.trim();
            try {
                return switch (kind) {
                    case INT -> Integer.parseInt(v) + unit;
                    case LONG -> Long.parseLong(v) + unit;
                    case TEXT -> v;
                    case DB -> "jdbc:sqlite:" + v;
                };
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid number for " + key + ": " + raw, e);
            }
        }
    }
}
