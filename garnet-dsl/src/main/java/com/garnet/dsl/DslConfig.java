package com.garnet.dsl;

import com.garnet.core.GarnetException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DSL pass 配置，JSON 格式：
 *
 * <pre>
 * { "disabledRules": [], "verifyOwnership": false, "logRewrites": true }
 * </pre>
 */
public class DslConfig {

    public static final String RESOURCE = "garnet-dsl.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** 不参与匹配的规则名称 */
    private List<String> disabledRules = new ArrayList<>();
    /** 结束后校验结果仍是一棵树 */
    private boolean verifyOwnership = false;
    /** 输出 FINE 级别的改写日志 */
    private boolean logRewrites = true;

    public DslConfig() {
    }

    /**
     * 读取 classpath 上的默认配置；资源不存在时使用内置默认值。
     */
    public static DslConfig load() {
        InputStream in = DslConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            return new DslConfig();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new GarnetException("无法读取 DSL 配置: " + RESOURCE, e);
        }
    }

    public static DslConfig fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    public static DslConfig fromJson(Reader reader) {
        DslConfig config;
        try {
            config = GSON.fromJson(reader, DslConfig.class);
        } catch (JsonParseException e) {
            throw new GarnetException("DSL 配置格式错误: " + e.getMessage(), e);
        }
        if (config == null) {
            return new DslConfig();
        }
        if (config.disabledRules == null) {
            config.disabledRules = new ArrayList<>();
        }
        return config;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public List<String> getDisabledRules() {
        return disabledRules;
    }

    public DslConfig setDisabledRules(String... names) {
        this.disabledRules = new ArrayList<>(Arrays.asList(names));
        return this;
    }

    public boolean isVerifyOwnership() {
        return verifyOwnership;
    }

    public DslConfig setVerifyOwnership(boolean verifyOwnership) {
        this.verifyOwnership = verifyOwnership;
        return this;
    }

    public boolean isLogRewrites() {
        return logRewrites;
    }

    public DslConfig setLogRewrites(boolean logRewrites) {
        this.logRewrites = logRewrites;
        return this;
    }
}
