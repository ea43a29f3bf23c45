package com.ddm.metis.classify;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 判定部署上下文所依据的环境变量。
 *
 * @author liyifei
 */
public final class Signals {
    private Signals() {
    }

    // ===== CI markers (truthy) =====
    public static final String CI = "CI";
    public static final String GITHUB_ACTIONS = "GITHUB_ACTIONS";
    public static final String GITLAB_CI = "GITLAB_CI";
    public static final String CIRCLECI = "CIRCLECI";
    public static final String BUILDKITE = "BUILDKITE";
    public static final List<String> CI_FLAGS = List.of(CI, GITHUB_ACTIONS, GITLAB_CI, CIRCLECI, BUILDKITE);

    /**
     * Jenkins 只设置 URL，非空即视为 CI
     */
    public static final String JENKINS_URL = "JENKINS_URL";

    /**
     * 在 CI 中强制走运行时配置（例如集成测试）
     */
    public static final String RUNTIME_CONFIG_REQUIRED = "RUNTIME_CONFIG_REQUIRED";

    // ===== Managed runtime =====
    public static final String PARAMETER_STORE_PREFIX = "PARAMETER_STORE_PREFIX";
    public static final String AWS_LAMBDA_FUNCTION_NAME = "AWS_LAMBDA_FUNCTION_NAME";
    public static final String ECS_CONTAINER_METADATA_URI_V4 = "ECS_CONTAINER_METADATA_URI_V4";
    public static final List<String> RUNTIME_MARKERS = List.of(AWS_LAMBDA_FUNCTION_NAME, ECS_CONTAINER_METADATA_URI_V4);

    /**
     * 预览环境：APP_ENV=pr-123
     */
    public static final String APP_ENV = "APP_ENV";
    public static final Pattern PREVIEW_ENV = Pattern.compile("pr-\\d+");

    public static final String NODE_ENV = "NODE_ENV";
}
