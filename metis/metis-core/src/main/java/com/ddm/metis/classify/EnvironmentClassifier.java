package com.ddm.metis.classify;

import com.ddm.metis.defined.DeploymentContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.ddm.metis.utils.EnvValues.get;
import static com.ddm.metis.utils.EnvValues.has;
import static com.ddm.metis.utils.EnvValues.isTrue;

/**
 * 根据进程环境变量判定部署上下文。
 *
 * <p>判定顺序（先匹配先返回）：
 * <ol>
 *   <li>存在 CI 标记，且未设置 {@code RUNTIME_CONFIG_REQUIRED}：{@link DeploymentContext#BUILD_TIME}</li>
 *   <li>存在参数存储前缀、Lambda/ECS 运行时标记，或 {@code APP_ENV=pr-N}：{@link DeploymentContext#MANAGED_RUNTIME}</li>
 *   <li>其它情况：{@link DeploymentContext#LOCAL}</li>
 * </ol>
 * 纯函数，不会失败。
 *
 * @author liyifei
 * @since 1.0
 */
public final class EnvironmentClassifier {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentClassifier.class);

    private final Map<String, String> env;

    public EnvironmentClassifier(Map<String, String> env) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env"));
    }

    public DeploymentContext classify() {
        if (ciDetected() && !runtimeRequired()) {
            return DeploymentContext.BUILD_TIME;
        }
        if (storeConfigured() || runtimeDetected() || previewDetected()) {
            return DeploymentContext.MANAGED_RUNTIME;
        }
        return DeploymentContext.LOCAL;
    }

    public Diagnosis diagnose() {
        DeploymentContext context = classify();
        boolean ci = ciDetected();
        boolean runtime = runtimeDetected();
        boolean store = storeConfigured();
        boolean preview = previewDetected();
        List<String> warnings = new ArrayList<>();

        if (ci && (runtime || store)) {
            warnings.add("Both CI and runtime indicators are present; classified as " + context);
        }
        if (context == DeploymentContext.MANAGED_RUNTIME && !store && !runtime) {
            warnings.add("Managed runtime inferred from APP_ENV only; no parameter store prefix or runtime marker set");
        }
        if (context == DeploymentContext.BUILD_TIME && "production".equals(get(env, Signals.NODE_ENV))) {
            warnings.add("Build-time context with NODE_ENV=production; runtime secrets will be placeholders");
        }
        Diagnosis diagnosis = new Diagnosis(context, ci, runtimeRequired(), store, runtime, preview, warnings);
        warnings.forEach(w -> log.warn("Environment detection: {}", w));
        return diagnosis;
    }

    private boolean ciDetected() {
        return Signals.CI_FLAGS.stream().anyMatch(k -> isTrue(env.get(k))) || has(env, Signals.JENKINS_URL);
    }

    private boolean runtimeRequired() {
        return isTrue(env.get(Signals.RUNTIME_CONFIG_REQUIRED));
    }

    private boolean storeConfigured() {
        return has(env, Signals.PARAMETER_STORE_PREFIX);
    }

    private boolean runtimeDetected() {
        return Signals.RUNTIME_MARKERS.stream().anyMatch(k -> has(env, k));
    }

    private boolean previewDetected() {
        String appEnv = get(env, Signals.APP_ENV);
        return appEnv != null && Signals.PREVIEW_ENV.matcher(appEnv).matches();
    }
}
