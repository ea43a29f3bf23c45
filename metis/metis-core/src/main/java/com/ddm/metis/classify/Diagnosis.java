package com.ddm.metis.classify;

import com.ddm.metis.defined.DeploymentContext;

import java.util.List;

/**
 * 上下文判定的诊断信息，仅用于排查，不影响判定结果。
 *
 * @param context         判定结果
 * @param ciDetected      检测到 CI 标记
 * @param runtimeRequired 设置了 RUNTIME_CONFIG_REQUIRED
 * @param storeConfigured 设置了 PARAMETER_STORE_PREFIX
 * @param runtimeDetected 检测到 Lambda / ECS 运行时标记
 * @param previewDetected APP_ENV 为 pr-N
 * @param warnings        可读的告警信息
 * @author liyifei
 */
public record Diagnosis(DeploymentContext context,
                        boolean ciDetected,
                        boolean runtimeRequired,
                        boolean storeConfigured,
                        boolean runtimeDetected,
                        boolean previewDetected,
                        List<String> warnings) {

    public Diagnosis {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
