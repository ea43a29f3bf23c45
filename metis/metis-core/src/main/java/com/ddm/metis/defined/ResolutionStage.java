package com.ddm.metis.defined;

/**
 * 单次解析调用的阶段：
 * {@code IDLE → CLASSIFYING → LOADING → VALIDATING → MAPPING → DONE | FAILED}。
 *
 * @author liyifei
 */
public enum ResolutionStage {
    IDLE("idle"),
    CLASSIFYING("classifying"),
    LOADING("loading"),
    VALIDATING("validating"),
    MAPPING("mapping"),
    DONE("done"),
    FAILED("failed");

    private final String label;

    ResolutionStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
