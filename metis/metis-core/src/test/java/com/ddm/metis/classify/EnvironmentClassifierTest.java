package com.ddm.metis.classify;

import com.ddm.metis.defined.DeploymentContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link EnvironmentClassifier} 的单元测试。
 *
 * @author liyifei
 */
class EnvironmentClassifierTest {

    private static DeploymentContext classify(Map<String, String> env) {
        return new EnvironmentClassifier(env).classify();
    }

    @Test
    void testClassify_NoSignalsIsLocal() {
        assertEquals(DeploymentContext.LOCAL, classify(Map.of()));
        assertEquals(DeploymentContext.LOCAL, classify(Map.of("CI", "false", "APP_ENV", "development")));
    }

    @Test
    void testClassify_CiMarkersAreBuildTime() {
        assertEquals(DeploymentContext.BUILD_TIME, classify(Map.of("CI", "true")));
        assertEquals(DeploymentContext.BUILD_TIME, classify(Map.of("GITHUB_ACTIONS", "TRUE")));
        assertEquals(DeploymentContext.BUILD_TIME, classify(Map.of("BUILDKITE", "1")));
        assertEquals(DeploymentContext.BUILD_TIME, classify(Map.of("JENKINS_URL", "https://jenkins.local/")));
    }

    @Test
    void testClassify_CiWinsOverRuntimeSignals() {
        assertEquals(DeploymentContext.BUILD_TIME,
                classify(Map.of("CI", "yes", "PARAMETER_STORE_PREFIX", "/app/dev/")));
    }

    @Test
    void testClassify_RuntimeRequiredOverridesCi() {
        assertEquals(DeploymentContext.MANAGED_RUNTIME,
                classify(Map.of("CI", "true", "RUNTIME_CONFIG_REQUIRED", "true", "PARAMETER_STORE_PREFIX", "/app/dev/")));
        assertEquals(DeploymentContext.LOCAL,
                classify(Map.of("CI", "true", "RUNTIME_CONFIG_REQUIRED", "1")));
    }

    @Test
    void testClassify_ManagedRuntimeSignals() {
        assertEquals(DeploymentContext.MANAGED_RUNTIME, classify(Map.of("PARAMETER_STORE_PREFIX", "/app/prod/")));
        assertEquals(DeploymentContext.MANAGED_RUNTIME, classify(Map.of("AWS_LAMBDA_FUNCTION_NAME", "api")));
        assertEquals(DeploymentContext.MANAGED_RUNTIME,
                classify(Map.of("ECS_CONTAINER_METADATA_URI_V4", "http://169.254.170.2/v4/abc")));
        assertEquals(DeploymentContext.MANAGED_RUNTIME, classify(Map.of("APP_ENV", "pr-17")));
    }

    @Test
    void testClassify_BlankSignalsIgnored() {
        assertEquals(DeploymentContext.LOCAL, classify(Map.of("PARAMETER_STORE_PREFIX", "  ", "JENKINS_URL", "")));
    }

    @Test
    void testDiagnose_WarnsWithoutChangingClassification() {
        EnvironmentClassifier classifier = new EnvironmentClassifier(Map.of("APP_ENV", "pr-3"));

        Diagnosis diagnosis = classifier.diagnose();

        assertEquals(classifier.classify(), diagnosis.context());
        assertTrue(diagnosis.previewDetected());
        assertFalse(diagnosis.storeConfigured());
        assertTrue(diagnosis.hasWarnings());
    }

    @Test
    void testDiagnose_ProductionBuildWarning() {
        Diagnosis diagnosis = new EnvironmentClassifier(Map.of("CI", "true", "NODE_ENV", "production")).diagnose();

        assertEquals(DeploymentContext.BUILD_TIME, diagnosis.context());
        assertTrue(diagnosis.ciDetected());
        assertEquals(1, diagnosis.warnings().size());
    }
}
