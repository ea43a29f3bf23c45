package com.ddm.metis.defined;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RawEnvironment} 的单元测试。
 *
 * @author liyifei
 */
class RawEnvironmentTest {

    @Test
    void testBuilder_LastWriteWinsWithProvenance() {
        RawEnvironment env = RawEnvironment.builder()
                .put("A", "1", ConfigSource.ENVIRONMENT)
                .put("B", "2", ConfigSource.ENVIRONMENT)
                .put("A", "3", ConfigSource.LOCAL_FILE)
                .build();

        assertEquals("3", env.get("A").orElseThrow());
        assertEquals(ConfigSource.LOCAL_FILE, env.sourceOf("A").orElseThrow());
        assertEquals(List.of("B", "A"), List.copyOf(env.keys()));
        assertEquals(env.keys(), env.provenance().keySet());
    }

    @Test
    void testCountBySource_IncludesEverySource() {
        RawEnvironment env = RawEnvironment.builder()
                .putAll(Map.of("A", "1", "B", "2"), ConfigSource.REMOTE_STORE)
                .build();

        Map<ConfigSource, Integer> counts = env.countBySource();

        assertEquals(2, counts.get(ConfigSource.REMOTE_STORE));
        assertEquals(0, counts.get(ConfigSource.LOCAL_FILE));
        assertEquals(ConfigSource.values().length, counts.size());
    }

    @Test
    void testToString_DoesNotExposeValues() {
        RawEnvironment env = RawEnvironment.builder().put("API_KEY", "s3cr3t", ConfigSource.ENVIRONMENT).build();

        assertFalse(env.toString().contains("s3cr3t"));
    }

    @Test
    void testDeploymentContext_FromId() {
        assertEquals(DeploymentContext.BUILD_TIME, DeploymentContext.fromId("build-time").orElseThrow());
        assertEquals(DeploymentContext.MANAGED_RUNTIME, DeploymentContext.fromId("MANAGED_RUNTIME").orElseThrow());
        assertTrue(DeploymentContext.fromId("cloud").isEmpty());
    }
}
