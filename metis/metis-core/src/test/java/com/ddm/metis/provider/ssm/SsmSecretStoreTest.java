package com.ddm.metis.provider.ssm;

import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.GetParametersRequest;
import software.amazon.awssdk.services.ssm.model.GetParametersResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link SsmSecretStore} 的单元测试，SsmClient 使用 Mockito 模拟。
 *
 * @author liyifei
 */
class SsmSecretStoreTest {

    private SsmClient mockClient;
    private SsmSecretStore store;

    @BeforeEach
    void setUp() {
        mockClient = mock(SsmClient.class);
        store = new SsmSecretStore(mockClient, new ParameterPaths("/macro-ai/development/"), true);
    }

    private static Parameter param(String name, String value) {
        return Parameter.builder().name(name).value(value).build();
    }

    @Test
    void testGet_ResolvesUpperSnakePath() {
        when(mockClient.getParameter(any(GetParameterRequest.class))).thenReturn(GetParameterResponse.builder()
                .parameter(param("/macro-ai/development/API_KEY", "secret"))
                .build());

        Result<String> result = store.get("api-key");

        assertEquals(Result.success("secret"), result);
        verify(mockClient).getParameter(GetParameterRequest.builder()
                .name("/macro-ai/development/API_KEY")
                .withDecryption(true)
                .build());
    }

    @Test
    void testGet_NotFoundAndUnavailable() {
        ParameterNotFoundException missing = ParameterNotFoundException.builder().message("nope").build();
        when(mockClient.getParameter(any(GetParameterRequest.class)))
                .thenThrow(missing)
                .thenThrow(missing)
                .thenThrow(SdkClientException.create("timeout"));

        ConfigError notFound = store.get("api-key").errorOptional().orElseThrow();
        ConfigError unavailable = store.get("api-key").errorOptional().orElseThrow();

        assertInstanceOf(ConfigError.NotFound.class, notFound);
        // 扁平路径与分层路径都已尝试
        assertEquals("/macro-ai/development/API_KEY, /macro-ai/development/critical/api-key",
                ((ConfigError.NotFound) notFound).location());
        assertInstanceOf(ConfigError.Unavailable.class, unavailable);
    }

    @Test
    void testGet_FallsBackToHierarchicalPath() {
        when(mockClient.getParameter(any(GetParameterRequest.class)))
                .thenThrow(ParameterNotFoundException.builder().message("nope").build())
                .thenReturn(GetParameterResponse.builder()
                        .parameter(param("/macro-ai/development/standard/cognito-user-pool-id", "pool-1"))
                        .build());

        Result<String> result = store.get("cognito-user-pool-id");

        assertEquals(Result.success("pool-1"), result);
        verify(mockClient).getParameter(GetParameterRequest.builder()
                .name("/macro-ai/development/standard/cognito-user-pool-id")
                .withDecryption(true)
                .build());
    }

    @Test
    void testGetMany_InvalidParametersBecomeNotFound() {
        when(mockClient.getParameters(any(GetParametersRequest.class))).thenReturn(GetParametersResponse.builder()
                .parameters(param("/macro-ai/development/API_KEY", "k"))
                .invalidParameters("/macro-ai/development/OPENAI_API_KEY")
                .build());

        Map<String, Result<String>> results = store.getMany(List.of("api-key", "openai-api-key"));

        assertEquals(Result.success("k"), results.get("api-key"));
        assertInstanceOf(ConfigError.NotFound.class, results.get("openai-api-key").errorOptional().orElseThrow());
    }

    @Test
    void testGetMany_RetriesMissingNamesOnHierarchicalPath() {
        when(mockClient.getParameters(any(GetParametersRequest.class)))
                .thenReturn(GetParametersResponse.builder()
                        .parameters(param("/macro-ai/development/API_KEY", "k"))
                        .invalidParameters("/macro-ai/development/OPENAI_API_KEY")
                        .build())
                .thenReturn(GetParametersResponse.builder()
                        .parameters(param("/macro-ai/development/critical/openai-api-key", "sk-legacy"))
                        .build());

        Map<String, Result<String>> results = store.getMany(List.of("api-key", "openai-api-key"));

        assertEquals(Result.success("k"), results.get("api-key"));
        assertEquals(Result.success("sk-legacy"), results.get("openai-api-key"));
        verify(mockClient).getParameters(GetParametersRequest.builder()
                .names(List.of("/macro-ai/development/critical/openai-api-key"))
                .withDecryption(true)
                .build());
    }

    @Test
    void testGetMany_ChunksByTen() {
        when(mockClient.getParameters(any(GetParametersRequest.class)))
                .thenReturn(GetParametersResponse.builder().build());
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            names.add("p" + i);
        }

        Map<String, Result<String>> results = store.getMany(names);

        assertEquals(12, results.size());
        // 每批一次扁平读取，加一次分层路径补读
        verify(mockClient, times(4)).getParameters(any(GetParametersRequest.class));
    }

    @Test
    void testGetMany_SdkFailureMarksWholeBatchUnavailable() {
        when(mockClient.getParameters(any(GetParametersRequest.class)))
                .thenThrow(SdkClientException.create("network down"));

        Map<String, Result<String>> results = store.getMany(List.of("a", "b"));

        assertInstanceOf(ConfigError.Unavailable.class, results.get("a").errorOptional().orElseThrow());
        assertInstanceOf(ConfigError.Unavailable.class, results.get("b").errorOptional().orElseThrow());
    }

    @Test
    void testParseTimeout() {
        assertEquals(Duration.ofSeconds(6), SsmSecretStore.parseTimeout(null));
        assertEquals(Duration.ofSeconds(3), SsmSecretStore.parseTimeout("3"));
        assertEquals(Duration.ofMillis(1500), SsmSecretStore.parseTimeout("PT1.5S"));
    }
}
