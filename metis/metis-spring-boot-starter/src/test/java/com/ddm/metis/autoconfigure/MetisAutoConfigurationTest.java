package com.ddm.metis.autoconfigure;

import com.ddm.metis.cache.SecretCache;
import com.ddm.metis.loader.BuildTimeLoader;
import com.ddm.metis.mapper.AppConfig;
import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.provider.SecretStores;
import com.ddm.metis.resolver.ConfigResolutionException;
import com.ddm.metis.resolver.ConfigResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link MetisAutoConfiguration} 的单元测试。
 *
 * @author liyifei
 */
class MetisAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MetisAutoConfiguration.class));

    @TempDir
    Path dir;

    @Test
    void testBuildTimeContextStartsWithPlaceholders() {
        runner.withPropertyValues("metis.force-context=build-time", "metis.enable-logging=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AppConfig config = context.getBean(AppConfig.class);
                    assertThat(config.apiKey()).startsWith(BuildTimeLoader.PLACEHOLDER_PREFIX);
                    assertThat(context.getBean(SecretStore.class).type()).isEqualTo(SecretStores.UNCONFIGURED);
                    assertThat(context.getBean(ConfigResolver.class).current()).contains(config);
                });
    }

    @Test
    void testLocalContextReadsConfiguredEnvFiles() throws IOException {
        Files.write(dir.resolve("app.env"), List.of(
                "API_KEY=file-api-key",
                "AWS_COGNITO_USER_POOL_ID=pool",
                "AWS_COGNITO_USER_POOL_CLIENT_ID=client",
                "AWS_COGNITO_USER_POOL_SECRET_KEY=pool-secret",
                "AWS_COGNITO_ACCESS_KEY=access",
                "AWS_COGNITO_SECRET_KEY=secret",
                "COOKIE_ENCRYPTION_KEY=cookie",
                "NON_RELATIONAL_DATABASE_URL=redis://localhost",
                "RELATIONAL_DATABASE_URL=postgres://localhost/app",
                "OPENAI_API_KEY=sk-file",
                "SERVER_PORT=4000"));

        runner.withPropertyValues("metis.force-context=local",
                        "metis.env-dir=" + dir,
                        "metis.env-files=app.env")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AppConfig config = context.getBean(AppConfig.class);
                    assertThat(config.port()).isEqualTo(4000);
                    assertThat(config.apiKey()).isEqualTo("file-api-key");
                });
    }

    @Test
    void testLocalValidationFailureRefusesToStart() {
        runner.withPropertyValues("metis.force-context=local",
                        "metis.env-dir=" + dir,
                        "metis.env-files=missing.env")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigResolutionException.class);
                });
    }

    @Test
    void testUnknownProviderTypeFails() {
        runner.withPropertyValues("metis.force-context=build-time", "metis.provider.type=vault")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause().hasMessageContaining("vault");
                });
    }

    @Test
    void testDefaultProperties() {
        runner.withPropertyValues("metis.force-context=build-time", "metis.enable-logging=false")
                .run(context -> {
                    MetisProperties props = context.getBean(MetisProperties.class);
                    assertThat(props.cacheTtl()).isEqualTo(Duration.ofSeconds(300));
                    assertThat(props.enableValidation()).isTrue();
                    assertThat(context.getBean(SecretCache.class).ttl()).isEqualTo(Duration.ofMinutes(5));
                });
    }
}
