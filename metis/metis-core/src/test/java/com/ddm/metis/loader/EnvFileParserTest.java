package com.ddm.metis.loader;

import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link EnvFileParser} 的单元测试。
 *
 * @author liyifei
 */
class EnvFileParserTest {

    @Test
    void testParse_SupportedSyntax() {
        Result<Map<String, String>> result = EnvFileParser.parse(".env", List.of(
                "# comment",
                "",
                "SERVER_PORT=3040",
                "export NODE_ENV=test",
                "API_KEY=\"quoted # not a comment\"",
                "COOKIE_DOMAIN='single'",
                "REDIS_URL=redis://localhost:6379 # trailing",
                "EMPTY=",
                "SERVER_PORT=3041"));

        Map<String, String> values = result.toOptional().orElseThrow();
        assertEquals("3041", values.get("SERVER_PORT"));
        assertEquals("test", values.get("NODE_ENV"));
        assertEquals("quoted # not a comment", values.get("API_KEY"));
        assertEquals("single", values.get("COOKIE_DOMAIN"));
        assertEquals("redis://localhost:6379", values.get("REDIS_URL"));
        assertEquals("", values.get("EMPTY"));
    }

    @Test
    void testParse_MissingEqualsNamesFileAndLine() {
        Result<Map<String, String>> result = EnvFileParser.parse(".env.local", List.of("A=1", "garbage"));

        ConfigError.SourceLoadError error = (ConfigError.SourceLoadError) result.errorOptional().orElseThrow();
        assertEquals(".env.local", error.source());
        assertTrue(error.reason().contains("line 2"));
    }

    @Test
    void testParse_InvalidKeyAndUnterminatedQuote() {
        assertTrue(EnvFileParser.parse(".env", List.of("1BAD=x")).isFailure());
        assertTrue(EnvFileParser.parse(".env", List.of("KEY=\"open")).isFailure());
    }

    @Test
    void testParse_TextAfterClosingQuote() {
        Result<Map<String, String>> commented = EnvFileParser.parse(".env", List.of("KEY=\"a\"   # note"));
        Result<Map<String, String>> junk = EnvFileParser.parse(".env", List.of("A=1", "KEY=\"a\" junk"));

        assertEquals("a", commented.toOptional().orElseThrow().get("KEY"));
        ConfigError.SourceLoadError error = (ConfigError.SourceLoadError) junk.errorOptional().orElseThrow();
        assertTrue(error.reason().contains("line 2"));
    }
}
