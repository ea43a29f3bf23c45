package com.ddm.metis.schema;

/**
 * 应用配置的字段声明。键名即环境变量名。
 *
 * @author liyifei
 */
public final class AppSchema {

    private AppSchema() {
    }

    // ===== Core =====
    public static final String API_KEY = "API_KEY";
    public static final String NODE_ENV = "NODE_ENV";
    public static final String APP_ENV = "APP_ENV";
    public static final String SERVER_PORT = "SERVER_PORT";

    // ===== Cognito =====
    public static final String AWS_COGNITO_REGION = "AWS_COGNITO_REGION";
    public static final String AWS_COGNITO_USER_POOL_ID = "AWS_COGNITO_USER_POOL_ID";
    public static final String AWS_COGNITO_USER_POOL_CLIENT_ID = "AWS_COGNITO_USER_POOL_CLIENT_ID";
    public static final String AWS_COGNITO_USER_POOL_SECRET_KEY = "AWS_COGNITO_USER_POOL_SECRET_KEY";
    public static final String AWS_COGNITO_ACCESS_KEY = "AWS_COGNITO_ACCESS_KEY";
    public static final String AWS_COGNITO_SECRET_KEY = "AWS_COGNITO_SECRET_KEY";
    public static final String AWS_COGNITO_REFRESH_TOKEN_EXPIRY = "AWS_COGNITO_REFRESH_TOKEN_EXPIRY";

    // ===== Cookie =====
    public static final String COOKIE_DOMAIN = "COOKIE_DOMAIN";
    public static final String COOKIE_ENCRYPTION_KEY = "COOKIE_ENCRYPTION_KEY";

    // ===== Database =====
    public static final String NON_RELATIONAL_DATABASE_URL = "NON_RELATIONAL_DATABASE_URL";
    public static final String RELATIONAL_DATABASE_URL = "RELATIONAL_DATABASE_URL";

    public static final String OPENAI_API_KEY = "OPENAI_API_KEY";

    // ===== Rate limits =====
    public static final String RATE_LIMIT_WINDOW_MS = "RATE_LIMIT_WINDOW_MS";
    public static final String RATE_LIMIT_MAX_REQUESTS = "RATE_LIMIT_MAX_REQUESTS";
    public static final String AUTH_RATE_LIMIT_WINDOW_MS = "AUTH_RATE_LIMIT_WINDOW_MS";
    public static final String AUTH_RATE_LIMIT_MAX_REQUESTS = "AUTH_RATE_LIMIT_MAX_REQUESTS";
    public static final String API_RATE_LIMIT_WINDOW_MS = "API_RATE_LIMIT_WINDOW_MS";
    public static final String API_RATE_LIMIT_MAX_REQUESTS = "API_RATE_LIMIT_MAX_REQUESTS";

    // ===== Optional =====
    public static final String REDIS_URL = "REDIS_URL";
    public static final String CORS_ALLOWED_ORIGINS = "CORS_ALLOWED_ORIGINS";

    public static final String APP_ENV_PATTERN = "development|staging|production|test|pr-\\d+";

    public static final ConfigSchema SCHEMA = ConfigSchema.of(
            FieldSpec.string(API_KEY).mandatory().secret(),
            FieldSpec.oneOf(NODE_ENV, "development", "production", "test").withDefault("development"),
            FieldSpec.string(APP_ENV).matching(APP_ENV_PATTERN).withDefault("development"),
            FieldSpec.integer(SERVER_PORT).range(1, 65535).withDefault("3040"),

            FieldSpec.string(AWS_COGNITO_REGION).withDefault("us-east-1"),
            FieldSpec.string(AWS_COGNITO_USER_POOL_ID).mandatory(),
            FieldSpec.string(AWS_COGNITO_USER_POOL_CLIENT_ID).mandatory(),
            FieldSpec.string(AWS_COGNITO_USER_POOL_SECRET_KEY).mandatory().secret(),
            FieldSpec.string(AWS_COGNITO_ACCESS_KEY).mandatory().secret(),
            FieldSpec.string(AWS_COGNITO_SECRET_KEY).mandatory().secret(),
            FieldSpec.integer(AWS_COGNITO_REFRESH_TOKEN_EXPIRY).positive().withDefault("30"),

            FieldSpec.string(COOKIE_DOMAIN).withDefault("localhost"),
            FieldSpec.string(COOKIE_ENCRYPTION_KEY).mandatory().secret(),

            FieldSpec.string(NON_RELATIONAL_DATABASE_URL).mandatory().secret(),
            FieldSpec.string(RELATIONAL_DATABASE_URL).mandatory().secret(),

            FieldSpec.string(OPENAI_API_KEY).mandatory().secret(),

            FieldSpec.integer(RATE_LIMIT_WINDOW_MS).positive().withDefault("900000"),
            FieldSpec.integer(RATE_LIMIT_MAX_REQUESTS).positive().withDefault("100"),
            FieldSpec.integer(AUTH_RATE_LIMIT_WINDOW_MS).positive().withDefault("3600000"),
            FieldSpec.integer(AUTH_RATE_LIMIT_MAX_REQUESTS).positive().withDefault("10"),
            FieldSpec.integer(API_RATE_LIMIT_WINDOW_MS).positive().withDefault("60000"),
            FieldSpec.integer(API_RATE_LIMIT_MAX_REQUESTS).positive().withDefault("60"),

            FieldSpec.string(REDIS_URL).secret(),
            FieldSpec.string(CORS_ALLOWED_ORIGINS)
    );
}
