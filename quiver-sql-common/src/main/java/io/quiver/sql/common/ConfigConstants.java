package io.quiver.sql.common;

public class ConfigConstants {

    public static final String CONFIG_PATH = "quiver_client";

    public static final String HOST_KEY = "host";
    public static final String TOKEN_KEY = "token";
    public static final String DATABASE_KEY = "database";
    public static final String TIMEOUT_MS_KEY = "timeout_ms";
    public static final String DISABLE_SERVER_CERTIFICATE_VERIFICATION_KEY = "disable_server_certificate_verification";

    // Query defaults
    public static final String QUERY_PREFIX = "query";
    public static final String QUERY_TYPE_KEY = "query.type";
    public static final String QUERY_HEADERS_KEY = "query.headers";

    // Write defaults
    public static final String WRITE_PREFIX = "write";
    public static final String WRITE_PRECISION_KEY = "write.precision";
    public static final String WRITE_GZIP_THRESHOLD_KEY = "write.gzip_threshold";
    public static final String WRITE_DEFAULT_TAGS_KEY = "write.default_tags";
}
