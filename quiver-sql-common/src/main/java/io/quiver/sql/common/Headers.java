package io.quiver.sql.common;

public class Headers {

    public static final String HEADER_AUTHORIZATION = "authorization";
    public static final String HEADER_DATABASE = "database";
    public static final String BEARER_PREFIX = "Bearer ";

}
