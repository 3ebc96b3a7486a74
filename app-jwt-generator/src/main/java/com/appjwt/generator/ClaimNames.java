package com.appjwt.generator;

/** Claim names written by {@link TokenGenerator}. */
public final class ClaimNames {
    private ClaimNames() {}

    public static final String ISSUED_AT = "iat";
    public static final String EXPIRATION = "exp";
    public static final String NOT_BEFORE = "nbf";
    public static final String ID = "jti";
    public static final String SUBJECT = "sub";

    public static final String APPLICATION_ID = "application_id";
    public static final String ACL = "acl";
    public static final String ACL_PATHS = "paths";   // keyed by path pattern
}
