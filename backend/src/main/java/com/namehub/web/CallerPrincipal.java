package com.namehub.web;

/**
 * Caller identity carried on every request.
 */
public final class CallerPrincipal {

    public static final String HEADER = "X-Principal";

    /**
     * Textual form of the anonymous principal. Requests without a principal header resolve to it.
     */
    public static final String ANONYMOUS = "2vxsx-fae";

    private CallerPrincipal() {
    }

    public static String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return ANONYMOUS;
        }
        return headerValue.trim();
    }

    public static boolean isAnonymous(String principal) {
        return principal == null || principal.isBlank() || ANONYMOUS.equals(principal.trim());
    }
}
