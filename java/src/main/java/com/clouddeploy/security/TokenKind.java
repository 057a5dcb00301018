package com.clouddeploy.security;

/**
 * Value of the {@code token_type} claim.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static TokenKind fromClaim(String value) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
