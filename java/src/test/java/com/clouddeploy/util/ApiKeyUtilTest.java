package com.clouddeploy.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ApiKeyUtil.
 */
class ApiKeyUtilTest {

    @Test
    void generateApiKey_UsesPrefixAndUrlSafeAlphabet() {
        String key = ApiKeyUtil.generateApiKey("cdp_", 32);

        assertThat(key).startsWith("cdp_");
        // 32 bytes base64url without padding
        assertThat(key).hasSize(4 + 43);
        assertThat(key.substring(4)).matches("[A-Za-z0-9_-]+");
    }

    @Test
    void hashApiKey_IsStableHexDigest() {
        String digest = ApiKeyUtil.hashApiKey("cdp_example");

        assertThat(digest).hasSize(64).matches("[0-9a-f]+");
        assertThat(ApiKeyUtil.hashApiKey("cdp_example")).isEqualTo(digest);
        assertThat(ApiKeyUtil.hashApiKey("cdp_example2")).isNotEqualTo(digest);
    }

    @Test
    void displayParts_KeepBothEnds() {
        String key = "cdp_abcdefghijklmnopqrstuvwxyz";

        assertThat(ApiKeyUtil.displayPrefix(key)).isEqualTo("cdp_abcdef");
        assertThat(ApiKeyUtil.displaySuffix(key)).isEqualTo("wxyz");
    }

    @Test
    void displayParts_ShortKeyDoesNotOverflow() {
        assertThat(ApiKeyUtil.displayPrefix("abc")).isEqualTo("abc");
        assertThat(ApiKeyUtil.displaySuffix("abc")).isEqualTo("abc");
    }
}
