package com.flagship.liquidity_pool.asset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.liquidity_pool.config.JacksonConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Asset Tests")
class AssetTest {

    @Test
    @DisplayName("Assets are equal by trimmed id and ordered by id")
    void testIdentityAndOrder() {
        assertEquals(Asset.of("ETH"), Asset.of(" ETH "));
        assertTrue(Asset.of("DAI").compareTo(Asset.of("ETH")) < 0);
        assertTrue(Asset.of("ETH").compareTo(Asset.of("eth")) < 0);
    }

    @Test
    @DisplayName("Blank ids are rejected")
    void testBlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> Asset.of(null));
        assertThrows(IllegalArgumentException.class, () -> Asset.of("  "));
    }

    @Test
    @DisplayName("An asset is written and read as its bare id")
    void testJson() throws Exception {
        ObjectMapper mapper = new JacksonConfig().objectMapper();

        assertEquals("\"ETH\"", mapper.writeValueAsString(Asset.of("ETH")));
        assertEquals(Asset.of("ETH"), mapper.readValue("\"ETH\"", Asset.class));
    }
}
