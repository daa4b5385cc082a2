package me.golemcore.chainscope.adapter.inbound.web.config;

import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebFluxConfigTest {

    @Test
    void shouldParseCommaSeparatedOrigins() {
        assertEquals(List.of("http://localhost:3000", "https://app.example.com"),
                WebFluxConfig.parseOrigins(" http://localhost:3000 ,https://app.example.com,, "));
    }

    @Test
    void shouldTreatBlankAsAnyOrigin() {
        assertTrue(WebFluxConfig.parseOrigins(null).isEmpty());
        assertTrue(WebFluxConfig.parseOrigins("   ").isEmpty());
    }

    @Test
    void shouldCreateCorsFilter() {
        ChainscopeProperties properties = new ChainscopeProperties();
        properties.getWeb().setAllowedOrigins("http://localhost:3000");

        assertNotNull(new WebFluxConfig().corsWebFilter(properties));
    }
}
