package me.christianrobert.arclabel.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.arclabel.config.service.ConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigRestService with a real ConfigService behind it.
 */
class ConfigRestServiceTest {

    private ConfigRestService resource;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        resource = new ConfigRestService();
        resource.configService = configService;
    }

    @Test
    void getConfiguration() {
        Response response = resource.getConfiguration();

        assertEquals(200, response.getStatus());
        assertEquals("FindLabel", ((Map<?, ?>) response.getEntity()).get(ConfigService.FUNCTION_NAME));
    }

    @Test
    void getUnknownKey() {
        assertEquals(404, resource.getConfigValue("nope").getStatus());
    }

    @Test
    void putValue() {
        Response response = resource.setConfigValue(ConfigService.PRETTY_PRINT, Map.of("value", true));

        assertEquals(200, response.getStatus());
        assertTrue(configService.isPrettyPrint());
    }

    @Test
    void putWithoutValueField() {
        assertEquals(400, resource.setConfigValue(ConfigService.PRETTY_PRINT, Map.of("v", true)).getStatus());
    }

    @Test
    void putInvalidValue() {
        Response response = resource.setConfigValue(ConfigService.FUNCTION_NAME, Map.of("value", "not valid"));

        assertEquals(400, response.getStatus());
        assertEquals("FindLabel", configService.getFunctionName());
    }

    @Test
    void saveAndReset() {
        assertEquals(200, resource.saveConfiguration(Map.of(ConfigService.FUNCTION_NAME, "MakeLabel")).getStatus());
        assertEquals("MakeLabel", configService.getFunctionName());

        assertEquals(200, resource.resetConfiguration().getStatus());
        assertEquals("FindLabel", configService.getFunctionName());
    }

    @Test
    void saveEmptyBody() {
        assertEquals(400, resource.saveConfiguration(Map.of()).getStatus());
    }
}
