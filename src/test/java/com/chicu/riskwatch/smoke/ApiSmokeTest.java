package com.chicu.riskwatch.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ApiSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void actuatorHealthShouldBeUp() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/actuator/health"), Map.class);
        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));
    }

    @Test
    void modelInfoWithoutActiveModelIsUnavailable() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/model"), Map.class);
        assertEquals(503, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("ERR-ARTIFACT", resp.getBody().get("code"));
        assertEquals("/api/model", resp.getBody().get("path"));
    }

    @Test
    void predictionWithoutActiveModelIsUnavailable() {
        Map<String, Object> body = Map.of("studentId", "S0001", "features", Map.of("age", 17));
        ResponseEntity<Map> resp = rest.postForEntity(url("/api/predictions"), body, Map.class);
        assertEquals(503, resp.getStatusCode().value());
    }

    @Test
    void performanceHistoryStartsEmpty() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/model/performance"), Map.class);
        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals(Boolean.FALSE, resp.getBody().get("drifting"));
    }
}
