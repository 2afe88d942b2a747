package com.phillippitts.cipherseal.integration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static com.phillippitts.cipherseal.integration.MultipartUploads.png;
import static com.phillippitts.cipherseal.integration.MultipartUploads.upload;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Without a secret key the API starts degraded and refuses watermark operations.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "watermark.secret-key="
)
class UnconfiguredServiceIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON =
            new ParameterizedTypeReference<>() {};

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void rootReportsDegraded() {
        ResponseEntity<Map<String, Object>> response =
                restTemplate.exchange("/", HttpMethod.GET, null, JSON);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("message", "Digital Watermarking API is degraded (secret key not configured).");
    }

    @Test
    void watermarkEndpointsReturn503() {
        ResponseEntity<Map<String, Object>> image = restTemplate.exchange("/watermark/image/add",
                HttpMethod.POST, upload("cover.png", png(16, 16), Map.of()), JSON);
        ResponseEntity<Map<String, Object>> text = restTemplate.exchange("/watermark/text/detect",
                HttpMethod.POST, upload("doc.txt", new byte[]{'a'}, Map.of()), JSON);

        assertThat(image.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(image.getBody()).containsEntry("errorCode", "ServiceNotConfiguredException");
        assertThat(text.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void healthIsDown() {
        ResponseEntity<Map<String, Object>> response =
                restTemplate.exchange("/actuator/health", HttpMethod.GET, null, JSON);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("status", "DOWN");
    }
}
