package com.linlay.assistantgw.controller;

import com.linlay.assistantgw.security.JwtTokenVerifierTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "agent.auth.enabled=true",
                "agent.auth.secret=auth-secret-for-tests",
                "agent.auth.issuer=https://auth.example.local"
        }
)
@AutoConfigureWebTestClient
class ApiAuthIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void protectedEndpointWithoutTokenShouldReturnUnauthorized() {
        webTestClient.get()
                .uri("/ingest/{jobId}", "missing")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("unauthorized");
    }

    @Test
    void validTokenShouldPassThroughToController() throws Exception {
        String token = JwtTokenVerifierTestSupport.sign(
                "auth-secret-for-tests", "user-1", "https://auth.example.local", Instant.now().plusSeconds(300));

        webTestClient.get()
                .uri("/ingest/{jobId}", "missing")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void healthShouldStayOpen() {
        webTestClient.get().uri("/health").exchange().expectStatus().isOk();
    }
}
