package com.linlay.assistantrunner.controller;

import com.linlay.assistantrunner.model.TurnResult;
import com.linlay.assistantrunner.run.RunStatus;
import com.linlay.assistantrunner.session.SessionRegistry;
import com.linlay.assistantrunner.session.ThreadDirectory;
import com.linlay.assistantrunner.support.FakeAssistantClient;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "assistant.provider.api-key=test-key",
                "assistant.provider.assistant-id=asst_test",
                "assistant.polling.base-interval-ms=5",
                "assistant.polling.max-backoff-ms=20",
                "assistant.sessions.thread-directory-file=",
                "assistant.notification.enabled=false"
        }
)
@AutoConfigureWebTestClient
@Import(AssistantControllerTest.FakeClientConfig.class)
class AssistantControllerTest {

    @Autowired
    private WebTestClient webTestClient;
    @Autowired
    private FakeAssistantClient client;
    @Autowired
    private ThreadDirectory threadDirectory;
    @Autowired
    private SessionRegistry sessionRegistry;

    @TestConfiguration
    static class FakeClientConfig {
        @Bean
        @Primary
        FakeAssistantClient fakeAssistantClient() {
            return new FakeAssistantClient();
        }
    }

    @Test
    void turnShouldReturnAssistantReply() {
        threadDirectory.record("u-ok", "t-ok");
        client.reply("t-ok", "Hello from the assistant");

        webTestClient.post()
                .uri("/api/assistant/turn")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u-ok", "text", "hi"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.text").isEqualTo("Hello from the assistant")
                .jsonPath("$.data.threadId").isEqualTo("t-ok")
                .jsonPath("$.data.turnSequence").isEqualTo(1);

        webTestClient.get()
                .uri("/api/assistant/turns?limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[?(@.userId == 'u-ok')].success").value(Matchers.hasItem(true));
    }

    @Test
    void concurrentTurnShouldReturnConflict() throws Exception {
        threadDirectory.record("u-busy", "t-busy");
        client.enqueueStatus("t-busy", RunStatus.IN_PROGRESS).statusDelay("t-busy", Duration.ofMillis(300));
        CompletableFuture<TurnResult> first = sessionRegistry.handleTurn("u-busy", "first").toFuture();

        webTestClient.post()
                .uri("/api/assistant/turn")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u-busy", "text", "second"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo(409)
                .jsonPath("$.data.category").isEqualTo("BUSY");

        assertThat(first.get(5, TimeUnit.SECONDS)).isNotNull();
    }

    @Test
    void blankTextShouldFailValidation() {
        webTestClient.post()
                .uri("/api/assistant/turn")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u1", "text", " "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.msg").isEqualTo("Validation failed")
                .jsonPath("$.data.fields.text").exists();
    }

    @Test
    void nonPositiveLimitShouldBeRejected() {
        webTestClient.get()
                .uri("/api/assistant/turns?limit=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.msg").isEqualTo("limit must be positive");
    }

    @Test
    void toolsShouldListRegisteredTools() {
        webTestClient.get()
                .uri("/api/assistant/tools")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.tools[0].name").isEqualTo("get_client_contact_info")
                .jsonPath("$.data.tools[1].name").isEqualTo("request_manager_callback")
                .jsonPath("$.data.tools[0].critical").isEqualTo(false);
    }

    @Test
    void sessionStatsShouldReportCap() {
        webTestClient.get()
                .uri("/api/assistant/sessions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.maxResidentSessions").isEqualTo(10000);
    }
}
