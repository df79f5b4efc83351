package com.carelog.app;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.carelog.concern.ConcernCommandExecutor;
import com.carelog.concern.ConcernLifecycleService;
import com.carelog.concern.LegacyAggregator;
import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernStatus;
import com.carelog.core.model.SnapshotReason;
import com.carelog.testing.InMemoryConcernStore;
import com.carelog.testing.InMemoryLegacyAggregateStore;
import com.carelog.testing.MutableClock;

class ConcernControllerTest {

    private static final String USER = "user-5";

    private MutableClock clock;
    private ConcernLifecycleService concerns;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
        InMemoryConcernStore store = new InMemoryConcernStore();
        FuzzyMatcher matcher = new FuzzyMatcher();
        concerns = new ConcernLifecycleService(store,
                new LegacyAggregator(store, new InMemoryLegacyAggregateStore(), clock), matcher, clock);
        client = WebTestClient
                .bindToController(new ConcernController(concerns, new ConcernCommandExecutor(concerns, matcher)))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private Concern concern(String userId, String title, String content) {
        Concern c = concerns.getOrCreateConcern(userId, title).block();
        concerns.updateConcernSummary(c.id(), content, SnapshotReason.AUTO_UPDATE).block();
        clock.advance(Duration.ofMinutes(1));
        return c;
    }

    @Test
    void listsOpenConcernsNewestFirst() {
        concern(USER, "Back Pain", "Back hurts.");
        Concern knee = concern(USER, "Knee Swelling", "Knee is swollen.");
        concerns.updateConcernStatus(concern(USER, "Cough", "Dry cough.").id(), ConcernStatus.RESOLVED).block();

        client.get().uri("/api/concerns/{userId}", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo(knee.id().toString())
                .jsonPath("$[0].status").isEqualTo("active");

        client.get().uri("/api/concerns/{userId}?all=true", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3);
    }

    @Test
    void detailIncludesHistory() {
        Concern back = concern(USER, "Back Pain", "Back hurts.");

        client.get().uri("/api/concerns/{userId}/{id}", USER, back.id())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.concern.title").isEqualTo("Back Pain")
                .jsonPath("$.history[0].reason").isEqualTo("auto_update");
    }

    @Test
    void anotherUsersConcernIsNotFound() {
        Concern other = concern("someone-else", "Back Pain", "Back hurts.");

        client.get().uri("/api/concerns/{userId}/{id}", USER, other.id())
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("NOT_FOUND");
    }

    @Test
    void statusChangesFollowTheLifecycle() {
        Concern back = concern(USER, "Back Pain", "Back hurts.");

        client.patch().uri("/api/concerns/{userId}/{id}/status", USER, back.id())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "resolved"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("resolved");

        client.patch().uri("/api/concerns/{userId}/{id}/status", USER, back.id())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "active"))
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void unknownStatusIsInvalid() {
        Concern back = concern(USER, "Back Pain", "Back hurts.");

        client.patch().uri("/api/concerns/{userId}/{id}/status", USER, back.id())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "cured"))
                .exchange()
                .expectStatus().isEqualTo(422);
    }

    @Test
    void renameCommandReportsOldAndNewTitles() {
        concern(USER, "Back Pain", "Back hurts.");

        client.post().uri("/api/concerns/{userId}/commands", USER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "RENAME", "targets", List.of("back"), "newName", "Lower Back Pain"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.type").isEqualTo("rename")
                .jsonPath("$.matched[0]").isEqualTo("Back Pain")
                .jsonPath("$.matched[1]").isEqualTo("Lower Back Pain");

        assertThat(concerns.getActiveConcerns(USER).map(Concern::title).collectList().block())
                .containsExactly("Lower Back Pain");
    }

    @Test
    void unmatchedCommandTargetIsNotFound() {
        concern(USER, "Back Pain", "Back hurts.");

        client.post().uri("/api/concerns/{userId}/commands", USER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "DELETE", "targets", List.of("knee")))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("NO_MATCH");
    }
}
