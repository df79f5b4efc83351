package com.carelog.app;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.carelog.concern.ConcernCommandExecutor;
import com.carelog.concern.ConcernLifecycleService;
import com.carelog.core.error.ConcernNotFoundException;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernCommand;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.ConcernStatus;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import reactor.core.publisher.Mono;

/**
 * Read-mostly concern API for the summary page and support tooling.
 */
@RestController
@RequestMapping(path = "/api/concerns", produces = MediaType.APPLICATION_JSON_VALUE)
public class ConcernController {

    private final ConcernLifecycleService concerns;
    private final ConcernCommandExecutor commands;

    public ConcernController(ConcernLifecycleService concerns, ConcernCommandExecutor commands) {
        this.concerns = concerns;
        this.commands = commands;
    }

    /**
     * Open concerns, or every concern with {@code ?all=true}.
     */
    @GetMapping("/{userId}")
    public Mono<List<ConcernView>> list(@PathVariable String userId,
            @RequestParam(name = "all", defaultValue = "false") boolean all) {
        return (all ? concerns.getAllConcerns(userId) : concerns.getActiveConcerns(userId))
                .map(ConcernView::of)
                .collectList();
    }

    @GetMapping("/{userId}/{concernId}")
    public Mono<ConcernDetail> detail(@PathVariable String userId, @PathVariable UUID concernId) {
        return ownedBy(userId, concernId)
                .flatMap(c -> concerns.getConcernHistory(concernId)
                        .map(SnapshotView::of)
                        .collectList()
                        .map(history -> new ConcernDetail(ConcernView.of(c), history)));
    }

    @PatchMapping(path = "/{userId}/{concernId}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ConcernView> updateStatus(@PathVariable String userId, @PathVariable UUID concernId,
            @Valid @RequestBody StatusRequest req) {
        ConcernStatus next = ConcernStatus.fromDb(req.status());
        return ownedBy(userId, concernId)
                .flatMap(c -> concerns.updateConcernStatus(concernId, next))
                .map(ConcernView::of);
    }

    @PostMapping(path = "/{userId}/commands", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CommandResponse> command(@PathVariable String userId, @Valid @RequestBody CommandRequest req) {
        ConcernCommand command = req.toCommand();
        return commands.execute(userId, command)
                .map(matched -> new CommandResponse(command.type().name().toLowerCase(Locale.ROOT), matched));
    }

    // A concern id from another user reads as absent.
    private Mono<Concern> ownedBy(String userId, UUID concernId) {
        return concerns.getConcernById(concernId)
                .filter(c -> c.userId().equals(userId))
                .switchIfEmpty(Mono.error(() -> new ConcernNotFoundException(concernId)));
    }

    public record ConcernView(UUID id, String title, String status, String summaryContent,
            Instant createdAt, Instant updatedAt) {

        static ConcernView of(Concern c) {
            return new ConcernView(c.id(), c.title(), c.status().dbValue(), c.summaryContent(),
                    c.createdAt(), c.updatedAt());
        }
    }

    public record SnapshotView(UUID id, String content, String reason, Instant createdAt) {

        static SnapshotView of(ConcernSnapshot s) {
            return new SnapshotView(s.id(), s.content(), s.reason().dbValue(), s.createdAt());
        }
    }

    public record ConcernDetail(ConcernView concern, List<SnapshotView> history) {
    }

    public record StatusRequest(@NotBlank String status) {
    }

    public record CommandRequest(@NotNull ConcernCommand.Type type, List<String> targets, String newName) {

        ConcernCommand toCommand() {
            return new ConcernCommand(type, targets, newName);
        }
    }

    public record CommandResponse(String type, List<String> matched) {
    }
}
