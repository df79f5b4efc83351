package com.carelog.app;

import java.time.Instant;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.carelog.core.model.FollowUpState;
import com.carelog.followup.FollowUpScheduler;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import reactor.core.publisher.Mono;

/**
 * Operational endpoints for the follow-up slot. Off unless
 * {@code carelog.admin.enabled=true}.
 */
@RestController
@ConditionalOnProperty(prefix = "carelog.admin", name = "enabled", havingValue = "true")
@RequestMapping(path = "/admin/followup", produces = MediaType.APPLICATION_JSON_VALUE)
public class FollowUpAdminController {

    private final FollowUpScheduler scheduler;

    public FollowUpAdminController(FollowUpScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/{userId}")
    public Mono<StateView> state(@PathVariable String userId) {
        return scheduler.getState(userId).map(StateView::of);
    }

    @PostMapping(path = "/{userId}/schedule", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ScheduleResponse> schedule(@PathVariable String userId, @Valid @RequestBody ScheduleRequest req) {
        return scheduler.scheduleCheckin(userId, req.conversationRef(), req.caseLabel())
                .map(job -> new ScheduleResponse(job.userId(), job.jobKey(), job.scheduledFor()));
    }

    @PostMapping("/{userId}/cancel")
    public Mono<StateView> cancel(@PathVariable String userId) {
        return scheduler.cancelExistingCheckin(userId)
                .then(scheduler.getState(userId))
                .map(StateView::of);
    }

    /**
     * Runs the fire path now, with the same validation a due job gets.
     */
    @PostMapping(path = "/{userId}/execute", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExecuteResponse> execute(@PathVariable String userId, @Valid @RequestBody ExecuteRequest req) {
        return scheduler.executeCheckin(userId, req.conversationRef())
                .map(outcome -> new ExecuteResponse(userId, outcome.name().toLowerCase(), outcome.sent()));
    }

    public record StateView(String userId, String status, Instant scheduledFor, Instant lastSummaryCreatedAt,
            Instant lastUserMessageAt, Instant lastBotMessageAt, String caseLabel) {

        static StateView of(FollowUpState s) {
            return new StateView(s.userId(), s.status().dbValue(), s.scheduledFor(), s.lastSummaryCreatedAt(),
                    s.lastUserMessageAt(), s.lastBotMessageAt(), s.caseLabel());
        }
    }

    public record ScheduleRequest(@NotBlank String conversationRef, String caseLabel) {
    }

    public record ScheduleResponse(String userId, String jobKey, Instant scheduledFor) {
    }

    public record ExecuteRequest(@NotBlank String conversationRef) {
    }

    public record ExecuteResponse(String userId, String outcome, boolean sent) {
    }
}
