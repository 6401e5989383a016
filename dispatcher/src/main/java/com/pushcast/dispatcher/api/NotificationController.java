package com.pushcast.dispatcher.api;

import com.pushcast.dispatcher.api.dto.DeliveryResponse;
import com.pushcast.dispatcher.api.dto.ScheduleRequest;
import com.pushcast.dispatcher.api.dto.ScheduleResponse;
import com.pushcast.dispatcher.api.dto.SendRequest;
import com.pushcast.dispatcher.api.dto.SequenceRequest;
import com.pushcast.dispatcher.api.dto.SequenceResponse;
import com.pushcast.dispatcher.api.dto.TemplateRequest;
import com.pushcast.dispatcher.api.dto.TournamentRequest;
import com.pushcast.dispatcher.model.JobState;
import com.pushcast.dispatcher.model.JobSummary;
import com.pushcast.dispatcher.service.NotificationService;
import com.pushcast.dispatcher.service.NotificationTemplate;
import com.pushcast.dispatcher.store.JobFilter;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for sending and scheduling notifications.
 *
 * POST   /notifications/send                    — deliver now, per-target result
 * POST   /notifications/schedule                — create a scheduled job
 * DELETE /notifications/schedule/{id}           — cancel a scheduled job
 * GET    /notifications/scheduled               — list jobs (state, groupId, name filters)
 * GET    /notifications/scheduled/{id}          — one job
 * POST   /notifications/sequences               — multi-step sequence around an anchor
 * POST   /notifications/sequences/tournament    — tournament reminders + start
 * DELETE /notifications/sequences/{groupId}     — cancel a whole sequence
 * POST   /notifications/templates/{template}    — send a built-in template now
 */
@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @PostMapping("/send")
    public DeliveryResponse send(@RequestBody SendRequest req) {
        return DeliveryResponse.from(notificationService.sendNow(req.toPayload()));
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/notifications/schedule \
     *     -H "Content-Type: application/json" \
     *     -d '{"trigger":{"type":"one_shot","at":"2030-01-01T09:00:00Z"},
     *          "target":{"type":"TOPICS","values":["news"]},
     *          "message":{"title":"Hi","body":"Happy new year"}}'
     */
    @PostMapping("/schedule")
    public ResponseEntity<ScheduleResponse> schedule(@RequestBody ScheduleRequest req) {
        if (req.trigger() == null) {
            throw new InvalidTriggerException("Trigger is required");
        }
        UUID id = req.name() == null
                ? notificationService.schedule(req.trigger().toSpec(), req.toPayload())
                : notificationService.scheduleNamed(req.name(), req.trigger().toSpec(), req.toPayload());
        ScheduleResponse body = new ScheduleResponse(id,
                notificationService.find(id).map(JobSummary::nextFireAt).orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/schedule/{id}")
    public Map<String, Object> cancel(@PathVariable UUID id) {
        return Map.of("jobId", id, "cancelled", notificationService.cancel(id));
    }

    @GetMapping("/scheduled")
    public List<JobSummary> list(@RequestParam(required = false) Set<JobState> state,
                                 @RequestParam(required = false) UUID groupId,
                                 @RequestParam(required = false) String name) {
        return notificationService.listScheduled(new JobFilter(state, groupId, name));
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/scheduled/{id}")
    public JobSummary get(@PathVariable UUID id) {
        return notificationService.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    @PostMapping("/sequences")
    public ResponseEntity<SequenceResponse> composeSequence(@RequestBody SequenceRequest req) {
        SequenceResponse body = SequenceResponse.from(notificationService.composeSequence(req.toSpec()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/sequences/tournament")
    public ResponseEntity<SequenceResponse> scheduleTournament(@RequestBody TournamentRequest req) {
        if (req.startTime() == null) {
            throw new InvalidTriggerException("startTime is required");
        }
        SequenceResponse body = SequenceResponse.from(notificationService.scheduleTournament(
                req.tournamentName(), req.tournamentId(), req.startTime(), req.reminderMinutes()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/sequences/{groupId}")
    public Map<String, Object> cancelSequence(@PathVariable UUID groupId) {
        return Map.of("groupId", groupId, "cancelled", notificationService.cancelGroup(groupId));
    }

    @PostMapping("/templates/{template}")
    public DeliveryResponse sendTemplate(@PathVariable String template, @RequestBody TemplateRequest req) {
        return DeliveryResponse.from(notificationService.sendTemplate(
                NotificationTemplate.fromSlug(template), req.params(), req.target()));
    }
}
