package at.sv.lock;

import at.sv.lock.api.AuditEvent;
import at.sv.lock.api.AuditSink;
import at.sv.lock.api.Device;
import at.sv.lock.api.DeviceActionGateway;
import at.sv.lock.api.DeviceActionResult;
import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.LockAction;
import at.sv.lock.schedule.ScheduleMetadata;
import at.sv.lock.store.ScheduleStore;
import at.sv.lock.time.RecurrenceEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Periodically evaluates all enabled schedules and applies their actions on activity transitions. A schedule that
 * becomes active triggers its action once; when it becomes inactive again its end action is triggered, if any.
 */
@Slf4j
public final class ScheduleExecutor {

    static final String TRIGGER_ACTION = "schedule_triggered";
    static final String SUBJECT_TYPE = "schedule";
    static final String PHASE_START = "start";
    static final String PHASE_END = "end";

    private final ScheduleStore store;
    private final RecurrenceEvaluator evaluator;
    private final TargetResolver targetResolver;
    private final DeviceActionGateway gateway;
    private final AuditSink auditSink;
    private final TickScheduler tickScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final int tickIntervalInSeconds;
    private final Map<String, Boolean> lastKnownActive = new ConcurrentHashMap<>();

    public ScheduleExecutor(ScheduleStore store, RecurrenceEvaluator evaluator, TargetResolver targetResolver,
                            DeviceActionGateway gateway, AuditSink auditSink, TickScheduler tickScheduler,
                            Supplier<ZonedDateTime> currentTime, int tickIntervalInSeconds) {
        this.store = store;
        this.evaluator = evaluator;
        this.targetResolver = targetResolver;
        this.gateway = gateway;
        this.auditSink = auditSink;
        this.tickScheduler = tickScheduler;
        this.currentTime = currentTime;
        this.tickIntervalInSeconds = tickIntervalInSeconds;
    }

    public void start() {
        log.info("Starting schedule executor with a tick interval of {} seconds.", tickIntervalInSeconds);
        tickScheduler.scheduleWithFixedDelay(() -> evaluateOnce(currentTime.get()), 0, tickIntervalInSeconds,
                TimeUnit.SECONDS);
    }

    public void stop() {
        log.info("Stopping schedule executor.");
        tickScheduler.shutdown();
    }

    /**
     * Runs a single tick for the given instant. Ticks must not run concurrently.
     */
    public void evaluateOnce(ZonedDateTime instant) {
        MDC.put("context", "tick");
        try {
            ZoneId zone = resolveZone(store.getMetadata());
            ZonedDateTime now = instant.withZoneSameInstant(zone);
            List<DeviceSchedule> schedules = store.list(null, null, true);
            Set<String> ids = schedules.stream().map(DeviceSchedule::getId).collect(Collectors.toSet());
            lastKnownActive.keySet().retainAll(ids);
            log.trace("Evaluating {} enabled schedule(s) at {}.", schedules.size(), now);
            for (DeviceSchedule schedule : schedules) {
                evaluate(schedule, now, zone);
            }
        } finally {
            MDC.remove("context");
        }
    }

    Map<String, Boolean> getLastKnownActive() {
        return Collections.unmodifiableMap(lastKnownActive);
    }

    private void evaluate(DeviceSchedule schedule, ZonedDateTime now, ZoneId zone) {
        MDC.put("context", schedule.getContextName());
        try {
            boolean active = evaluator.isActive(schedule, now, zone);
            boolean wasActive = lastKnownActive.getOrDefault(schedule.getId(), false);
            if (active && !wasActive) {
                trigger(schedule, schedule.getAction(), PHASE_START);
                lastKnownActive.put(schedule.getId(), true);
            } else if (!active && wasActive) {
                if (schedule.getEndAction() != null) {
                    trigger(schedule, schedule.getEndAction(), PHASE_END);
                } else {
                    log.debug("Window ended. No end action configured.");
                }
                lastKnownActive.put(schedule.getId(), false);
            }
        } catch (Exception e) {
            log.error("Failed to evaluate schedule '{}': {}", schedule.getId(), e.getLocalizedMessage(), e);
        } finally {
            MDC.put("context", "tick");
        }
    }

    private void trigger(DeviceSchedule schedule, LockAction action, String phase) {
        List<Device> devices = targetResolver.resolve(schedule.getTargets());
        if (devices.isEmpty()) {
            log.warn("No devices resolved. Skipping {} ({}).", action, phase);
            return;
        }
        String actor = "schedule:" + schedule.getId();
        log.info("Applying {} to {} device(s) ({}).", action, devices.size(), phase);
        List<DeviceActionResult> results = gateway.apply(devices, action.isUnlock(), actor, schedule.getLabel());
        long failedCount = 0;
        for (DeviceActionResult result : results) {
            if (result.isError()) {
                failedCount++;
                log.warn("Failed to {} device {}: {}", action, result.mac(), result.message());
            }
        }
        record(new AuditEvent(TRIGGER_ACTION, SUBJECT_TYPE, schedule.getId(), actor, schedule.getLabel(),
                Map.of("phase", phase,
                        "action", action.toString(),
                        "deviceCount", devices.size(),
                        "failedCount", failedCount)));
    }

    private void record(AuditEvent event) {
        try {
            auditSink.record(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event: {}", e.getLocalizedMessage(), e);
        }
    }

    private static ZoneId resolveZone(ScheduleMetadata metadata) {
        String timezone = metadata == null ? null : metadata.timezone();
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of(ScheduleMetadata.DEFAULT_TIMEZONE);
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}'. Falling back to {}.", timezone, ScheduleMetadata.DEFAULT_TIMEZONE);
            return ZoneId.of(ScheduleMetadata.DEFAULT_TIMEZONE);
        }
    }
}
