package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes grid jobs to their {@link JobHandler}.
 *
 * <p>Lookup: the job type's key, except for CUSTOM jobs whose {@code task}
 * param names a registered {@code custom/<task>} handler. CUSTOM jobs with no
 * matching task fall back to the plain {@code custom} handler.
 *
 * <p>Every execution is timed and counted:
 * <pre>
 *   flowgrid.grid.job.runs{handler, status="success|error|invalid_params|..."}
 *   flowgrid.grid.job.duration{handler}
 * </pre>
 */
@Component
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public JobHandlerRegistry(List<JobHandler> allHandlers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (JobHandler handler : allHandlers) {
            JobHandler previous = handlers.put(handler.key(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two job handlers registered for '" + handler.key() + "': "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
            log.info("Registered job handler '{}' ({})", handler.key(), handler.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public JobHandler resolve(GridJobType type, JsonNode params) {
        if (type == GridJobType.CUSTOM) {
            String task = params.path("task").asText("");
            if (!task.isEmpty()) {
                JobHandler custom = handlers.get(JobHandler.customTask(task));
                if (custom != null) {
                    return custom;
                }
            }
        }
        JobHandler handler = handlers.get(type.key());
        if (handler == null) {
            throw new JobHandlerNotFoundException(type.key());
        }
        return handler;
    }

    public List<String> handlerKeys() {
        return handlers.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    public JsonNode execute(GridJob job, JsonNode params) {
        JobHandler handler = resolve(job.getType(), params);
        String handlerKey = handler.key();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return handler.handle(job, params);
        } catch (JobException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("flowgrid.grid.job.duration", "handler", handlerKey));
            meterRegistry.counter("flowgrid.grid.job.runs", "handler", handlerKey, "status", status).increment();
        }
    }
}
