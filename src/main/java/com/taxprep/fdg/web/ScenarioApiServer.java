package com.taxprep.fdg.web;

import com.taxprep.fdg.api.GraphDefectException;
import com.taxprep.fdg.io.Json;
import com.taxprep.fdg.scenario.ScenarioEngine;
import com.taxprep.fdg.scenario.TaxCalculationResult;
import com.taxprep.fdg.wiring.CalculationPublisher;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * HTTP front for a {@link ScenarioEngine}. Reads go straight to the engine;
 * calculations are queued through the {@link CalculationPublisher}.
 *
 * <pre>
 * GET  /api/scenarios                  scenarios with state and selection
 * GET  /api/scenarios/{id}/state       lifecycle state
 * GET  /api/scenarios/{id}/result      cached result, 404 when there is none
 * POST /api/scenarios/{id}/calculate   calculate and return the result
 * GET  /api/baseline                   result for the unmodified input
 * GET  /api/selection                  selected ids and the limit
 * POST /api/selection/{id}             select, evicting the oldest when full
 * DELETE /api/selection/{id}           deselect
 * GET  /api/comparison                 selected scenarios against the baseline
 * </pre>
 *
 * Unknown scenario ids answer 404, defects 500.
 */
public class ScenarioApiServer {
    private static final Logger log = LogManager.getLogger(ScenarioApiServer.class);
    private static final String JSON = "application/json";

    private final ScenarioEngine engine;
    private final CalculationPublisher publisher;
    private Javalin app;

    public ScenarioApiServer(ScenarioEngine engine, CalculationPublisher publisher) {
        this.engine = engine;
        this.publisher = publisher;
    }

    /**
     * Starts listening.
     *
     * @param port port to bind, 0 for any free port
     */
    public void start(int port) {
        log.info("Starting scenario API on port {}", port);
        app = Javalin.create().start(port);

        app.get("/api/scenarios", ctx -> json(ctx, engine.scenarios().stream()
                .map(s -> ScenarioSummary.of(s, engine.state(s.id()), engine.selected().contains(s.id())))
                .toList()));

        app.get("/api/scenarios/{id}/state", ctx -> {
            String id = ctx.pathParam("id");
            json(ctx, Map.of("id", id, "state", engine.state(id)));
        });

        app.get("/api/scenarios/{id}/result", ctx -> {
            String id = ctx.pathParam("id");
            Optional<TaxCalculationResult> result = engine.cachedResult(id);
            if (result.isPresent()) {
                json(ctx, result.get());
            } else {
                ctx.status(404);
                json(ctx, Map.of("error", "No calculated result for " + id, "state", engine.state(id)));
            }
        });

        app.post("/api/scenarios/{id}/calculate", ctx -> {
            String id = ctx.pathParam("id");
            engine.state(id);
            respond(ctx, id);
        });

        app.get("/api/baseline", ctx -> respond(ctx, ScenarioEngine.BASELINE_ID));

        app.get("/api/selection", ctx -> json(ctx, selection()));

        app.post("/api/selection/{id}", ctx -> {
            engine.select(ctx.pathParam("id"));
            json(ctx, selection());
        });

        app.delete("/api/selection/{id}", ctx -> {
            engine.deselect(ctx.pathParam("id"));
            json(ctx, selection());
        });

        app.get("/api/comparison", ctx -> json(ctx, engine.compareSelected()));

        app.exception(IllegalArgumentException.class, (e, ctx) -> error(ctx, 404, e));
        app.exception(GraphDefectException.class, (e, ctx) -> {
            log.error("Defect while serving {}: {}", ctx.path(), e.getMessage(), e);
            error(ctx, 500, e);
        });
    }

    /** The bound port; meaningful once started. */
    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            log.info("Scenario API stopped");
        }
    }

    private void respond(Context ctx, String id) {
        ctx.future(() -> publisher.submit(id)
                .thenAccept(result -> json(ctx, result))
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (!(cause instanceof IllegalArgumentException))
                        log.error("Calculation of {} failed: {}", id, cause.getMessage(), cause);
                    error(ctx, cause instanceof IllegalArgumentException ? 404 : 500, cause);
                    return null;
                }));
    }

    private Map<String, Object> selection() {
        Map<String, Object> body = new LinkedHashMap<>();
        List<String> selected = engine.selected();
        body.put("selected", selected);
        body.put("limit", engine.selectionLimit());
        return body;
    }

    private static void json(Context ctx, Object body) {
        ctx.contentType(JSON).result(Json.write(body));
    }

    private static void error(Context ctx, int status, Throwable e) {
        ctx.status(status);
        json(ctx, Map.of("error", String.valueOf(e.getMessage())));
    }
}
