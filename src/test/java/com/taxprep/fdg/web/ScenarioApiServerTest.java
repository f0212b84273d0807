package com.taxprep.fdg.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.taxprep.fdg.FormGraph;
import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.assembly.FieldTemplates;
import com.taxprep.fdg.io.Json;
import com.taxprep.fdg.scenario.Modification;
import com.taxprep.fdg.scenario.Scenario;
import com.taxprep.fdg.scenario.ScenarioCalculator;
import com.taxprep.fdg.scenario.ScenarioEngine;
import com.taxprep.fdg.wiring.CalculationPublisher;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.Assert.*;

public class ScenarioApiServerTest {
    private final HttpClient http = HttpClient.newHttpClient();

    private ScenarioEngine engine;
    private CalculationPublisher publisher;
    private ScenarioApiServer server;

    @Before
    public void setUp() {
        engine = new ScenarioEngine(SampleReturns.singleFiler(50000, 5000),
                new ScenarioCalculator(FormGraph.builder(2025), FieldTemplates.load()));
        publisher = new CalculationPublisher(engine, 16);
        server = new ScenarioApiServer(engine, publisher);
        server.start(0);
    }

    @After
    public void tearDown() {
        server.stop();
        publisher.close();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return Json.mapper().readTree(response.body());
    }

    @Test
    public void testListCalculateAndFetch() throws Exception {
        Scenario s = engine.create("Raise", "more pay");
        engine.addModification(s.id(), Modification.adjust("Raise", "w2s[0].income", 10000));

        JsonNode list = json(send("GET", "/api/scenarios"));
        assertEquals(1, list.size());
        assertEquals("Raise", list.get(0).get("name").asText());
        assertEquals("DRAFT", list.get(0).get("state").asText());
        assertEquals(1, list.get(0).get("modifications").asInt());

        HttpResponse<String> missing = send("GET", "/api/scenarios/" + s.id() + "/result");
        assertEquals(404, missing.statusCode());
        assertEquals("DRAFT", json(missing).get("state").asText());

        HttpResponse<String> calculated = send("POST", "/api/scenarios/" + s.id() + "/calculate");
        assertEquals(200, calculated.statusCode());
        assertEquals(60000.0, json(calculated).get("agi").asDouble(), 0.0);
        assertNull(json(calculated).get("filingSet"));

        HttpResponse<String> cached = send("GET", "/api/scenarios/" + s.id() + "/result");
        assertEquals(200, cached.statusCode());
        assertEquals(s.id(), json(cached).get("scenarioId").asText());

        assertEquals("CALCULATED", json(send("GET", "/api/scenarios/" + s.id() + "/state")).get("state").asText());
    }

    @Test
    public void testUnknownScenarioIs404() throws Exception {
        assertEquals(404, send("GET", "/api/scenarios/nope/state").statusCode());
        HttpResponse<String> calc = send("POST", "/api/scenarios/nope/calculate");
        assertEquals(404, calc.statusCode());
        assertTrue(json(calc).get("error").asText().contains("nope"));
    }

    @Test
    public void testBaselineAndSelection() throws Exception {
        JsonNode baseline = json(send("GET", "/api/baseline"));
        assertTrue(baseline.get("baseline").asBoolean());
        assertEquals(34250.0, baseline.get("taxableIncome").asDouble(), 0.0);

        Scenario a = engine.create("A", null);
        Scenario b = engine.create("B", null);
        send("POST", "/api/selection/" + a.id());
        JsonNode selection = json(send("POST", "/api/selection/" + b.id()));
        assertEquals(2, selection.get("selected").size());
        assertEquals(3, selection.get("limit").asInt());

        JsonNode comparison = json(send("GET", "/api/comparison"));
        assertEquals(2, comparison.get("scenarios").size());
        assertEquals(0.0, comparison.get("scenarios").get(0).get("totalTaxDiff").asDouble(), 0.0);

        json(send("DELETE", "/api/selection/" + a.id()));
        assertEquals(1, json(send("GET", "/api/selection")).get("selected").size());
    }
}
