package com.taxprep.fdg;

import com.taxprep.fdg.assembly.FieldTemplates;
import com.taxprep.fdg.config.EngineConfig;
import com.taxprep.fdg.engine.ReturnGraphBuilder;
import com.taxprep.fdg.io.InformationReader;
import com.taxprep.fdg.model.ValidatedInformation;
import com.taxprep.fdg.scenario.ScenarioCalculator;
import com.taxprep.fdg.scenario.ScenarioEngine;
import com.taxprep.fdg.util.FormGraphExplain;
import com.taxprep.fdg.web.ScenarioApiServer;
import com.taxprep.fdg.wiring.CalculationPublisher;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serves the scenario API for one input snapshot.
 *
 * <pre>
 * java com.taxprep.fdg.ScenarioServerMain input.json
 * </pre>
 */
public class ScenarioServerMain {
    private static final Logger log = LogManager.getLogger(ScenarioServerMain.class);

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("usage: ScenarioServerMain <input.json>");
            System.exit(2);
        }

        // 1. Config and catalog
        EngineConfig config = EngineConfig.load();
        ReturnGraphBuilder builder = FormGraph.builder(config);
        log.info("\n{}", new FormGraphExplain(builder.buildOrder()).dumpBuildOrder());

        // 2. Input and engine
        ValidatedInformation info = InformationReader.read(Path.of(args[0]));
        FieldTemplates templates = config.isVerifyFieldLayout() ? FieldTemplates.load() : null;
        ScenarioEngine engine = new ScenarioEngine(info, new ScenarioCalculator(builder, templates),
                config.getSelectionLimit());

        // 3. Queue and HTTP
        CalculationPublisher publisher = new CalculationPublisher(engine, config.getRingBufferSize());
        ScenarioApiServer server = new ScenarioApiServer(engine, publisher);
        server.start(config.getApiPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            publisher.close();
            stopped.countDown();
        }));
        stopped.await();
    }
}
