package com.celesteos.dispatch.cli;

import com.celesteos.core.engine.RoutingService;
import com.celesteos.core.model.ClassificationResult;
import com.celesteos.dispatch.api.ClassifyResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;

/**
 * CLI command: celeste classify "&lt;query&gt;"
 * <p>
 * Routes a single query and prints the lane and entities, or the raw JSON result
 * with {@code --json}.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a query into a lane")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language query")
    private String query;

    @Option(names = {"--json", "-j"}, description = "Print the result as JSON")
    private boolean json;

    private final RoutingService routingService;
    private final ObjectMapper objectMapper;

    public ClassifyCommand(RoutingService routingService, ObjectMapper objectMapper) {
        this.routingService = routingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ClassificationResult result = routingService.route(query, Map.of());

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(ClassifyResponse.from(result)));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render result: " + e.getOriginalMessage());
            }
            return;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.lane(result.lane(), result.laneReason());
        System.out.printf("Intent confidence: %.2f | Entity confidence: %.2f | Coverage: %.3f%n",
                result.scores().intentConfidence(), result.scores().entityConfidence(),
                result.metadata().coverage());

        if (!result.canonicalEntities().isEmpty()) {
            System.out.println();
            System.out.println("ENTITIES:");
            for (var e : result.canonicalEntities()) {
                ConsoleOutput.entity(e.type().wireName(), e.value(), e.canonical(), e.confidence());
            }
        }
        System.out.println();
        ConsoleOutput.info("Completed in " + result.metadata().latencyMs() + "ms");
    }
}
