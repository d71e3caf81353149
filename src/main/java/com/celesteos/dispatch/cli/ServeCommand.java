package com.celesteos.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: celeste serve
 * <p>
 * Starts the router as an HTTP service. The servlet stack is enabled by
 * {@link com.celesteos.CelesteRouterApplication#main} when "serve" is in the arguments,
 * and {@link CliRunner} then skips picocli so the web server keeps the JVM alive.
 * The banner is printed once the server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the router HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Router listening on port " + port);
        System.out.println();
        System.out.println("  Classify:  POST http://localhost:" + port + "/api/v1/classify");
        System.out.println("  Health:    GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
