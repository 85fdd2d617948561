package com.crewdesk.dispatch.cli;

import com.crewdesk.core.engine.DispatchEngine;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: crewdesk serve
 * <p>
 * Runs Crewdesk as a long-lived HTTP server. {@link CliRunner} skips picocli
 * in serve mode, so the work happens once the web server is up: the engine
 * recovers the persisted queue and starts processing, then the banner prints.
 * <p>
 * Configure the port via {@code SERVER_PORT=9090 crewdesk serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Crewdesk HTTP server")
@Component
public class ServeCommand implements Runnable {

    private final DispatchEngine engine;

    public ServeCommand(DispatchEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        // Not reached in serve mode; kept for subcommand registration and --help.
        ConsoleOutput.info("Run 'crewdesk serve' as the only argument to start the server.");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        engine.start();
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Crewdesk server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
