package com.provenant.dispatch.cli;

import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: provenant serve
 * <p>
 * Starts the REST API. The web server is enabled by
 * {@link com.provenant.ProvenantApplication#main} detecting "serve" in the arguments, and
 * {@link CliRunner} skips picocli in that mode; this class only registers the subcommand
 * and prints the banner once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Provenant HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.info("Run 'provenant serve' as the only command to start the server.");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Provenant server running on port " + port);
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Metrics:    http://localhost:" + port + "/actuator/prometheus");
    }
}
