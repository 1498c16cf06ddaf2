package com.isweep.dispatch.cli;

import com.isweep.core.preferences.PreferencesStore;
import com.isweep.core.rules.FilterRules;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: isweep serve
 * <p>
 * {@link CliRunner} never runs this through picocli; the web server starts
 * because {@link com.isweep.IsweepApplication} sees {@code serve} as the
 * subcommand. The class exists for {@code --help} and for the startup summary
 * printed once Tomcat has a port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the ISweep HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final FilterRules filterRules;
    private final PreferencesStore preferencesStore;

    public ServeCommand(FilterRules filterRules, PreferencesStore preferencesStore) {
        this.filterRules = filterRules;
        this.preferencesStore = preferencesStore;
    }

    @Override
    public void run() {
        printSummary(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printSummary(event.getWebServer().getPort());
    }

    private void printSummary(int listenPort) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Listening on port " + listenPort);
        ConsoleOutput.info("Rules: " + filterRules.signalCount() + " signals from " + filterRules.source());
        ConsoleOutput.info("Preferences: " + preferencesStore.getClass().getSimpleName());
        System.out.println();
        System.out.println("  POST /api/analyze     {user_id, text} -> action");
        System.out.println("  POST /event           {user_id, text, confidence?} -> decision");
        System.out.println("  POST /api/users       create a user");
        System.out.println("  GET  /api/health      component status");
        System.out.println();
    }
}
