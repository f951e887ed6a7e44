package com.launchpad.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ansi.AnsiColor;
import org.springframework.boot.ansi.AnsiOutput;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Announces the bound address once the web server is up, and the shutdown when the context closes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ServerStartupListener {

    private final ProcessRole processRole;
    private final RuntimeEnvironment runtimeEnvironment;

    @Value("${app.https:false}")
    private boolean https;

    @EventListener
    public void onServerStarted(WebServerInitializedEvent event) {
        String url = String.format("%s://%s:%d", https ? "https" : "http",
                ServerCustomizer.BIND_ADDRESS, event.getWebServer().getPort());

        if (processRole.isWorker()) {
            log.info(AnsiOutput.toString(AnsiColor.YELLOW, "Worker Server running at ", url, AnsiColor.DEFAULT));
        } else {
            log.info(AnsiOutput.toString(AnsiColor.BLUE, "Server running at ", url, AnsiColor.DEFAULT));
        }
        log.info("Environment: {}", runtimeEnvironment);
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        log.info("Shutting down {} process", processRole);
    }
}
