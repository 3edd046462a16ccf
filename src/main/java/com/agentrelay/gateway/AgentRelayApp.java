package com.agentrelay.gateway;

import com.agentrelay.channels.CliChannel;
import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.router.AgentRouter;
import com.agentrelay.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.agentrelay")
public class AgentRelayApp {

    private static final Logger log = LoggerFactory.getLogger(AgentRelayApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(AgentRelayApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        var ctx = app.run(args);

        if (System.console() == null) {
            log.info("No console attached, CLI channel disabled");
            return;
        }
        var cli = new CliChannel(
                new BufferedReader(new InputStreamReader(System.in)),
                System.out,
                ctx.getBean(AgentRouter.class),
                ctx.getBean(AgentRegistry.class));
        cli.onStop(ctx::close);
        cli.start();
    }
}
