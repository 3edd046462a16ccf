package com.agentrelay.channels;

import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.router.AgentRouter;

import java.io.BufferedReader;
import java.io.PrintStream;

public class CliChannel {

    private final BufferedReader reader;
    private final PrintStream out;
    private final AgentRouter router;
    private final AgentRegistry registry;
    private volatile boolean running;
    private Thread readThread;
    private Runnable onStop;

    public CliChannel(BufferedReader reader, PrintStream out, AgentRouter router, AgentRegistry registry) {
        this.reader = reader;
        this.out = out;
        this.router = router;
        this.registry = registry;
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    public void start() {
        running = true;
        readThread = new Thread(this::runLoop, "relay-cli");
        readThread.setDaemon(true);
        readThread.start();
    }

    public boolean isRunning() {
        return running;
    }

    /** Reads and answers lines on the calling thread until /quit or end of input. */
    public void run() {
        running = true;
        runLoop();
    }

    private void runLoop() {
        out.println("AgentRelay CLI (/agents lists agents, /quit to stop)");
        while (running) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (Exception e) {
                if (!running) break;
                var msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                out.println("Input read error: " + msg);
                continue;
            }

            if (line == null) {
                finish();
                break;
            }
            var input = line.trim();
            if (input.isEmpty()) continue;
            if ("/quit".equals(input) || "/exit".equals(input)) {
                finish();
                break;
            }
            if ("/agents".equals(input)) {
                printAgents();
                continue;
            }

            try {
                out.println(router.route(input).content());
            } catch (Exception e) {
                var msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                out.println("Message handling error: " + msg);
            }
        }
    }

    private void printAgents() {
        var agents = registry.listAgents();
        if (agents.isEmpty()) {
            out.println("No agents registered.");
            return;
        }
        for (var a : agents) {
            out.println(a.name() + "  " + a.endpoint() + "  " + String.join(",", a.capabilities()));
        }
    }

    private void finish() {
        stop();
        if (onStop != null) onStop.run();
    }

    public void stop() {
        running = false;
        if (readThread != null && readThread != Thread.currentThread()) readThread.interrupt();
    }
}
