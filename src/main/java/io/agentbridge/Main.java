package io.agentbridge;

import io.agentbridge.cli.AgentBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new AgentBridgeCommand())
                .setExecutionExceptionHandler(AgentBridgeCommand::handleExecutionException);
        int code = commandLine.execute(args);
        System.exit(code);
    }
}
