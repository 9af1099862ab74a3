package io.uabridge;

import io.uabridge.cli.UaBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new UaBridgeCommand()).execute(args);
        System.exit(code);
    }
}
