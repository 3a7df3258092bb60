package io.sessionkeeper;

import io.sessionkeeper.cli.SessionKeeperCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SessionKeeperCommand()).execute(args);
        System.exit(code);
    }
}
