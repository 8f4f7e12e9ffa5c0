package io.sichter;

import io.sichter.cli.SichterCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SichterCommand()).execute(args);
        System.exit(code);
    }
}
