package io.eventrelay;

import io.eventrelay.cli.EventRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EventRelayCommand()).execute(args);
        System.exit(code);
    }
}
