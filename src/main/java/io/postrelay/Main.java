package io.postrelay;

import io.postrelay.cli.PostRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PostRelayCommand()).execute(args);
        System.exit(code);
    }
}
