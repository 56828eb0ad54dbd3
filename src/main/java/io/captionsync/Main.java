package io.captionsync;

import io.captionsync.cli.CaptionSyncCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CaptionSyncCommand()).execute(args);
        System.exit(code);
    }
}
