package io.specqueue;

import io.specqueue.cli.SpecQueueCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = SpecQueueCommand.commandLine().execute(args);
        System.exit(code);
    }
}
