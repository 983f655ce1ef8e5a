package io.pricedock;

import io.pricedock.cli.PriceDockCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PriceDockCommand()).execute(args);
        System.exit(code);
    }
}
