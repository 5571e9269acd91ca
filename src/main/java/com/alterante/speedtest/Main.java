package com.alterante.speedtest;

import com.alterante.speedtest.command.EnginesCommand;
import com.alterante.speedtest.command.RunCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-speedtest",
        description = "Network throughput and latency measurement",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                RunCommand.class,
                EnginesCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
