package com.alterante.speedtest.command;

import com.alterante.speedtest.engine.EngineRegistry;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "engines",
        description = "List the available measurement engines",
        mixinStandardHelpOptions = true
)
public class EnginesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        for (EngineRegistry.Entry entry : EngineRegistry.entries()) {
            System.out.printf("  %-8s %s%n", entry.name(), entry.description());
        }
        return 0;
    }
}
