/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.drivelabs.core;

import io.drivelabs.common.FileUtils;
import io.drivelabs.common.ScenarioException;
import io.drivelabs.simulator.InMemorySimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintStream;
import java.util.concurrent.Callable;

/**
 * Runs a scenario file against the in-memory simulator.
 * <pre>
 * scenario my-scenario.yaml --ticks 500 --distance 0.5 --output result.json
 * </pre>
 */
@Command(
        name = "scenario",
        mixinStandardHelpOptions = true,
        version = "scenario 0.1.0",
        description = "Loads a scenario file and ticks it until an end condition holds"
)
public class Main implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(Main.class);

    @Parameters(index = "0", description = "Scenario YAML file")
    File scenario;

    @Option(names = {"-t", "--ticks"}, defaultValue = "1000",
            description = "Maximum number of ticks, 0 for no limit (default: ${DEFAULT-VALUE})")
    long ticks;

    @Option(names = {"-d", "--distance"}, defaultValue = "0",
            description = "Distance the ego vehicle moves per tick (default: ${DEFAULT-VALUE})")
    double distance;

    @Option(names = {"-o", "--output"}, description = "Write the result as JSON to this file")
    File output;

    @Option(names = {"-D", "--dryrun"}, description = "Only load the scenario and print the end conditions")
    boolean dryRun;

    PrintStream out = System.out;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        InMemorySimulator simulator = new InMemorySimulator(distance);
        ScenarioRunner runner;
        try {
            runner = ScenarioRunner.builder()
                    .document(ScenarioDocument.read(scenario))
                    .simulator(simulator)
                    .hook(new ScenarioHook() {
                        @Override
                        public boolean beforeTick(ScenarioRunner current, long tick) {
                            simulator.step();
                            return true;
                        }
                    })
                    .build();
        } catch (ScenarioException e) {
            logger.error("cannot load scenario: {}", e.getMessage());
            out.println("error: " + e.getMessage());
            return 2;
        }
        if (dryRun) {
            out.println("Success: " + runner.getSuccess());
            out.println("Failure: " + runner.getFailure());
            return 0;
        }
        ScenarioResult result = runner.run(ticks);
        out.println(result);
        if (output != null) {
            try {
                FileUtils.writeToFile(output, result.toJson());
                logger.debug("result written to: {}", output.getAbsolutePath());
            } catch (ScenarioException e) {
                logger.error("cannot write result: {}", e.getMessage());
                out.println("error: cannot write result: " + e.getMessage());
                return 3;
            }
        }
        return result.isSucceeded() ? 0 : 1;
    }

}
