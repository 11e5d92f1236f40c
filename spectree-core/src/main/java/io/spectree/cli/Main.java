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
package io.spectree.cli;

import io.spectree.common.ConfigLoader;
import io.spectree.core.DispatchReporter;
import io.spectree.core.Filter;
import io.spectree.core.Ordinal;
import io.spectree.core.Reporter;
import io.spectree.core.Rerunner;
import io.spectree.core.RunResult;
import io.spectree.core.Runner;
import io.spectree.core.Stopper;
import io.spectree.core.Suite;
import io.spectree.core.SuiteResolutionException;
import io.spectree.log.LogContext;
import io.spectree.output.ConsoleReporter;
import io.spectree.output.JsonLinesReporter;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 * <pre>
 * spectree -T 4 -x Slow -o target/events.jsonl com.acme.StackSpec com.acme.QueueSpec
 * spectree -n "A Stack should pop values in last-in-first-out order" com.acme.StackSpec
 * </pre>
 * Exit code is 0 when nothing failed or aborted, 1 otherwise and 2 on usage errors.
 */
@Command(
        name = "spectree",
        mixinStandardHelpOptions = true,
        version = "spectree 1.0",
        description = "Run spectree suites"
)
public class Main implements Callable<Integer> {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    @Parameters(
            arity = "1..*",
            description = "Fully qualified class names of the suites to run"
    )
    List<String> suiteClasses;

    @Option(
            names = {"-T", "--threads"},
            description = "Number of parallel threads (default: 1)"
    )
    int threads = 1;

    @Option(
            names = {"-i", "--include"},
            description = "Only run tests with one of these tags"
    )
    List<String> includeTags = new ArrayList<>();

    @Option(
            names = {"-x", "--exclude"},
            description = "Skip tests with any of these tags"
    )
    List<String> excludeTags = new ArrayList<>();

    @Option(
            names = {"--report-excluded"},
            description = "Report excluded tests as ignored"
    )
    boolean reportExcluded;

    @Option(
            names = {"-n", "--name"},
            description = "Full name of a single test to rerun (needs exactly one suite)"
    )
    String testName;

    @Option(
            names = {"-c", "--config"},
            description = "JSON config file handed to every test, classpath: prefix supported"
    )
    String configPath;

    @Option(
            names = {"-o", "--output"},
            description = "Write every event to this JSON Lines file"
    )
    Path output;

    private final ClassSuiteResolver resolver;

    public Main() {
        this(new ClassSuiteResolver());
    }

    Main(ClassSuiteResolver resolver) {
        this.resolver = resolver;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

    @Override
    public Integer call() {
        if (testName != null) {
            if (suiteClasses.size() != 1) {
                logger.error("--name needs exactly one suite, got {}", suiteClasses.size());
                return 2;
            }
            return rerun();
        }
        List<Suite> suites = new ArrayList<>();
        for (String className : suiteClasses) {
            try {
                suites.add(resolver.resolve(className));
            } catch (SuiteResolutionException e) {
                logger.error("{} ({})", e.getMessage(), e.getReason().getLabel());
                return 1;
            }
        }
        Runner.Builder builder = Runner.suites(suites.toArray(new Suite[0]))
                .includeTags(includeTags)
                .excludeTags(excludeTags)
                .reportExcluded(reportExcluded)
                .parallel(threads)
                .configPath(configPath)
                .reporter(new ConsoleReporter());
        if (output != null) {
            builder.reporter(new JsonLinesReporter(output));
        }
        RunResult result = builder.run();
        logger.debug("result: {}", result.toJson());
        return result.isPassed() ? 0 : 1;
    }

    private int rerun() {
        Map<String, Object> config = configPath == null ? Map.of() : ConfigLoader.load(configPath);
        Set<String> include = new LinkedHashSet<>(includeTags);
        Set<String> exclude = new LinkedHashSet<>(excludeTags);
        Filter filter = Filter.of(include, exclude).reportExcluded(reportExcluded);
        RunResult result = new RunResult();
        List<Reporter> reporters = new ArrayList<>();
        reporters.add(result);
        reporters.add(new ConsoleReporter());
        if (output != null) {
            reporters.add(new JsonLinesReporter(output));
        }
        DispatchReporter reporter = new DispatchReporter(reporters);
        try {
            new Rerunner(resolver).rerun(suiteClasses.get(0), testName, reporter, Stopper.NEVER, filter,
                    config, null, new Ordinal(0));
        } finally {
            reporter.dispose();
        }
        return result.isPassed() ? 0 : 1;
    }

}
