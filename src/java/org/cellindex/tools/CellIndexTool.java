/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellindex.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

import org.cellindex.backend.IndexBackend;
import org.cellindex.backend.JdbcPostingBackend;
import org.cellindex.backend.PostgisBackend;
import org.cellindex.backend.SortedFileBackend;
import org.cellindex.bench.BenchmarkRunner;
import org.cellindex.bench.ShutdownHookInterruptSource;
import org.cellindex.config.BenchmarkDescriptor;
import org.cellindex.config.Config;
import org.cellindex.config.ConfigurationLoader;
import org.cellindex.config.YamlConfigurationLoader;
import org.cellindex.exceptions.ConfigurationException;
import org.cellindex.exceptions.CorruptIndexException;
import org.cellindex.index.PostingIndexBuilder;
import org.cellindex.index.SortedPostingIndex;
import org.cellindex.index.SortedPostingIndexWriter;
import org.cellindex.source.SpatialObjectSource;
import org.cellindex.source.WktLineStringSource;

/**
 * Builds sorted posting indexes and benchmarks cell index queries against them, a relational posting table, or a
 * PostGIS geometry table.
 */
public class CellIndexTool
{
    private static final Logger logger = LoggerFactory.getLogger(CellIndexTool.class);

    private static final String CONFIG_OPTION = "c";
    private static final String HELP_OPTION = "h";

    private static final Options options = new Options();

    static
    {
        Option config = new Option(CONFIG_OPTION, "config", true, "YAML configuration file (defaults to cellindex.yaml on the classpath)");
        config.setArgName("config.yaml");
        options.addOption(config);
        options.addOption(HELP_OPTION, "help", false, "Print this help");
    }

    enum Command
    {
        BUILD("build", 2, 3, "<objects.tsv> <index.db> [postings.csv]"),
        QUERY_SST("query-sst", 2, 2, "<objects.tsv> <index.db>"),
        QUERY_JDBC("query-jdbc", 1, 1, "<objects.tsv>"),
        QUERY_POSTGIS("query-postgis", 1, 1, "<objects.tsv>");

        final String name;
        final int minArgs;
        final int maxArgs;
        final String usage;

        Command(String name, int minArgs, int maxArgs, String usage)
        {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.usage = usage;
        }

        static Command fromName(String name)
        {
            for (Command command : values())
            {
                if (command.name.equals(name))
                    return command;
            }
            return null;
        }
    }

    public static void main(String[] args)
    {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out)
    {
        CommandLine cmd;
        CommandLineParser parser = new DefaultParser();
        try
        {
            cmd = parser.parse(options, args);
        }
        catch (ParseException e)
        {
            System.err.println(e.getMessage());
            printUsage();
            return 1;
        }

        if (cmd.hasOption(HELP_OPTION))
        {
            printUsage();
            return 0;
        }

        List<String> arguments = cmd.getArgList();
        Command command = arguments.isEmpty() ? null : Command.fromName(arguments.get(0));
        if (command == null)
        {
            System.err.println(arguments.isEmpty() ? "Missing command" : "Unknown command: " + arguments.get(0));
            printUsage();
            return 1;
        }

        List<String> commandArgs = arguments.subList(1, arguments.size());
        if (commandArgs.size() < command.minArgs || commandArgs.size() > command.maxArgs)
        {
            System.err.println("usage: " + command.name + ' ' + command.usage);
            return 1;
        }

        try
        {
            BenchmarkDescriptor descriptor = new BenchmarkDescriptor(loadConfig(cmd));
            execute(command, commandArgs, descriptor, out);
            return 0;
        }
        catch (ConfigurationException e)
        {
            if (e.logStackTrace)
                logger.error("Invalid configuration", e);
            else
                logger.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }
        catch (IOException | UncheckedIOException | CorruptIndexException e)
        {
            logger.error("{} failed", command.name, e);
            return 3;
        }
    }

    private static Config loadConfig(CommandLine cmd) throws ConfigurationException
    {
        if (cmd.hasOption(CONFIG_OPTION))
            return new YamlConfigurationLoader().loadConfig(YamlConfigurationLoader.configURL(cmd.getOptionValue(CONFIG_OPTION)));
        return ConfigurationLoader.create().loadConfig();
    }

    private static void execute(Command command, List<String> args, BenchmarkDescriptor descriptor, PrintStream out) throws IOException, ConfigurationException
    {
        Path objects = Paths.get(args.get(0));
        if (!Files.isRegularFile(objects))
            throw new ConfigurationException("Cannot find object file " + objects, false);
        SpatialObjectSource.Factory sources = () -> WktLineStringSource.open(objects);
        Config config = descriptor.config();

        switch (command)
        {
            case BUILD:
                build(descriptor, sources, Paths.get(args.get(1)), args.size() > 2 ? Paths.get(args.get(2)) : null, out);
                break;
            case QUERY_SST:
            {
                MetricRegistry registry = new MetricRegistry();
                SortedPostingIndex index = SortedPostingIndex.open(Paths.get(args.get(1)), descriptor.blockCacheBytes());
                index.cache().registerMetrics(registry, MetricRegistry.name("index", "cache"));
                benchmark(descriptor, new SortedFileBackend(index), sources, registry, out);
                break;
            }
            case QUERY_JDBC:
                checkJdbcUrl(config);
                benchmark(descriptor,
                          JdbcPostingBackend.connect(config.jdbc_url, config.jdbc_user, config.jdbc_password, config.postings_table),
                          sources, new MetricRegistry(), out);
                break;
            case QUERY_POSTGIS:
                checkJdbcUrl(config);
                benchmark(descriptor,
                          PostgisBackend.connect(config.jdbc_url, config.jdbc_user, config.jdbc_password, config.geometries_table),
                          sources, new MetricRegistry(), out);
                break;
            default:
                throw new AssertionError(command);
        }
    }

    private static void checkJdbcUrl(Config config) throws ConfigurationException
    {
        if (config.jdbc_url == null)
            throw new ConfigurationException("jdbc_url must be set to query a relational backend", false);
    }

    private static void build(BenchmarkDescriptor descriptor, SpatialObjectSource.Factory sources, Path indexPath, Path csvPath, PrintStream out) throws IOException
    {
        PostingIndexBuilder builder = new PostingIndexBuilder(descriptor.coveringPolicy(), descriptor.buildMaxObjects());
        try (SpatialObjectSource source = sources.open();
             SortedPostingIndexWriter writer = new SortedPostingIndexWriter(indexPath, descriptor.sortedIndexBlockSize());
             Writer csv = csvPath == null ? null : Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8))
        {
            PostingIndexBuilder.Summary summary = builder.build(source, writer, csv);
            out.printf("indexed %d objects into %d postings%n", summary.objects, summary.postings);
            if (summary.uncovered > 0 || summary.skippedRecords > 0)
                out.printf("skipped %d%n", summary.uncovered + summary.skippedRecords);
        }
    }

    private static void benchmark(BenchmarkDescriptor descriptor, IndexBackend backend, SpatialObjectSource.Factory sources, MetricRegistry registry, PrintStream out) throws IOException, ConfigurationException
    {
        try (IndexBackend closing = backend;
             ShutdownHookInterruptSource interrupts = new ShutdownHookInterruptSource())
        {
            new BenchmarkRunner(descriptor, closing, sources, registry, out).run(interrupts);
        }
        finally
        {
            Slf4jReporter.forRegistry(registry)
                         .outputTo(LoggerFactory.getLogger("org.cellindex.metrics"))
                         .build()
                         .report();
        }
    }

    private static void printUsage()
    {
        StringBuilder usage = new StringBuilder("cellindex [-c config.yaml] <command> <args>").append(System.lineSeparator());
        Arrays.stream(Command.values()).forEach(c -> usage.append("  ").append(c.name).append(' ').append(c.usage).append(System.lineSeparator()));
        String header = "Build and benchmark S2 cell inverted indexes.";
        new HelpFormatter().printHelp(usage.toString(), header, options, "");
    }
}
