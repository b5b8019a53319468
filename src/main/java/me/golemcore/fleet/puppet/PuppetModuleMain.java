package me.golemcore.fleet.puppet;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.fleet.domain.service.JvmExitService;
import me.golemcore.fleet.infrastructure.config.AutoConfiguration;
import me.golemcore.fleet.protocol.ExternalModuleRunner;
import me.golemcore.fleet.protocol.ProcessEnvironment;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry point of the {@code puppet} external module.
 *
 * <p>
 * {@code puppet [metadata]} prints the module metadata; {@code puppet run}
 * reads the invocation from stdin and triggers a puppet agent run. No Spring
 * context is started: configuration arrives with the invocation.
 */
@Command(name = "puppet", description = "Runs the Puppet agent on behalf of the fleet agent.",
        mixinStandardHelpOptions = true)
public final class PuppetModuleMain implements Callable<Integer> {

    static final String DESCRIPTION = "Run the Puppet agent";

    @Parameters(index = "0", arity = "0..1", defaultValue = ExternalModuleRunner.METADATA_ACTION,
            paramLabel = "ACTION", description = "metadata (default) or the action to perform")
    private String action;

    private final ExternalModuleRunner runner;

    public PuppetModuleMain() {
        this(System.in, System.out, System.err);
    }

    PuppetModuleMain(InputStream in, PrintStream out, PrintStream err) {
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        this.runner = new ExternalModuleRunner(DESCRIPTION, PuppetRunAction.CONFIGURATION_SCHEMA,
                List.of(new PuppetRunAction(objectMapper, ProcessEnvironment.detect())),
                objectMapper, in, out, err);
    }

    @Override
    public Integer call() {
        return runner.run(action);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PuppetModuleMain()).execute(args);
        new JvmExitService().exit(exitCode);
    }
}
