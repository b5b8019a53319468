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

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code last_run_report.yaml}.
 *
 * <p>
 * Reports are tagged with ruby object tags ({@code !ruby/object:...}); such
 * nodes are loaded as plain maps, lists and strings. Timestamps are kept as
 * the strings found in the report.
 */
@Slf4j
public class LastRunReportReader {

    private static final int CODE_POINT_LIMIT = 64 * 1024 * 1024;

    /**
     * Returns the modification time of the report, or empty if it does not
     * exist.
     */
    public Optional<FileTime> modificationTime(Path report) {
        if (report == null || !Files.isRegularFile(report)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(report));
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", report, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses a report.
     *
     * @throws InvalidReportException
     *             if the report cannot be read or is not a YAML mapping
     */
    public Map<?, ?> read(Path report) {
        Yaml yaml = new Yaml(new ReportConstructor(loaderOptions()));
        Object document;
        try (Reader reader = Files.newBufferedReader(report, StandardCharsets.UTF_8)) {
            document = yaml.load(reader);
        } catch (IOException | YAMLException e) {
            throw new InvalidReportException("failed to parse " + report + ": " + e.getMessage(), e);
        }
        if (document instanceof Map<?, ?> map) {
            return map;
        }
        throw new InvalidReportException(report + " is not a YAML mapping");
    }

    private static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setCodePointLimit(CODE_POINT_LIMIT);
        options.setTagInspector(tag -> true);
        return options;
    }

    private static final class ReportConstructor extends SafeConstructor {

        private ReportConstructor(LoaderOptions options) {
            super(options);
            this.yamlConstructors.put(null, new ConstructUntagged());
            this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        }

        private final class ConstructUntagged extends AbstractConstruct {

            @Override
            public Object construct(Node node) {
                return switch (node.getNodeId()) {
                case mapping -> constructMapping((MappingNode) node);
                case sequence -> constructSequence((SequenceNode) node);
                default -> constructScalar((ScalarNode) node);
                };
            }
        }
    }
}
