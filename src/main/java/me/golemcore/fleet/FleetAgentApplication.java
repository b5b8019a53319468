package me.golemcore.fleet;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Fleet Agent.
 *
 * <p>
 * The fleet agent keeps a persistent connection to a message broker, receives
 * action requests addressed to it and routes each one to a named module. A
 * module either runs in-process (built-in) or as an independent executable
 * that speaks the external module protocol over stdin/stdout.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → WebSocketBrokerConnector (BrokerConnector port)
 * Domain Layer       → AgentDispatcher, ModuleRegistry, modules
 * External modules   → protocol runner, puppet run action
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FleetAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetAgentApplication.class, args);
    }

}
