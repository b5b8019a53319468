package me.golemcore.fleet.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All agent configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>broker location and identity</li>
 * <li>{@link SslProperties} - client certificate and CA stores</li>
 * <li>{@link ConnectionProperties} - connect timeouts, keepalive and
 * reconnect backoff</li>
 * <li>module, module configuration and spool directories</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String brokerWsUri = "wss://localhost:8142/pcp/";
    private String identity = "pcp://localhost/agent";
    private String modulesDir = "${user.home}/.fleet-agent/modules";
    private String modulesConfigDir = "${user.home}/.fleet-agent/modules.d";
    private String spoolDir = "${user.home}/.fleet-agent/spool";
    private int sendTimeout = 10;
    private int moduleMetadataTimeout = 30;
    private SslProperties ssl = new SslProperties();
    private ConnectionProperties connection = new ConnectionProperties();

    public Path modulesPath() {
        return resolvePath(modulesDir);
    }

    public Path modulesConfigPath() {
        return resolvePath(modulesConfigDir);
    }

    public Path spoolPath() {
        return resolvePath(spoolDir);
    }

    public static Path resolvePath(String configured) {
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
    }

    @Data
    public static class SslProperties {
        private String keyStore = "";
        private String keyStorePassword = "";
        private String keyStoreType = "PKCS12";
        private String trustStore = "";
        private String trustStorePassword = "";
        private String trustStoreType = "PKCS12";
    }

    @Data
    public static class ConnectionProperties {
        private long connectTimeout = 10000;
        private long pingInterval = 15000;
        private long reconnectInitialDelay = 2000;
        private long reconnectMaxDelay = 60000;
        private int maxConnectAttempts = 5;
    }
}
