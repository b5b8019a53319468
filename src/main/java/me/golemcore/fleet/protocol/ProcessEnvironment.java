package me.golemcore.fleet.protocol;

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

import java.util.Locale;
import java.util.Map;

/**
 * Environment fix-up for processes spawned by external modules.
 *
 * <p>
 * When the module runs as a non-root user on a POSIX platform, {@code USER},
 * {@code LOGNAME} and {@code HOME} are forced to the effective user. They may
 * be inherited from a different user when the agent service drops
 * privileges, which makes tools look for their state in the wrong home.
 * Computed once per process.
 */
public final class ProcessEnvironment {

    private static final String ROOT_USER = "root";

    private final Map<String, String> overrides;

    ProcessEnvironment(String userName, String userHome, boolean windows) {
        if (windows || ROOT_USER.equals(userName) || userName == null || userHome == null) {
            this.overrides = Map.of();
        } else {
            this.overrides = Map.of(
                    "USER", userName,
                    "LOGNAME", userName,
                    "HOME", userHome);
        }
    }

    public static ProcessEnvironment detect() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return new ProcessEnvironment(System.getProperty("user.name"), System.getProperty("user.home"),
                os.contains("win"));
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    /**
     * Applies the overrides on top of an environment, typically after
     * caller-supplied variables have been merged into it.
     */
    public void apply(Map<String, String> environment) {
        environment.putAll(overrides);
    }
}
