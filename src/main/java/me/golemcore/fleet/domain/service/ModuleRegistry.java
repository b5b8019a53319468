package me.golemcore.fleet.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.component.AgentModule;
import me.golemcore.fleet.domain.component.BuiltinModule;
import me.golemcore.fleet.domain.component.ExternalModule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-indexed set of modules, built once on first use and read-only
 * afterwards.
 *
 * <p>
 * Built-in modules are registered first, ordered by name, followed by the
 * external modules of the modules directory. On a name collision the module
 * registered last wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModuleRegistry {

    private final List<BuiltinModule> builtinModules;
    private final ExternalModuleLoader externalModuleLoader;

    private boolean initialized;
    private Map<String, AgentModule> modulesByName = Map.of();

    public synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initializeInternal();
        initialized = true;
    }

    public Optional<AgentModule> find(String name) {
        ensureInitialized();
        return Optional.ofNullable(modulesByName.get(name));
    }

    public List<AgentModule> getModules() {
        ensureInitialized();
        return List.copyOf(modulesByName.values());
    }

    public List<String> getModuleNames() {
        ensureInitialized();
        return List.copyOf(modulesByName.keySet());
    }

    private void initializeInternal() {
        List<AgentModule> candidates = new ArrayList<>();
        builtinModules.stream()
                .sorted(Comparator.comparing(BuiltinModule::getName))
                .forEach(candidates::add);
        List<ExternalModule> externalModules = externalModuleLoader.loadModules();
        candidates.addAll(externalModules);

        Map<String, AgentModule> moduleMap = new LinkedHashMap<>();
        for (AgentModule module : candidates) {
            AgentModule previous = moduleMap.put(module.getName(), module);
            if (previous != null) {
                log.warn("[Registry] Module '{}' is defined more than once, the last definition replaces the"
                        + " earlier one", module.getName());
            }
        }
        this.modulesByName = Collections.unmodifiableMap(moduleMap);

        log.info("[Registry] Loaded {} modules ({} external)", modulesByName.size(), externalModules.size());
        logLoadedModules();
    }

    private void logLoadedModules() {
        for (AgentModule module : modulesByName.values()) {
            List<String> actions = module.getActionNames();
            String label = actions.size() == 1 ? "action" : "actions";
            log.info("[Registry] Loaded '{}' module - {}: {}", module.getName(), label,
                    actions.isEmpty() ? "(none)" : String.join(", ", actions));
        }
    }
}
