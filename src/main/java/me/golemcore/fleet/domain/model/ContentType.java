package me.golemcore.fleet.domain.model;

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

/**
 * Payload content type carried by a broker envelope.
 */
public enum ContentType {

    JSON("json"),

    BINARY("binary");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire name; a missing name means JSON.
     */
    public static ContentType fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return JSON;
        }
        for (ContentType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) {
                return type;
            }
        }
        return BINARY;
    }
}
