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

import java.util.regex.Pattern;

/**
 * Recognizes agent states that {@code puppet agent} only reports as console
 * text.
 *
 * <p>
 * This is a text match over human-readable output and breaks if the messages
 * change; puppet offers no structured status channel for these states.
 */
public final class PuppetConsoleOutput {

    private static final Pattern ALREADY_RUNNING = Pattern
            .compile("Run of Puppet configuration client already in progress");
    private static final Pattern DISABLED = Pattern
            .compile("disabled.*Use 'puppet agent --enable' to re-enable", Pattern.DOTALL);

    private PuppetConsoleOutput() {
    }

    public static boolean isAlreadyRunning(String output) {
        return output != null && ALREADY_RUNNING.matcher(output).find();
    }

    public static boolean isDisabled(String output) {
        return output != null && DISABLED.matcher(output).find();
    }
}
