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

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the flags and environment entries a requester may pass to
 * {@code puppet agent}.
 *
 * <p>
 * The default flags are always on the command line and cannot be overridden;
 * repeating one verbatim is allowed. Other flags must be allow-listed, and a
 * value is accepted only for a value-taking flag, either as the next token or
 * as {@code --flag=value}. Values never contain whitespace or shell
 * metacharacters.
 */
public final class PuppetFlagValidator {

    public static final List<String> DEFAULT_FLAGS = List.of("--onetime", "--no-daemonize", "--verbose");

    static final Set<String> ALLOWED_FLAGS = Set.of(
            "--color", "--debug", "--environment", "--evaltrace", "--filetimeout", "--graph",
            "--http_compression", "--job-id", "--noop", "--no-noop", "--ordering", "--show_diff",
            "--skip_tags", "--strict_variables", "--summarize", "--tags", "--trace",
            "--use_cached_catalog", "--no-use_cached_catalog", "--usecacheonfailure",
            "--no-usecacheonfailure", "--waitforcert", "--sourceaddress");

    static final Set<String> VALUE_FLAGS = Set.of(
            "--color", "--environment", "--filetimeout", "--job-id", "--ordering", "--skip_tags", "--tags",
            "--waitforcert", "--sourceaddress");

    private static final Pattern SAFE_VALUE = Pattern.compile("[A-Za-z0-9_.,:/@%+=-]+");
    private static final Pattern ENV_ENTRY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*=.*", Pattern.DOTALL);
    private static final String FLAG_PREFIX = "--";
    private static final String NEGATION_PREFIX = "no-";

    private PuppetFlagValidator() {
    }

    /**
     * Finds the first flag that may not be passed.
     *
     * @return a description of the offending flag, empty when all flags are
     *         acceptable
     */
    public static Optional<String> findInvalidFlag(List<String> flags) {
        boolean expectingValue = false;
        for (String token : flags) {
            if (token == null || token.isEmpty()) {
                return Optional.of("empty flag");
            }
            if (!token.startsWith(FLAG_PREFIX)) {
                if (!expectingValue) {
                    return Optional.of("unexpected argument '" + token + "'");
                }
                if (!isSafeValue(token)) {
                    return Optional.of("invalid value '" + token + "'");
                }
                expectingValue = false;
                continue;
            }

            expectingValue = false;
            int equals = token.indexOf('=');
            String flag = equals >= 0 ? token.substring(0, equals) : token;

            Optional<String> defaultFlag = findDefault(flag);
            if (defaultFlag.isPresent()) {
                if (!token.equals(defaultFlag.get())) {
                    return Optional.of("'" + token + "' overrides the default flag '" + defaultFlag.get() + "'");
                }
                continue;
            }

            if (!ALLOWED_FLAGS.contains(flag)) {
                return Optional.of("'" + flag + "' is not an allowed flag");
            }
            if (equals >= 0) {
                if (!VALUE_FLAGS.contains(flag)) {
                    return Optional.of("'" + flag + "' does not take a value");
                }
                if (!isSafeValue(token.substring(equals + 1))) {
                    return Optional.of("invalid value in '" + token + "'");
                }
            } else {
                expectingValue = VALUE_FLAGS.contains(flag);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first environment entry that is not {@code KEY=VALUE}.
     */
    public static Optional<String> findInvalidEnvEntry(List<String> env) {
        for (String entry : env) {
            if (entry == null || !ENV_ENTRY.matcher(entry).matches()) {
                return Optional.of("invalid environment entry '" + entry + "'");
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the flags to append after the defaults, without verbatim
     * repetitions of a default.
     */
    public static List<String> withoutDefaults(List<String> flags) {
        return flags.stream().filter(flag -> !DEFAULT_FLAGS.contains(flag)).toList();
    }

    private static Optional<String> findDefault(String flag) {
        String base = baseName(flag);
        return DEFAULT_FLAGS.stream()
                .filter(defaultFlag -> baseName(defaultFlag).equals(base))
                .findFirst();
    }

    static String baseName(String flag) {
        String name = flag.startsWith(FLAG_PREFIX) ? flag.substring(FLAG_PREFIX.length()) : flag;
        return name.startsWith(NEGATION_PREFIX) ? name.substring(NEGATION_PREFIX.length()) : name;
    }

    private static boolean isSafeValue(String value) {
        return !value.isEmpty() && SAFE_VALUE.matcher(value).matches();
    }
}
