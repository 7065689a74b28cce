package me.golemcore.brain.adapter.inbound.command;

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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command arguments split into positionals, {@code --name value} options and
 * bare {@code --flag} switches.
 */
final class Arguments {

    private static final Set<String> VALUE_OPTIONS = Set.of("category", "importance", "limit", "since-hours");
    private static final String PREFIX = "--";

    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> flags;

    private Arguments(List<String> positionals, Map<String, String> options, Set<String> flags) {
        this.positionals = positionals;
        this.options = options;
        this.flags = flags;
    }

    static Arguments parse(List<String> args) {
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new HashMap<>();
        Set<String> flags = new HashSet<>();
        List<String> source = args != null ? args : List.of();
        for (int i = 0; i < source.size(); i++) {
            String arg = source.get(i);
            if (arg.startsWith(PREFIX) && arg.length() > PREFIX.length()) {
                String name = arg.substring(PREFIX.length());
                if (VALUE_OPTIONS.contains(name)) {
                    if (i + 1 >= source.size()) {
                        throw new IllegalArgumentException("--" + name + " needs a value");
                    }
                    options.put(name, source.get(++i));
                } else {
                    flags.add(name);
                }
            } else {
                positionals.add(arg);
            }
        }
        return new Arguments(positionals, options, flags);
    }

    Optional<String> positional(int index) {
        return index < positionals.size() ? Optional.of(positionals.get(index)) : Optional.empty();
    }

    String requirePositional(int index, String name) {
        return positional(index)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalArgumentException("missing <" + name + ">"));
    }

    /**
     * Positionals from {@code index} on, joined with spaces.
     */
    String positionalFrom(int index) {
        if (index >= positionals.size()) {
            return "";
        }
        return String.join(" ", positionals.subList(index, positionals.size()));
    }

    String requireText(String name) {
        String text = positionalFrom(0).trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("missing <" + name + ">");
        }
        return text;
    }

    Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    boolean flag(String name) {
        return flags.contains(name);
    }
}
