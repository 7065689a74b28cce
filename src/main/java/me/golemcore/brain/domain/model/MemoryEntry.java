package me.golemcore.brain.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * One retained conversational turn, as appended to a daily tier file.
 * Immutable once created.
 */
@Value
@Builder
public class MemoryEntry {

    public enum Role {
        USER("user"), ASSISTANT("assistant");

        private final String code;

        Role(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        public static Optional<Role> fromCode(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Role role : values()) {
                if (role.code.equals(normalized)) {
                    return Optional.of(role);
                }
            }
            return Optional.empty();
        }
    }

    public enum Importance {
        NORMAL("normal"), HIGH("high"), ACTION("action"), DECISION("decision"), LONG_TERM("long-term");

        private final String code;

        Importance(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        /**
         * Resolves a label such as {@code long-term}. A null label is
         * {@link #NORMAL}.
         *
         * @throws IllegalArgumentException
         *             for an unknown label
         */
        public static Importance fromCode(String value) {
            if (value == null) {
                return NORMAL;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Importance importance : values()) {
                if (importance.code.equals(normalized)) {
                    return importance;
                }
            }
            throw new IllegalArgumentException("Unknown importance: " + value);
        }
    }

    String content;
    Role role;

    @Builder.Default
    String category = "general";

    @Builder.Default
    Importance importance = Importance.NORMAL;

    OffsetDateTime timestamp;
}
