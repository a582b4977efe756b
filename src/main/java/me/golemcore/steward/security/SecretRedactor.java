package me.golemcore.steward.security;

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

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Masks credentials in tool parameters before they are written to a formatted
 * transcript.
 */
@Component
public class SecretRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final List<String> SENSITIVE_KEYS = List.of(
            "apikey", "token", "password", "passwd", "secret", "authorization", "credential", "privatekey");

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("sk-[A-Za-z0-9_-]{8,}"),
            Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+"),
            Pattern.compile("(?i)\\b([A-Z0-9_]*(?:API_KEY|TOKEN|SECRET|PASSWORD))=\\S+"));

    /**
     * Convert a JSON parameter object to plain values with secrets masked.
     */
    public Map<String, Object> redactParameters(JsonNode parameters) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (parameters == null || !parameters.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isSensitiveKey(field.getKey())) {
                result.put(field.getKey(), REDACTED);
            } else {
                result.put(field.getKey(), redactNode(field.getValue()));
            }
        }
        return result;
    }

    public String redactText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String redacted = text;
        for (Pattern pattern : SECRET_PATTERNS) {
            redacted = pattern.matcher(redacted).replaceAll(REDACTED);
        }
        return redacted;
    }

    public boolean isSensitiveKey(String key) {
        String normalized = key.toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]", "");
        return SENSITIVE_KEYS.stream().anyMatch(normalized::contains);
    }

    private Object redactNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return redactParameters(node);
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(element -> values.add(redactNode(element)));
            return values;
        }
        if (node.isTextual()) {
            return redactText(node.asText());
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return redactText(node.asText());
    }
}
