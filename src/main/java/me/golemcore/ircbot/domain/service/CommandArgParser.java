package me.golemcore.ircbot.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Parses command usage strings into YAML schemas and checks command
 * arguments against them.
 *
 * <p>
 * Schema rules:
 * <ul>
 * <li>{@code ...} or {@code [...]} accepts any argument</li>
 * <li>a mapping requires a mapping argument; a missing field is allowed when
 * its schema is a bracketed string {@code [x]}, a sequence, or a mapping that
 * accepts an empty mapping</li>
 * <li>a sequence requires a sequence argument</li>
 * <li>any other scalar, such as {@code <channel>}, takes the raw argument
 * text; a bracketed scalar makes it optional</li>
 * </ul>
 */
@Component
public class CommandArgParser {

    private static final String ANYTHING = "...";
    private static final String ANYTHING_BRACKETED = "[...]";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Parses a usage string. A blank usage means the command takes no
     * argument, which is the empty mapping.
     *
     * @throws IllegalArgumentException
     *             if the usage is not valid YAML
     */
    public JsonNode parseUsage(String usage) {
        if (usage == null || usage.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        String trimmed = usage.trim();
        if (ANYTHING.equals(trimmed) || ANYTHING_BRACKETED.equals(trimmed)) {
            return TextNode.valueOf(trimmed);
        }
        try {
            JsonNode schema = yamlMapper.readTree(usage);
            return schema != null && !schema.isMissingNode() ? schema : JsonNodeFactory.instance.objectNode();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Usage is not valid YAML: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses {@code argText} and checks it against {@code schema}.
     */
    public ParsedArgument parse(JsonNode schema, String argText) {
        String text = argText != null ? argText.trim() : "";

        if (isRawScalarSchema(schema)) {
            String schemaText = schema.asText();
            if (text.isEmpty() && !isBracketed(schemaText)) {
                return ParsedArgument.failed(BotCmdResult.argMissing(stripDelimiters(schemaText)));
            }
            return ParsedArgument.of(TextNode.valueOf(text));
        }

        JsonNode argument;
        if (text.isEmpty()) {
            argument = JsonNodeFactory.instance.objectNode();
        } else {
            try {
                argument = yamlMapper.readTree(text);
            } catch (JsonProcessingException e) {
                return ParsedArgument.failed(BotCmdResult.syntaxErr());
            }
            if (argument == null || argument.isMissingNode()) {
                argument = JsonNodeFactory.instance.objectNode();
            }
        }

        BotCmdResult failure = check(schema, argument);
        return failure != null ? ParsedArgument.failed(failure) : ParsedArgument.of(argument);
    }

    private BotCmdResult check(JsonNode expected, JsonNode actual) {
        if (isAnything(expected)) {
            return null;
        }
        if (expected.isObject()) {
            if (!actual.isObject()) {
                return BotCmdResult.syntaxErr();
            }
            return checkFields((ObjectNode) expected, (ObjectNode) actual);
        }
        if (expected.isArray()) {
            return actual.isArray() ? null : BotCmdResult.syntaxErr();
        }
        return actual.isValueNode() || actual.isNull() ? null : BotCmdResult.syntaxErr();
    }

    private BotCmdResult checkFields(ObjectNode expected, ObjectNode actual) {
        Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = actual.get(field.getKey());
            JsonNode fieldSchema = field.getValue();
            BotCmdResult failure;
            if (value != null) {
                failure = check(fieldSchema, value);
            } else if ((fieldSchema.isTextual() && isBracketed(fieldSchema.asText())) || fieldSchema.isArray()) {
                failure = null;
            } else if (fieldSchema.isObject()) {
                failure = check(fieldSchema, JsonNodeFactory.instance.objectNode());
            } else {
                failure = BotCmdResult.argMissing(field.getKey());
            }
            if (failure != null) {
                return failure;
            }
        }
        return null;
    }

    private static boolean isRawScalarSchema(JsonNode schema) {
        return schema.isValueNode() && !isAnything(schema);
    }

    private static boolean isAnything(JsonNode schema) {
        if (schema.isArray() && schema.size() == 1) {
            return isAnything(schema.get(0));
        }
        if (!schema.isTextual()) {
            return false;
        }
        String text = schema.asText();
        return ANYTHING.equals(text) || ANYTHING_BRACKETED.equals(text);
    }

    private static boolean isBracketed(String text) {
        return text.length() >= 2 && text.startsWith("[") && text.endsWith("]");
    }

    private static String stripDelimiters(String text) {
        if (text.length() >= 2 && ((text.startsWith("<") && text.endsWith(">")) || isBracketed(text))) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    /**
     * Checked argument, or the result to report instead of running the
     * handler.
     */
    public record ParsedArgument(JsonNode value, BotCmdResult failure) {

        static ParsedArgument of(JsonNode value) {
            return new ParsedArgument(value, null);
        }

        static ParsedArgument failed(BotCmdResult failure) {
            return new ParsedArgument(null, failure);
        }

        public boolean isValid() {
            return failure == null;
        }
    }
}
