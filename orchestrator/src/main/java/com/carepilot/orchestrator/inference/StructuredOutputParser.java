package com.carepilot.orchestrator.inference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of a model's text reply.
 *
 * Models asked for JSON still sometimes wrap it in a ```json fence or add a
 * sentence before it. This parser accepts, in order:
 *   1. the content of the first fenced block
 *   2. the first balanced {...} object in the text
 * It does no schema checking; see {@link OutputSchema#validate}.
 */
public final class StructuredOutputParser {

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    private StructuredOutputParser() {}

    /**
     * Extract the JSON object text from a reply.
     *
     * Returns Optional.empty() when the reply contains no object at all.
     */
    public static Optional<String> extractJsonObject(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        Matcher m = FENCED_BLOCK.matcher(reply);
        String candidate = m.find() ? m.group(1) : reply;
        return firstBalancedObject(candidate);
    }

    /**
     * Scan for the first top-level {...} span, honouring string literals so
     * that braces inside quoted text do not end the object early.
     */
    private static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) return Optional.empty();

        int depth = 0;
        boolean inString = false;
        boolean escaped  = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped)        escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"')  inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();   // unbalanced: truncated output
    }
}
