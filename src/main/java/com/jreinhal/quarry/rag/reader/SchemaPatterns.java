package com.jreinhal.quarry.rag.reader;

import java.util.regex.Pattern;

/**
 * Patterns for SQL schema-definition content, shared by sentence scoring, span extraction and answer normalization.
 */
public final class SchemaPatterns {
    static final Pattern SCHEMA_KEYWORD = Pattern.compile(
            "\\b(?:CREATE|ALTER|DROP)\\s+(?:UNIQUE\\s+)?(?:TABLE|INDEX|EXTENSION|VIEW|MATERIALIZED\\s+VIEW|FUNCTION|TRIGGER|SCHEMA|TYPE)\\b",
            Pattern.CASE_INSENSITIVE);
    static final Pattern CODE_FENCE = Pattern.compile("```");
    static final Pattern COMMAND_VERB = Pattern.compile(
            "^\\s*(?:create|alter|drop|insert|update|delete|select)\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern DEFINITION_VERB = Pattern.compile(
            "^\\s*(?:create|alter|drop)\\b", Pattern.CASE_INSENSITIVE);

    private SchemaPatterns() {
    }

    public static boolean containsSchemaKeyword(String text) {
        return text != null && SCHEMA_KEYWORD.matcher(text).find();
    }

    public static boolean containsCodeFence(String text) {
        return text != null && CODE_FENCE.matcher(text).find();
    }

    public static boolean startsWithCommandVerb(String text) {
        return text != null && COMMAND_VERB.matcher(text).find();
    }

    public static boolean startsWithDefinitionVerb(String text) {
        return text != null && DEFINITION_VERB.matcher(text).find();
    }
}
