package com.cmlarchitect.core.validation;

import com.cmlarchitect.parser.CmlLexer;
import org.antlr.v4.runtime.Vocabulary;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keywords that cannot appear unescaped as names in CML text.
 *
 * <p>Two sets are kept:
 * <ul>
 *   <li>{@link #isReservedAttributeName(String)}: the Context Mapper keyword list plus every
 *       keyword of our own grammar, compared case-insensitively. Attribute names in this set
 *       are written with a {@code ^} prefix.</li>
 *   <li>{@link #isGrammarKeyword(String)}: the exact keywords of {@code Cml.g4}. Any other name
 *       equal to one of them must be escaped too, or the text would not parse back.</li>
 * </ul>
 * Escaping is a writing concern only; models always hold unescaped names.
 */
public final class CmlKeywords {

    private static final Pattern KEYWORD_LITERAL = Pattern.compile("'([A-Za-z_][A-Za-z0-9_]*)'");

    private static final Set<String> CONTEXT_MAPPER_KEYWORDS = Set.of(
        "abstract", "action", "aggregate", "aggregateroot", "application", "assert", "async",
        "boundedcontext", "by",
        "case", "catch", "class", "command", "contains", "context",
        "def", "default", "description", "do", "domain", "domainevent", "domainvisionstatement",
        "else", "entity", "enum", "event", "exposedaggregates", "extends",
        "false", "final", "finally", "for", "function",
        "gap", "get",
        "hint", "hook",
        "if", "implements", "implementationtechnology", "import", "in", "input", "instanceof",
        "key", "knowledgelevel",
        "let", "list",
        "map", "module", "name",
        "new", "null", "nullable",
        "of", "operation", "optional", "output",
        "package", "param", "path", "plateau", "private", "protected", "public",
        "query",
        "ref", "repository", "required", "responsibilities", "result", "return",
        "scaffold", "service", "set", "state", "static", "subdomain", "super", "switch",
        "this", "throw", "trait", "true", "try", "type",
        "url", "use",
        "value", "valueobject", "var", "version", "void",
        "while", "with"
    );

    private static final Set<String> GRAMMAR_KEYWORDS = grammarKeywords(CmlLexer.VOCABULARY);

    private static final Set<String> RESERVED_ATTRIBUTE_NAMES = reservedAttributeNames();

    private CmlKeywords() {
        // Utility class
    }

    /**
     * Returns whether an attribute name must be escaped with {@code ^} when written.
     *
     * @param name unescaped attribute name
     * @return true if the name matches a keyword, ignoring case
     */
    public static boolean isReservedAttributeName(String name) {
        return name != null && RESERVED_ATTRIBUTE_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether a name is exactly one of the grammar's keyword tokens.
     *
     * @param name unescaped name
     * @return true if the lexer would read the name as a keyword
     */
    public static boolean isGrammarKeyword(String name) {
        return name != null && GRAMMAR_KEYWORDS.contains(name);
    }

    private static Set<String> grammarKeywords(Vocabulary vocabulary) {
        Set<String> keywords = new HashSet<>();
        for (int type = 1; type <= vocabulary.getMaxTokenType(); type++) {
            String literal = vocabulary.getLiteralName(type);
            if (literal == null) {
                continue;
            }
            var matcher = KEYWORD_LITERAL.matcher(literal);
            if (matcher.matches()) {
                keywords.add(matcher.group(1));
            }
        }
        return Set.copyOf(keywords);
    }

    private static Set<String> reservedAttributeNames() {
        Set<String> names = new HashSet<>(CONTEXT_MAPPER_KEYWORDS);
        GRAMMAR_KEYWORDS.forEach(keyword -> names.add(keyword.toLowerCase(Locale.ROOT)));
        return Set.copyOf(names);
    }
}
