package com.specmend.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lenient line-oriented parser for indented key:value documents.
 *
 * This is not a YAML parser. Each non-blank line is split at its first colon;
 * lines without a colon are skipped. Indentation (leading spaces / 2) decides
 * nesting: a line with an empty value opens a block and every deeper line that
 * follows nests under it until indentation drops back.
 *
 * Keys and values are unquoted: a {@code '200':} line yields key {@code 200}.
 *
 * Never throws on malformed content; a defective line is simply omitted.
 * Stateless, so one instance is shared by every caller.
 */
@Component
public class DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    public static final int INDENT_UNIT = 2;

    static final String VERSION_KEY    = "openapi";
    static final String INFO_KEY       = "info";
    static final String PATHS_KEY      = "paths";
    static final String COMPONENTS_KEY = "components";
    static final String SERVERS_KEY    = "servers";
    static final String SCHEMAS_KEY    = "schemas";

    public DocumentTree parse(String text) {

        DocumentTree tree = new DocumentTree();
        if (text == null || text.isBlank()) {
            return tree;
        }

        String[] lines  = text.split("\\r?\\n", -1);
        Deque<OpenBlock> stack = new ArrayDeque<>();
        int skipped = 0;

        for (int i = 0; i < lines.length; i++) {
            String raw     = lines[i];
            String trimmed = raw.trim();
            if (trimmed.isEmpty()) continue;

            int indentation = indentationOf(raw);

            // Close every block that is not strictly shallower than this line
            while (!stack.isEmpty() && indentation <= stack.peek().indentation) {
                stack.pop();
            }

            int colon = trimmed.indexOf(':');
            if (colon < 0) {
                skipped++;
                continue;
            }

            String key   = unquote(trimmed.substring(0, colon).trim());
            String value = unquote(trimmed.substring(colon + 1).trim());
            if (key.isEmpty()) {
                skipped++;
                continue;
            }

            List<String> path = currentPath(stack);
            DocumentNode node = new DocumentNode(
                    kindOf(key, path),
                    key,
                    value.isEmpty() ? null : value,
                    path,
                    i + 1
            );

            tree.register(node);
            if (stack.isEmpty()) {
                tree.addRoot(node);
            } else {
                stack.peek().node.addChild(node);
            }

            if (node.isBlock()) {
                stack.push(new OpenBlock(node, indentation));
            }
        }

        log.debug("[Parser] Parsed {} nodes from {} lines ({} skipped)",
                tree.size(), lines.length, skipped);
        return tree;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static int indentationOf(String line) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        return spaces / INDENT_UNIT;
    }

    static DocumentNodeKind kindOf(String key, List<String> path) {
        switch (key) {
            case VERSION_KEY:    return DocumentNodeKind.VERSION;
            case INFO_KEY:       return DocumentNodeKind.INFO;
            case PATHS_KEY:      return DocumentNodeKind.PATHS;
            case COMPONENTS_KEY: return DocumentNodeKind.COMPONENTS;
            case SERVERS_KEY:    return DocumentNodeKind.SERVERS;
            default:             break;
        }
        if (path.contains(PATHS_KEY))   return DocumentNodeKind.OPERATION;
        if (path.contains(SCHEMAS_KEY)) return DocumentNodeKind.SCHEMA;
        return DocumentNodeKind.PROPERTY;
    }

    private static List<String> currentPath(Deque<OpenBlock> stack) {
        List<String> path = new ArrayList<>(stack.size());
        // ArrayDeque used as a stack iterates top-first; walk it bottom-up
        Iterator<OpenBlock> it = stack.descendingIterator();
        while (it.hasNext()) {
            path.add(it.next().node.getKey());
        }
        return path;
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last  = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static final class OpenBlock {
        final DocumentNode node;
        final int          indentation;

        OpenBlock(DocumentNode node, int indentation) {
            this.node        = node;
            this.indentation = indentation;
        }
    }
}
