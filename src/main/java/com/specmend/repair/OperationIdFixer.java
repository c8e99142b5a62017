package com.specmend.repair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specmend.document.DocumentNode;
import com.specmend.document.DocumentParser;
import com.specmend.document.DocumentTree;

/**
 * Adds a generated operationId to every operation that lacks one.
 *
 * Local and deterministic: no oracle call. The id is
 * {@code <method>_<path>} with slashes turned into underscores and path
 * parameter braces dropped, e.g. {@code get /widgets/{id}} becomes
 * {@code get_widgets_id}.
 */
@Component
public class OperationIdFixer {

    private static final Logger log = LoggerFactory.getLogger(OperationIdFixer.class);

    private final DocumentParser parser;

    public OperationIdFixer(DocumentParser parser) {
        this.parser = parser;
    }

    public String apply(String specification) {

        DocumentTree tree = parser.parse(specification);

        List<DocumentNode> missing = new ArrayList<>();
        for (DocumentNode node : tree.getAllNodes()) {
            if (isOperation(node) && !node.hasChild("operationId")) {
                missing.add(node);
            }
        }
        if (missing.isEmpty()) {
            return specification;
        }

        List<String> lines = new ArrayList<>(Arrays.asList(specification.split("\\r?\\n", -1)));

        // Bottom-up so earlier line numbers stay valid
        for (int i = missing.size() - 1; i >= 0; i--) {
            DocumentNode operation = missing.get(i);
            int    index  = operation.getLine() - 1;
            String indent = leadingWhitespace(lines.get(index)) + " ".repeat(DocumentParser.INDENT_UNIT);
            String path   = operation.getPath().get(operation.getPath().size() - 1);

            lines.add(index + 1, indent + "operationId: " + operationId(operation.getKey(), path));
        }

        log.info("[OperationIdFixer] Added {} operationId(s)", missing.size());
        return String.join("\n", lines);
    }

    static String operationId(String method, String path) {
        String cleaned = path
                .replace("/", "_")
                .replace("{", "")
                .replace("}", "")
                .replace("__", "_");
        cleaned = stripUnderscores(cleaned);
        return method.toLowerCase() + "_" + cleaned;
    }

    private static String stripUnderscores(String text) {
        int start = 0;
        int end   = text.length();
        while (start < end && text.charAt(start) == '_') start++;
        while (end > start && text.charAt(end - 1) == '_') end--;
        return text.substring(start, end);
    }

    private static boolean isOperation(DocumentNode node) {
        List<String> path = node.getPath();
        return node.isHttpMethod() && node.isBlock() && path.size() == 2 && "paths".equals(path.get(0));
    }

    private static String leadingWhitespace(String line) {
        int n = 0;
        while (n < line.length() && Character.isWhitespace(line.charAt(n))) n++;
        return line.substring(0, n);
    }
}
