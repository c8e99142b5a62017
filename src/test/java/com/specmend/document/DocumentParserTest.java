package com.specmend.document;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentParserTest {

    private final DocumentParser parser = new DocumentParser();

    private static final String WIDGETS = """
            openapi: 3.1.0
            info:
              title: Widgets
            paths:
              /widgets:
                get:
                  operationId: listWidgets
            components:
              schemas:
                Widget:
                  type: object
            """;

    @Test
    void testPathMatchesEnclosingBlocks() {
        DocumentTree tree = parser.parse(WIDGETS);

        assertEquals(11, tree.size());
        for (DocumentNode root : tree.getRoots()) {
            assertTrue(root.getPath().isEmpty(), "Root " + root + " should have an empty path");
            assertChildPaths(root);
        }
    }

    private static void assertChildPaths(DocumentNode parent) {
        List<String> expected = new ArrayList<>(parent.getPath());
        expected.add(parent.getKey());
        for (DocumentNode child : parent.getChildren()) {
            assertEquals(expected, child.getPath(), "Path of " + child);
            assertChildPaths(child);
        }
    }

    @Test
    void testNodeKinds() {
        DocumentTree tree = parser.parse(WIDGETS);

        assertEquals(DocumentNodeKind.VERSION, tree.root("openapi").orElseThrow().getKind());
        assertEquals("3.1.0", tree.root("openapi").orElseThrow().getValue());
        assertEquals(DocumentNodeKind.INFO, tree.root("info").orElseThrow().getKind());

        DocumentNode get = tree.findFirst("get").orElseThrow();
        assertEquals(DocumentNodeKind.OPERATION, get.getKind());
        assertTrue(get.isHttpMethod());
        assertEquals(List.of("paths", "/widgets"), get.getPath());
        assertEquals("paths./widgets.get", get.getQualifiedName());

        DocumentNode widget = tree.findFirst("Widget").orElseThrow();
        assertEquals(DocumentNodeKind.SCHEMA, widget.getKind());
        assertEquals("object", widget.child("type").orElseThrow().getValue());
    }

    @Test
    void testLineNumbersAreOneBased() {
        DocumentTree tree = parser.parse(WIDGETS);

        assertEquals(1, tree.root("openapi").orElseThrow().getLine());
        assertEquals(7, tree.findFirst("operationId").orElseThrow().getLine());
    }

    @Test
    void testMalformedLinesAreSkipped() {
        String text = """
                openapi: 3.1.0
                this line has no colon

                info:
                  title: Widgets
                  : empty key
                """;

        DocumentTree tree = parser.parse(text);

        assertEquals(3, tree.size());
        assertEquals(1, tree.root("info").orElseThrow().getChildren().size());
    }

    @Test
    void testDedentClosesBlocks() {
        DocumentTree tree = parser.parse("a:\n  b:\n    c: 1\n  d: 2\ne: 3");

        assertEquals(List.of("a", "b"), tree.findFirst("c").orElseThrow().getPath());
        assertEquals(List.of("a"), tree.findFirst("d").orElseThrow().getPath());
        assertTrue(tree.findFirst("e").orElseThrow().getPath().isEmpty());
        assertEquals(2, tree.getRoots().size());
    }

    @Test
    void testQuotedKeysAndValuesAreUnquoted() {
        DocumentTree tree = parser.parse("responses:\n  '200':\n    description: \"OK\"");

        DocumentNode ok = tree.findFirst("200").orElseThrow();
        assertTrue(ok.isBlock());
        assertEquals("OK", ok.child("description").orElseThrow().getValue());
    }

    @Test
    void testEmptyInputGivesEmptyTree() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   \n\n").isEmpty());
    }
}
