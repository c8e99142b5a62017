package com.specmend.repair;

import org.junit.jupiter.api.Test;

import com.specmend.document.DocumentParser;
import com.specmend.oracle.MockSpecificationOracle;

import static org.junit.jupiter.api.Assertions.*;

class OperationIdFixerTest {

    private final OperationIdFixer fixer = new OperationIdFixer(new DocumentParser());

    @Test
    void testInsertsIdBelowMethodLine() {
        String spec = """
                paths:
                  /widgets/{id}:
                    get:
                      responses:
                        '200':
                          description: ok
                """;

        String[] lines = fixer.apply(spec).split("\n", -1);

        assertEquals("    get:", lines[2]);
        assertEquals("      operationId: get_widgets_id", lines[3]);
        assertEquals("      responses:", lines[4]);
        assertEquals("", lines[lines.length - 1]);
    }

    @Test
    void testEveryOperationGetsItsOwnId() {
        String spec = """
                paths:
                  /orders:
                    get:
                      summary: list
                    post:
                      operationId: createOrder
                    delete:
                      summary: purge
                """;

        String fixed = fixer.apply(spec);

        assertTrue(fixed.contains("      operationId: get_orders\n      summary: list"));
        assertTrue(fixed.contains("      operationId: delete_orders\n      summary: purge"));
        assertTrue(fixed.contains("operationId: createOrder"));
        assertFalse(fixed.contains("post_orders"));
    }

    @Test
    void testDraftBecomesComplete() {
        String fixed = fixer.apply(MockSpecificationOracle.DRAFT_SPECIFICATION);

        assertTrue(fixed.contains("    get:\n      operationId: get_widgets\n"));
    }

    @Test
    void testCompleteDocumentIsUnchanged() {
        String complete = MockSpecificationOracle.COMPLETE_SPECIFICATION;

        assertSame(complete, fixer.apply(complete));
    }

    @Test
    void testIdFormat() {
        assertEquals("get_widgets", OperationIdFixer.operationId("GET", "/widgets"));
        assertEquals("post_users_userId_orders", OperationIdFixer.operationId("post", "/users/{userId}/orders"));
    }
}
