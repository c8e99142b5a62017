package com.specmend.oracle;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for the generative service.
 *
 * generate() returns a draft that lacks operationIds and examples; every
 * correction request returns the complete document; review() always reports
 * no issues.
 */
@Component
@Profile("mock")
public class MockSpecificationOracle implements SpecificationOracle {

    private static final Logger log = LoggerFactory.getLogger(MockSpecificationOracle.class);

    public static final String DRAFT_SPECIFICATION = """
            openapi: 3.1.0
            info:
              title: Widget Service
              description: Manages widgets
              version: 1.0.0
            paths:
              /widgets:
                get:
                  summary: List widgets
                  parameters:
                    - name: limit
                      in: query
                      description: Maximum number of widgets to return
                  responses:
                    '200':
                      description: Widget list
                      content:
                        application/json:
                          schema:
                            $ref: '#/components/schemas/Widget'
                    '400':
                      description: Bad request
            components:
              schemas:
                Widget:
                  type: object
                  properties:
                    id:
                      type: integer
            """;

    public static final String COMPLETE_SPECIFICATION = """
            openapi: 3.1.0
            info:
              title: Widget Service
              description: Manages widgets
              version: 1.0.0
            paths:
              /widgets:
                get:
                  operationId: get_widgets
                  summary: List widgets
                  parameters:
                    - name: limit
                      in: query
                      description: Maximum number of widgets to return
                  responses:
                    '200':
                      description: Widget list
                      content:
                        application/json:
                          schema:
                            $ref: '#/components/schemas/Widget'
                    '400':
                      description: Bad request
            components:
              schemas:
                Widget:
                  type: object
                  example:
                    id: 1
                  properties:
                    id:
                      type: integer
            """;

    static final String CLEAN_REVIEW = """
            VALID: YES
            CONFIDENCE: 0.9
            ISSUES:
            - none
            """;

    @Override
    public String generate(String context) {
        log.debug("[MockOracle] generate: {}", context);
        return DRAFT_SPECIFICATION;
    }

    @Override
    public String review(String specification, List<String> knownIssues) {
        return CLEAN_REVIEW;
    }

    @Override
    public String applyFix(String specification, String issue, String solution) {
        log.debug("[MockOracle] applyFix: {}", issue);
        return COMPLETE_SPECIFICATION;
    }

    @Override
    public String correct(String specification, List<String> issues, List<String> fixedIssues) {
        return COMPLETE_SPECIFICATION;
    }

    @Override
    public String correctPersistent(String specification, List<String> persistentIssues, List<String> fixedIssues) {
        return COMPLETE_SPECIFICATION;
    }

    @Override
    public String forceCorrect(String specification, List<String> issues) {
        return COMPLETE_SPECIFICATION;
    }
}
