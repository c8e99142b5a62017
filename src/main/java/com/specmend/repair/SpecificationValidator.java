package com.specmend.repair;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specmend.constraint.ConstraintSolver;
import com.specmend.constraint.SolutionResult;
import com.specmend.document.DocumentParser;
import com.specmend.document.DocumentTree;
import com.specmend.oracle.OracleException;
import com.specmend.oracle.SpecificationOracle;
import com.specmend.response.ResponseParser;
import com.specmend.response.ValidationResult;
import com.specmend.validator.StructuralValidator;

/**
 * Runs every issue source over one document.
 *
 *   text ─► DocumentParser ─► ConstraintSolver ──┐
 *   text ─► StructuralValidator ─────────────────┼─► ValidationResults
 *   text ─► oracle.review ─► ResponseParser ─────┘
 *
 * The structural issues are handed to the oracle as known issues so its review
 * can focus on what the local checks miss.
 */
@Component
public class SpecificationValidator {

    private static final Logger log = LoggerFactory.getLogger(SpecificationValidator.class);

    private final DocumentParser      parser;
    private final StructuralValidator structuralValidator;
    private final ConstraintSolver    constraintSolver;
    private final ResponseParser      responseParser;
    private final SpecificationOracle oracle;

    public SpecificationValidator(
            DocumentParser      parser,
            StructuralValidator structuralValidator,
            ConstraintSolver    constraintSolver,
            ResponseParser      responseParser,
            SpecificationOracle oracle
    ) {
        this.parser              = parser;
        this.structuralValidator = structuralValidator;
        this.constraintSolver    = constraintSolver;
        this.responseParser      = responseParser;
        this.oracle              = oracle;
    }

    /** Constraints, structural checks and oracle review combined. */
    public ValidationResult validate(String specification) throws OracleException {

        DocumentTree   tree        = parser.parse(specification);
        SolutionResult constraints = constraintSolver.solve(constraintSolver.extractConstraints(tree));
        List<String>   structural  = structuralValidator.validate(specification);
        ValidationResult review    = review(specification, structural);

        ValidationResult combined = ValidationResults.combineComprehensive(constraints, structural, review);

        log.info("[Validation] constraints {}/{} satisfied, {} structural, {} from review -> {}",
                constraints.getSatisfied().size(),
                constraints.getSatisfied().size() + constraints.getViolations().size(),
                structural.size(),
                review.getIssues().size(),
                combined);
        return combined;
    }

    /** Structural checks and oracle review only; used to rank candidate drafts. */
    public ValidationResult validateQuick(String specification) throws OracleException {
        List<String> structural = structuralValidator.validate(specification);
        return ValidationResults.combine(structural, review(specification, structural));
    }

    private ValidationResult review(String specification, List<String> knownIssues) throws OracleException {
        return responseParser.parseValidationResponse(oracle.review(specification, knownIssues));
    }
}
