package com.specmend.repair;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.specmend.config.RepairSettings;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles({"test", "mock"})
class SpecificationRepairServiceTest {

    @Autowired
    private SpecificationRepairService service;

    @Autowired
    private RepairSettings repairSettings;

    @Test
    void testRepairLoop() throws Exception {

        RepairReport report = service.repair("A service that lists widgets");

        assertNotNull(report);
        assertTrue(report.isValid(), "Remaining: " + report.getRemainingIssues());
        assertTrue(report.getIterations() > 1, "Draft should need at least one fix");
        assertTrue(report.getIterations() <= repairSettings.getMaxIterations(), "Should not exceed iteration cap");
        assertTrue(report.getSpecification().contains("operationId: get_widgets"));
        assertTrue(report.getRemainingIssues().isEmpty());
        assertFalse(report.getFixedIssues().isEmpty());
    }

    @Test
    void testGenerateWithSearch() throws Exception {
        String specification = service.generateWithSearch("A service that lists widgets", 10);

        assertTrue(specification.contains("operationId: get_widgets"));
    }

    @Test
    void testGenerateWithSelfConsistency() throws Exception {
        String specification = service.generateWithSelfConsistency("A service that lists widgets", 2);

        assertTrue(specification.contains("example:"));
        assertThrows(IllegalArgumentException.class,
                () -> service.generateWithSelfConsistency("A service that lists widgets", 0));
    }

    @Test
    void testTestProfileSettingsAreBound() {
        assertEquals(4, repairSettings.getMaxIterations());
    }
}
