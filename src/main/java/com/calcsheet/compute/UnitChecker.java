package com.calcsheet.compute;

import java.io.IOException;

/**
 * Unit-consistency check against the compute engine.
 */
public interface UnitChecker {

    UnitCheckResult checkUnits(String expression, String expectedUnit) throws IOException, InterruptedException;

    default UnitCheckResult checkUnits(String expression) throws IOException, InterruptedException {
        return checkUnits(expression, null);
    }
}
