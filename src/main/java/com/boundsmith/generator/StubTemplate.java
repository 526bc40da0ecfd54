package com.boundsmith.generator;

import com.boundsmith.model.CoverageResult;

/**
 * Source template of a generated stub test file in one test framework.
 */
public interface StubTemplate {

    /**
     * File extension of the generated file, including the dot.
     */
    String getExtension();

    /**
     * Base name of the stub test for one boundary, before deduplication.
     */
    String testName(CoverageResult result);

    String header(String fileStem);

    String stub(String testName, CoverageResult result);

    String footer();
}
