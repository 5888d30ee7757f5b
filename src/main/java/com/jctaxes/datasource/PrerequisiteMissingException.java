package com.jctaxes.datasource;

import java.io.File;

/**
 * A required input data set does not exist. This is the only fatal condition in a run: without the input there is
 * nothing meaningful to compute, so we stop and tell the operator which earlier step produces the missing file.
 */
public class PrerequisiteMissingException extends DataSourceException {

    public final File missingFile;

    public final String producingStep;

    public PrerequisiteMissingException (String description, File missingFile, String producingStep) {
        super(String.format("%s not found at %s. Run the %s step first.", description, missingFile, producingStep));
        this.missingFile = missingFile;
        this.producingStep = producingStep;
    }

}
