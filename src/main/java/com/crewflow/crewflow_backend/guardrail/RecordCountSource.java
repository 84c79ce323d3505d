package com.crewflow.crewflow_backend.guardrail;

/**
 * Read access to the record table the data guardrails inspect.
 */
public interface RecordCountSource {

    long countTotal();

    long countUnprocessed();

    long countMissingCompanyName();

    /** Creates the backing table when it does not exist yet. */
    void createIfMissing();
}
