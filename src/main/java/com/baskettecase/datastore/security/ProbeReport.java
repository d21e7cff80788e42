package com.baskettecase.datastore.security;

import com.baskettecase.datastore.db.EndpointIdentity;

import java.util.List;

/**
 * Outcomes of a completed permission probe. Only produced when every statement failed as expected.
 */
public record ProbeReport(EndpointIdentity endpoint, String probeTable, List<ProbeOutcome> outcomes) {

    public ProbeReport {
        outcomes = List.copyOf(outcomes);
    }
}
