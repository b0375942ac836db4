package edu.uconn.salesdw.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts reported by one dimensional load run.
 */
@Value
@Builder
public class LoadSummary {

    int locationsLoaded;
    int salesRead;
    int factsInserted;
    int booksCreated;
    int timesCreated;
}
