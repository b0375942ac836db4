package edu.uconn.salesdw.job;

/**
 * A vendor bulk-load path that accepts raw lines already in the target table's load format.
 */
public interface BulkCopyChannel {

    void writeLine(byte[] line);

    /**
     * Completes the copy.
     *
     * @return the number of rows the target accepted
     */
    long finish();

    /**
     * Abandons a copy in progress. Safe to call after a failed write.
     */
    void abort();
}
