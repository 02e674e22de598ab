package com.phillippitts.scriptmonitor.service.hypothesis;

/**
 * Append-only record of transcript fragments received during a session.
 *
 * <p>Implementations must be safe for one writer per connection plus concurrent readers.
 */
public interface HypothesisLog {

    /**
     * Appends a fragment. Blank fragments are ignored.
     */
    void append(String fragment);

    /**
     * @return all fragments joined with single spaces, or "" when empty
     */
    String snapshot();

    int size();

    void clear();
}
