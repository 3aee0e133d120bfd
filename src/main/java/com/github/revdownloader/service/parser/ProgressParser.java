package com.github.revdownloader.service.parser;

import com.github.revdownloader.model.BackendProgress;

/**
 * Interface for parsing progress information from backend output.
 * One instance serves one download; different backends print progress differently.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output and extract progress information.
     *
     * @param line Output line to parse
     * @return BackendProgress if progress information was found, null otherwise
     */
    BackendProgress parseLine(String line);

    /**
     * Reset the parser state (e.g., for a new attempt).
     */
    void reset();
}
