package com.oceanintel.argo.service;

import com.oceanintel.argo.model.ExtractionResult;
import com.oceanintel.argo.model.RawProfileFile;

/**
 * Turns one downloaded profile file into quality-controlled measurements.
 *
 * Implementations never throw for a bad file: an unreadable file comes back as a
 * failed {@link ExtractionResult} so sibling files are unaffected.
 */
public interface ProfileExtractor {

    ExtractionResult extract(RawProfileFile file);
}
