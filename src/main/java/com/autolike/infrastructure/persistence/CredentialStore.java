package com.autolike.infrastructure.persistence;

import com.autolike.domain.model.Credential;

import java.util.Map;

/**
 * Flat subject-to-credential mapping shared with the registration front end.
 */
public interface CredentialStore {

    /**
     * Point-in-time snapshot of every decodable record, read in a single store call.
     */
    Map<String, Credential> getAll();

    /**
     * Replaces the record of {@code subjectId} as a whole.
     */
    void put(String subjectId, Credential credential);
}
