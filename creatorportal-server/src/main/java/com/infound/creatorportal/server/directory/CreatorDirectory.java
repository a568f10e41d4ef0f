package com.infound.creatorportal.server.directory;

import java.util.Optional;

/**
 * Lookup of samples and creator profiles used at login.
 * <p>
 * Backed by the platform datastore in production. Implementations must be thread-safe.
 */
public interface CreatorDirectory {

  /**
   * Finds a sample that was sent to the given username.
   *
   * @param sampleId the sample id
   * @param username the creator username
   * @return the sample, or empty when the id is unknown or belongs to someone else
   */
  Optional<SampleRecord> findSample(String sampleId, String username);

  /**
   * Finds the creator profile for a username.
   *
   * @param username the creator username
   * @return the profile, or empty when the creator has not been ingested yet
   */
  Optional<CreatorRecord> findCreator(String username);
}
