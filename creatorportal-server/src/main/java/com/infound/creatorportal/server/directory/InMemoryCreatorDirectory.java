package com.infound.creatorportal.server.directory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link CreatorDirectory} for development and tests.
 */
public class InMemoryCreatorDirectory implements CreatorDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCreatorDirectory.class);

  private final ConcurrentHashMap<String, SampleRecord> samples = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CreatorRecord> creators = new ConcurrentHashMap<>();

  public InMemoryCreatorDirectory addSample(SampleRecord sample) {
    samples.put(sample.id(), sample);
    log.debug("Added sample {} for {}", sample.id(), sample.platformCreatorUsername());
    return this;
  }

  public InMemoryCreatorDirectory addCreator(CreatorRecord creator) {
    creators.put(creator.platformCreatorUsername(), creator);
    log.debug("Added creator {}", creator.platformCreatorUsername());
    return this;
  }

  @Override
  public Optional<SampleRecord> findSample(String sampleId, String username) {
    return Optional.ofNullable(samples.get(sampleId))
        .filter(s -> s.platformCreatorUsername().equals(username));
  }

  @Override
  public Optional<CreatorRecord> findCreator(String username) {
    return Optional.ofNullable(creators.get(username));
  }
}
