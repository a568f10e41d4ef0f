package com.infound.creatorportal.server.directory;

/**
 * A sample shipped to a creator; proof of identity at login.
 *
 * @param id                      the sample id
 * @param platformCreatorUsername the username the sample was sent to
 */
public record SampleRecord(String id, String platformCreatorUsername) {
}
