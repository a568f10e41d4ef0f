package com.infound.creatorportal.server.directory;

import com.infound.creatorportal.model.CurrentUserInfo;

/**
 * Creator profile row.
 *
 * @param id                         internal creator id
 * @param platformCreatorId          creator id on the external platform
 * @param platformCreatorUsername    creator username on the external platform
 * @param platformCreatorDisplayName display name on the external platform
 * @param email                      contact email, may be null
 * @param whatsapp                   contact WhatsApp number, may be null
 */
public record CreatorRecord(String id, String platformCreatorId, String platformCreatorUsername,
                            String platformCreatorDisplayName, String email, String whatsapp) {

  /**
   * Snapshot of this profile for a new session.
   *
   * @param jti the session id
   * @return the snapshot
   */
  public CurrentUserInfo toUserInfo(String jti) {
    return new CurrentUserInfo(jti, nullToEmpty(id), nullToEmpty(platformCreatorId),
        nullToEmpty(platformCreatorUsername), nullToEmpty(platformCreatorDisplayName),
        nullToEmpty(email), nullToEmpty(whatsapp));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
