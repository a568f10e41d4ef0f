package com.infound.creatorportal.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the logged-in creator, captured at login and stored alongside the session.
 * <p>
 * Requests are hydrated from this snapshot rather than from the primary datastore, so it reflects
 * the creator profile as it was when the session was issued. Snake-case names are accepted on
 * input for snapshots written by older services.
 *
 * @param jti                        the session id this snapshot belongs to
 * @param ifId                       internal creator id
 * @param platformCreatorId          creator id on the external platform
 * @param platformCreatorUsername    creator username on the external platform
 * @param platformCreatorDisplayName display name on the external platform
 * @param email                      contact email, empty when unknown
 * @param whatsapp                   contact WhatsApp number, empty when unknown
 */
public record CurrentUserInfo(
    @JsonProperty("jti") String jti,
    @JsonProperty("ifId") @JsonAlias("if_id") String ifId,
    @JsonProperty("platformCreatorId") @JsonAlias("platform_creator_id") String platformCreatorId,
    @JsonProperty("platformCreatorUsername") @JsonAlias("platform_creator_username")
    String platformCreatorUsername,
    @JsonProperty("platformCreatorDisplayName") @JsonAlias("platform_creator_display_name")
    String platformCreatorDisplayName,
    @JsonProperty("email") String email,
    @JsonProperty("whatsapp") String whatsapp) {

  /**
   * Snapshot for a login whose creator profile row does not exist yet.
   *
   * @param jti      the session id
   * @param username the username supplied at login
   * @return a snapshot carrying only the username
   */
  public static CurrentUserInfo forUsernameOnly(String jti, String username) {
    return new CurrentUserInfo(jti, "", "", username, username, "", "");
  }
}
