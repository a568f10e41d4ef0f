package com.infound.creatorportal.server.gate;

import com.infound.creatorportal.server.auth.AuthFailure;
import com.infound.creatorportal.server.auth.CreatorPrincipal;

/**
 * What the gate decided for one request.
 *
 * @param outcome   the decision
 * @param principal the authenticated creator when {@link Outcome#AUTHENTICATED}
 * @param failure   the refusal reason when {@link Outcome#REJECTED}
 */
public record GateDecision(Outcome outcome, CreatorPrincipal principal, AuthFailure failure) {

  private static final GateDecision BYPASSED = new GateDecision(Outcome.BYPASSED, null, null);

  /**
   * The gate outcomes.
   */
  public enum Outcome {
    /** Path is allow-listed; no credential was examined. */
    BYPASSED,
    /** Credential accepted; the principal must be attached to the request. */
    AUTHENTICATED,
    /** Credential refused; the request must not reach its handler. */
    REJECTED
  }

  public static GateDecision bypassed() {
    return BYPASSED;
  }

  public static GateDecision authenticated(CreatorPrincipal principal) {
    return new GateDecision(Outcome.AUTHENTICATED, principal, null);
  }

  public static GateDecision rejected(AuthFailure failure) {
    return new GateDecision(Outcome.REJECTED, null, failure);
  }
}
