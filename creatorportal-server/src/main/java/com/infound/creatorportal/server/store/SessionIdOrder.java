package com.infound.creatorportal.server.store;

import java.util.Comparator;

/**
 * Creation order of session ids.
 * <p>
 * All-digit ids sort before every other id and compare as unsigned integers among themselves
 * (shorter first, then lexically). Other ids compare lexically. The Redis insert-and-trim
 * script applies the same rule.
 */
public final class SessionIdOrder implements Comparator<String> {

  public static final SessionIdOrder INSTANCE = new SessionIdOrder();

  private SessionIdOrder() {
  }

  @Override
  public int compare(String left, String right) {
    boolean leftDigits = isDigits(left);
    boolean rightDigits = isDigits(right);
    if (leftDigits != rightDigits) {
      return leftDigits ? -1 : 1;
    }
    if (leftDigits && left.length() != right.length()) {
      return Integer.compare(left.length(), right.length());
    }
    return left.compareTo(right);
  }

  static boolean isDigits(String value) {
    if (value.isEmpty()) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
