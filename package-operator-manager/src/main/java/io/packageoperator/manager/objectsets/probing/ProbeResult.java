package io.packageoperator.manager.objectsets.probing;

import java.util.ArrayList;
import java.util.List;

public record ProbeResult(boolean success, List<String> messages) {

  private static final ProbeResult OK = new ProbeResult(true, List.of());

  public ProbeResult {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static ProbeResult ok() {
    return OK;
  }

  public static ProbeResult failed(String message) {
    return new ProbeResult(false, List.of(message));
  }

  public ProbeResult and(ProbeResult other) {
    if (other.success && other.messages.isEmpty()) {
      return this;
    }
    List<String> combined = new ArrayList<>(messages);
    combined.addAll(other.messages);
    return new ProbeResult(success && other.success, combined);
  }
}
