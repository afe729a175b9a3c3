package NFAMin.Model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Wire form of a DFA: same shape as {@link RawNfa}, but each symbol maps to a single destination.
 */
@JsonPropertyOrder({"start", "alphabet", "final_states", "nodes"})
public record RawDfa(
    @JsonProperty(value = "start", required = true) String start,
    @JsonProperty("alphabet") Set<String> alphabet,
    @JsonProperty("final_states") Set<String> finalStates,
    @JsonProperty("nodes") Map<String, Map<String, String>> nodes) {

  public RawDfa {
    Objects.requireNonNull(start, "start");
    alphabet = alphabet == null ? Collections.emptySet() : alphabet;
    finalStates = finalStates == null ? Collections.emptySet() : finalStates;
    nodes = nodes == null ? Collections.emptyMap() : nodes;
  }
}
