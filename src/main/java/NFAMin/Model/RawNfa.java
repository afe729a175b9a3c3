package NFAMin.Model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Unverified NFA, exactly as read from the wire. Nothing downstream of the validator accepts this type.
 * @param start - start state id
 * @param alphabet - input symbols
 * @param finalStates - accepting state ids
 * @param nodes - state id to (symbol to destination state ids)
 */
@JsonPropertyOrder({"start", "alphabet", "final_states", "nodes"})
public record RawNfa(
    @JsonProperty(value = "start", required = true) String start,
    @JsonProperty("alphabet") Set<String> alphabet,
    @JsonProperty("final_states") Set<String> finalStates,
    @JsonProperty("nodes") Map<String, Map<String, Set<String>>> nodes) {

  public RawNfa {
    Objects.requireNonNull(start, "start");
    alphabet = alphabet == null ? Collections.emptySet() : alphabet;
    finalStates = finalStates == null ? Collections.emptySet() : finalStates;
    nodes = nodes == null ? Collections.emptyMap() : nodes;
  }
}
