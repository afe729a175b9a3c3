package NFAMin.Service;

import java.util.LinkedHashMap;
import java.util.Map;

import NFAMin.AutomatonValidator;
import NFAMin.Dfa;
import NFAMin.JsonFormat;
import NFAMin.Model.RawNfa;
import NFAMin.Model.StateLimit;
import NFAMin.SubsetDeterminizer;
import NFAMin.TableFillingMinimizer;
import NFAMin.ValidationException;
import NFAMin.VerifiedNfa;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Request handling independent of any transport: a raw NFA document in, a minimal DFA document out.
 * Each call runs its own pipeline and shares no automaton state with other calls.
 */
public class ConversionService {
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int PAYLOAD_TOO_LARGE = 413;
    public static final int INTERNAL_ERROR = 500;

    private static final ObjectMapper ERROR_MAPPER = new ObjectMapper();

    private final StateLimit stateLimit;

    public ConversionService() {
        this(new StateLimit());
    }

    public ConversionService(StateLimit stateLimit) {
        this.stateLimit = stateLimit;
    }

    /**
     * Status code and JSON body of a reply.
     */
    public record Response(int status, String body) {
    }

    /**
     * Validate, determinize and minimize the NFA in body.
     * @param body - JSON NFA document
     * @return 200 with the minimal DFA; 400 for malformed or invalid input; 413 above the state limit;
     *     500 for anything unexpected
     */
    public Response handle(String body) {
        final RawNfa raw;
        try {
            raw = JsonFormat.readNfa(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return error(BAD_REQUEST, "MalformedInput", "message", e.getOriginalMessage());
        }

        if (stateLimit.isAboveThreshold(raw.nodes().size())) {
            return error(PAYLOAD_TOO_LARGE, "TooManyStates", "message",
                raw.nodes().size() + " states exceed the limit of " + stateLimit.getStateThreshold());
        }

        try {
            VerifiedNfa nfa = AutomatonValidator.validate(raw);
            Dfa minimal = TableFillingMinimizer.minimize(SubsetDeterminizer.determinize(nfa));
            return new Response(OK, JsonFormat.write(minimal));
        } catch (ValidationException e) {
            return error(BAD_REQUEST, e.getKind(), "id", e.getIdentifier());
        } catch (JsonProcessingException | RuntimeException e) {
            System.err.println("Conversion failed: " + e);
            return error(INTERNAL_ERROR, "InternalError", "message", String.valueOf(e.getMessage()));
        }
    }

    private static Response error(int status, String kind, String detailKey, String detail) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("error", kind);
        payload.put(detailKey, detail);
        try {
            return new Response(status, ERROR_MAPPER.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return "ConversionService(limit=" + stateLimit + ")";
    }
}
