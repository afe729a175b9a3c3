package NFAMin;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import NFAMin.Model.RawDfa;
import NFAMin.Model.RawNfa;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON wire format shared by NFAs and DFAs:
 * <pre>
 * {"start": "1", "alphabet": ["a"], "final_states": ["2"], "nodes": {"1": {"a": ["1", "2"]}, "2": {}}}
 * </pre>
 * NFA transitions map a symbol to an array of destinations; DFA transitions map it to a single destination.
 */
public class JsonFormat {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonFormat() {
    }

    public static RawNfa readNfa(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, RawNfa.class);
    }

    public static RawNfa readNfa(InputStream is) throws IOException {
        return MAPPER.readValue(is, RawNfa.class);
    }

    public static RawDfa readDfa(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, RawDfa.class);
    }

    public static RawDfa readDfa(InputStream is) throws IOException {
        return MAPPER.readValue(is, RawDfa.class);
    }

    public static String write(Dfa dfa) throws JsonProcessingException {
        return MAPPER.writeValueAsString(dfa.toRaw());
    }

    public static String write(VerifiedNfa nfa) throws JsonProcessingException {
        return MAPPER.writeValueAsString(nfa.toRaw());
    }

    /**
     * Write a DFA to a file, indented.
     */
    public static void writeFile(File file, Dfa dfa) throws IOException {
        MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file, dfa.toRaw());
    }
}
