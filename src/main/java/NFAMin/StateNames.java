package NFAMin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Display names for composite states.
 * Members are sorted and escaped before joining, so distinct member sets never render the same name.
 */
public class StateNames {
    public static final String CONFIGURATION_SEPARATOR = " + ";
    public static final String MERGE_SEPARATOR = " | ";

    private static final String EMPTY_MEMBER = "\\e";

    private StateNames() {
    }

    /**
     * Name of a subset-construction state.
     * @param members - NFA state ids of the configuration
     * @return sorted, escaped ids joined with " + "; the empty configuration is ""
     */
    public static String ofConfiguration(Collection<String> members) {
        return join(members, '+', CONFIGURATION_SEPARATOR);
    }

    /**
     * Name of a minimized state. A state that was not merged keeps its name, unless the name contains '|' and
     * could be mistaken for a merge; only then is it escaped.
     * @param members - DFA state names judged equivalent
     * @return the unmerged name, or sorted, escaped names joined with " | "
     */
    public static String ofEquivalenceClass(Collection<String> members) {
        if (members.size() == 1) {
            String only = members.iterator().next();
            // a merged name always holds an unescaped '|', so names without one cannot clash with it
            return only.indexOf('|') < 0 ? only : escape(only, '|');
        }
        return join(members, '|', MERGE_SEPARATOR);
    }

    static String escape(String id, char separatorChar) {
        if (id.isEmpty()) {
            return EMPTY_MEMBER;
        }
        StringBuilder sb = null;
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c == '\\' || c == separatorChar) {
                if (sb == null) {
                    sb = new StringBuilder(id.length() + 4);
                    sb.append(id, 0, i);
                }
                sb.append('\\');
            }
            if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? id : sb.toString();
    }

    private static String join(Collection<String> members, char separatorChar, String separator) {
        List<String> sorted = new ArrayList<>(members);
        sorted.sort(null);
        StringBuilder sb = new StringBuilder();
        for (String member : sorted) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(escape(member, separatorChar));
        }
        return sb.toString();
    }
}
