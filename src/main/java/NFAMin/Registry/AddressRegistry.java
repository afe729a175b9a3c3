package NFAMin.Registry;

import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Hash-based registry; each configuration gets an address, names are stored per address.
 */
public class AddressRegistry implements Registry {
    private static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> key2Address;
    private final Object2IntMap<String> name2Address;
    private final List<String> names;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.name2Address = new Object2IntOpenHashMap<>();
        this.name2Address.defaultReturnValue(MISSING_ELEMENT);
        this.names = new ObjectArrayList<>();
    }

    @Override
    public String get(BitSet configuration) {
        int address = key2Address.getInt(configuration);
        return address < 0 ? null : names.get(address);
    }

    @Override
    public void put(BitSet configuration, String name) {
        if (key2Address.containsKey(configuration)) {
            throw new IllegalStateException("Configuration registered twice: " + configuration);
        }
        int clash = name2Address.getInt(name);
        if (clash != MISSING_ELEMENT) {
            throw new IllegalStateException("State name \"" + name + "\" already denotes another configuration");
        }
        int address = names.size();
        // BitSet is mutable; keep a private copy as the key
        key2Address.put((BitSet) configuration.clone(), address);
        name2Address.put(name, address);
        names.add(name);
    }

    @Override
    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return "Address(" + names.size() + ")";
    }
}
