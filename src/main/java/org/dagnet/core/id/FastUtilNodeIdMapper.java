package org.dagnet.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;

/**
 * Immutable {@link NodeIdMapper} backed by a fastutil open-hash map.
 *
 * <p>Ids are dense and follow the iteration order of the keys handed to the
 * constructor, which keeps graph traversal order reproducible. Safe for concurrent reads.</p>
 */
public class FastUtilNodeIdMapper implements NodeIdMapper {

    // key -> id, -1 when absent
    private final Object2IntOpenHashMap<String> forward;
    // id -> key
    private final String[] reverse;

    /**
     * Builds the mapper, rejecting null, malformed and duplicate keys.
     */
    public FastUtilNodeIdMapper(Collection<String> nodeKeys) {
        if (nodeKeys == null) {
            throw new IllegalArgumentException("Node keys cannot be null");
        }
        int size = nodeKeys.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        int next = 0;
        for (String key : nodeKeys) {
            if (!NodeIdMapper.isValidToken(key)) {
                throw new IllegalArgumentException("Node key must match [a-z0-9_-]+, got: " + key);
            }
            if (forward.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate node key: " + key);
            }
            forward.put(key, next);
            reverse[next] = key;
            next++;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String nodeKey) throws UnknownNodeException {
        if (nodeKey == null) {
            throw new IllegalArgumentException("Node key cannot be null");
        }
        int id = forward.getInt(nodeKey);
        if (id == -1) {
            throw new UnknownNodeException("Node not found: " + nodeKey);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String nodeKey) {
        return nodeKey != null && forward.containsKey(nodeKey);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
