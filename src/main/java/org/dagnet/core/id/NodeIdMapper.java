package org.dagnet.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Bidirectional mapping contract between funnel node keys and internal dense integer ids.
 *
 * <p>Node keys double as query tokens, so they must match {@link #TOKEN_PATTERN}.</p>
 */
public interface NodeIdMapper {

    /**
     * Token grammar shared by node keys and case/context pairs.
     */
    Pattern TOKEN_PATTERN = Pattern.compile("[a-z0-9_-]+");

    /**
     * Converts a node key to its internal index.
     * @param nodeKey The funnel node key.
     * @return The internal integer index.
     * @throws UnknownNodeException If the key is not mapped.
     */
    int toInternal(String nodeKey) throws UnknownNodeException;

    /**
     * Converts an internal index back to its node key.
     * @param internalId The internal index.
     * @return The funnel node key.
     * @throws IndexOutOfBoundsException If the internal id is invalid.
     */
    String toExternal(int internalId);

    /**
     * Checks whether a node key has a mapped internal id.
     *
     * @param nodeKey key to test.
     * @return true when the key is present.
     */
    boolean containsExternal(String nodeKey);

    /**
     * Returns number of mapped nodes.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Returns whether a string is a legal query token.
     */
    static boolean isValidToken(String token) {
        return token != null && TOKEN_PATTERN.matcher(token).matches();
    }

    /**
     * Exception thrown when a node key cannot be found in the mapping.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation, assigning ids in iteration order.
     *
     * @param nodeKeys distinct node keys; the first key receives id 0.
     * @return An immutable mapper instance.
     */
    static NodeIdMapper fromOrderedKeys(Collection<String> nodeKeys) {
        return new FastUtilNodeIdMapper(nodeKeys);
    }
}
