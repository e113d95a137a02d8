package org.dagnet.query.graph;

import java.util.List;

/**
 * Bounded simple-path enumeration result.
 *
 * @param paths collected paths, each from source to destination inclusive.
 * @param truncated whether the path cap stopped enumeration early.
 */
public record SimplePaths(List<int[]> paths, boolean truncated) {
}
