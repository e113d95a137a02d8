package org.dagnet.query.constraint;

import lombok.experimental.UtilityClass;
import org.dagnet.core.id.NodeIdMapper;

/**
 * Token validation shared by literal records.
 */
@UtilityClass
final class Tokens {

    static String require(String token, String fieldName) {
        if (token == null) {
            throw new IllegalArgumentException(fieldName + " must be provided");
        }
        if (!NodeIdMapper.isValidToken(token)) {
            throw new IllegalArgumentException(fieldName + " must match [a-z0-9_-]+, got: " + token);
        }
        return token;
    }
}
