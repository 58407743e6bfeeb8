package com.codeops.workbench.storage;

import com.codeops.workbench.entity.AuthConfig;
import com.codeops.workbench.entity.Collection;
import com.codeops.workbench.entity.Request;
import com.codeops.workbench.entity.enums.AuthType;
import org.springframework.stereotype.Component;

/**
 * Produces the persisted/exported form of a collection: bearer tokens are blanked
 * (on the collection, every request and every draft) and the runtime request index is dropped.
 */
@Component
public class CollectionSanitizer {

    /**
     * Returns a sanitized deep copy; {@code collection} is left untouched.
     *
     * @param collection the live or snapshot collection
     * @return the sanitized copy
     */
    public Collection sanitize(Collection collection) {
        Collection copy = collection.copy();
        redact(copy.getAuthentication());
        for (Request request : copy.getRequests().values()) {
            redact(request.getAuthentication());
            if (request.getPatch() != null) {
                redact(request.getPatch().getAuthentication());
            }
        }
        copy.setRequestIndex(null);
        return copy;
    }

    private static void redact(AuthConfig auth) {
        if (auth != null && auth.getType() == AuthType.BEARER && auth.getBearer() != null) {
            auth.getBearer().setToken(null);
        }
    }
}
