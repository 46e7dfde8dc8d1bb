package com.eainde.graphagent.resolution;

import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.model.EntityMention;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.ResolvedGoalSpec;

/**
 * Binds free-text mentions to graph identities.
 * <p>
 * Implementations are pure over the snapshot they are given. Ambiguity is a
 * normal outcome ({@code ASK_USER}), never an exception.
 * </p>
 */
public interface EntityResolver {

    /**
     * @throws com.eainde.graphagent.error.ValidationException if the mention is empty
     */
    EntityResolution resolve(EntityMention mention, GraphSnapshot snapshot);

    ResolvedGoalSpec resolveAll(IntentSpec intent, GraphSnapshot snapshot);

    /**
     * Re-resolves an ambiguous mention to one of its candidates.
     *
     * @throws com.eainde.graphagent.error.ValidationException if the candidate was not offered
     */
    EntityResolution choose(EntityResolution previous, String candidateId);

    /** Re-resolves a mention to a new entity. */
    EntityResolution createNew(EntityResolution previous);
}
