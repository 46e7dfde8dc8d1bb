package com.eainde.graphagent.error;

import java.util.List;

/**
 * Raised when a caller requires a single binding for every mention while some
 * mentions are still waiting for a human choice.
 * <p>
 * Ambiguity itself is a normal resolution outcome; this exception only marks the
 * misuse of an unresolved goal.
 * </p>
 */
public class AmbiguousEntityException extends GraphAgentException {

    private final List<String> mentions;

    public AmbiguousEntityException(List<String> mentions) {
        super(ErrorKind.VALIDATION, "Ambiguous entity mentions need a human choice: " + mentions);
        this.mentions = List.copyOf(mentions);
    }

    public List<String> getMentions() {
        return mentions;
    }
}
