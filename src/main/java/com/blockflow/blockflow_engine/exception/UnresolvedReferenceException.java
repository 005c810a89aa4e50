package com.blockflow.blockflow_engine.exception;

import lombok.Getter;

/**
 * A block input referenced another block that has no recorded output. With a correct
 * schedule this only happens for references to blocks that are not upstream dependencies.
 */
@Getter
public class UnresolvedReferenceException extends WorkflowExecutionException {

    private final String reference;

    public UnresolvedReferenceException(String blockId, String reference) {
        super(blockId, "Unresolved reference <" + reference + "> in block " + blockId
                + ": the referenced block has no output yet");
        this.reference = reference;
    }

    public UnresolvedReferenceException(String blockId, String reference, String reason) {
        super(blockId, "Unresolved reference <" + reference + "> in block " + blockId + ": " + reason);
        this.reference = reference;
    }
}
