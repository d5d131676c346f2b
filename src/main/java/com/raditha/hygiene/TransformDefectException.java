package com.raditha.hygiene;

/**
 * A structural defect found while rewriting: a node function returned {@code null}, or a pass
 * produced a tree that breaks one of the model invariants.
 */
public class TransformDefectException extends PipelineException {

    private final String nodeKind;

    public TransformDefectException(String message, String nodeKind) {
        super(message);
        this.nodeKind = nodeKind;
    }

    /**
     * Simple name of the node variant being rewritten when the defect was found.
     */
    public String getNodeKind() {
        return nodeKind;
    }
}
