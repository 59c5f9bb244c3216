package com.resonance.matrix.error;

/**
 * A single node failed validation. The node is skipped and the run continues.
 */
public class ValidationException extends MatrixException {

    private final String nodeId;
    private final long index;

    public ValidationException(String nodeId, long index, String message) {
        super(message);
        this.nodeId = nodeId;
        this.index = index;
    }

    /**
     * Returns the offending node id, or null when the node had none.
     */
    public String getNodeId() {
        return nodeId;
    }

    public long getIndex() {
        return index;
    }
}
