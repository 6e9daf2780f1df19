package com.calcsheet.document;

import com.calcsheet.models.Assumption;
import com.calcsheet.models.VerificationStatus;
import com.calcsheet.models.WorksheetDocument;
import com.calcsheet.models.WorksheetNode;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Read/write contract of the worksheet document that the command pipeline works against.
 * Mutations raise on failure; callers decide whether a failure aborts anything.
 */
public interface DocumentModel {

    /** Nodes in document order. */
    List<WorksheetNode> getNodes();

    List<Assumption> getAssumptions();

    /** @return the node, or null when no node has this id */
    WorksheetNode getNode(String id);

    WorksheetDocument snapshot();

    void insertNode(WorksheetNode node);

    /**
     * Applies a partial update. Keys follow the command wire format ({@code symbol}, {@code value},
     * {@code unit}, {@code lhs}, {@code content}, ...).
     *
     * @throws NodeNotFoundException when no node has this id
     */
    void updateNode(String id, Map<String, Object> updates);

    /**
     * @throws NodeNotFoundException when no node has this id
     */
    void deleteNode(String id);

    Assumption addAssumption(String statement, String formalExpression, List<String> scope);

    /**
     * @throws AssumptionNotFoundException when no assumption has this id
     */
    void removeAssumption(String id);

    VerificationStatus verifyNode(String id) throws IOException, InterruptedException;

    List<VerificationStatus> verifyAllNodes() throws IOException, InterruptedException;
}
