package com.calcsheet.context;

import com.calcsheet.models.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compact handle for one node, published to the model so it can target updates and deletes.
 * Every alias is accepted by the reference resolver.
 */
public class NodeRef {
    private final String id;
    private final NodeType type;
    private final int index;
    private final String ref;
    private final List<String> aliases;
    private final String label;

    public NodeRef(String id, NodeType type, int index, String ref, List<String> aliases, String label) {
        this.id = id;
        this.type = type;
        this.index = index;
        this.ref = ref;
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    /** 1-based position in document order. */
    public int getIndex() {
        return index;
    }

    public String getRef() {
        return ref;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getLabel() {
        return label;
    }
}
