package com.calcsheet.models;

public class TextNode extends WorksheetNode {
    private String content;

    public TextNode() {
    }

    public TextNode(String id, NodePosition position, String content) {
        super(id, position);
        this.content = content;
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}
