package com.calcsheet.models;

/**
 * Markdown note, optionally titled. Diagrams are annotations holding a fenced sketch.
 */
public class AnnotationNode extends WorksheetNode {
    private String content;
    private String title;
    private boolean collapsed;

    public AnnotationNode() {
    }

    public AnnotationNode(String id, NodePosition position, String content, String title) {
        super(id, position);
        this.content = content;
        this.title = title;
    }

    @Override
    public NodeType getType() {
        return NodeType.ANNOTATION;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean isCollapsed() {
        return collapsed;
    }

    public void setCollapsed(boolean collapsed) {
        this.collapsed = collapsed;
    }
}
