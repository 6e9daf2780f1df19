package com.calcsheet.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Who or what produced a node.
 */
public class Provenance {

    public enum Type {
        USER("user"),
        LLM("llm"),
        LIBRARY("library"),
        COMPUTED("computed");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    private Type type;
    private String timestamp;
    private List<String> fromNodes = new ArrayList<>(); // computed only
    private String source; // library only
    private String model; // llm only

    public Provenance() {
    }

    public Provenance(Type type, String timestamp) {
        this.type = type;
        this.timestamp = timestamp;
    }

    public static Provenance user() {
        return new Provenance(Type.USER, Instant.now().toString());
    }

    public static Provenance llm() {
        return new Provenance(Type.LLM, Instant.now().toString());
    }

    public static Provenance computed(List<String> fromNodes) {
        Provenance p = new Provenance(Type.COMPUTED, Instant.now().toString());
        p.setFromNodes(fromNodes);
        return p;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public List<String> getFromNodes() {
        return fromNodes;
    }

    public void setFromNodes(List<String> fromNodes) {
        this.fromNodes = fromNodes != null ? new ArrayList<>(fromNodes) : new ArrayList<>();
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }
}
