package com.calcsheet.context;

import com.calcsheet.commands.resolve.NodeReferenceResolver;
import com.calcsheet.compute.RecordingUnitChecker;
import com.calcsheet.document.InMemoryDocumentModel;
import com.calcsheet.models.Assumption;
import com.calcsheet.models.NodeType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.calcsheet.document.SampleWorksheet.*;
import static org.junit.jupiter.api.Assertions.*;

class ChatContextBuilderTest {

    private InMemoryDocumentModel document;
    private final ChatContextBuilder builder = new ChatContextBuilder();

    @BeforeEach
    void setUp() {
        document = create(new RecordingUnitChecker());
    }

    private ChatContext build() {
        return builder.build(document.getNodes(), document.getAssumptions(), null, null);
    }

    @Test
    void symbolsAndEquations() {
        ChatContext context = build();
        assertEquals(List.of("m", "a"), new ArrayList<>(context.getSymbols().keySet()));
        ChatContext.SymbolEntry mass = context.getSymbols().get("m");
        assertEquals(10.0, mass.getValue());
        assertEquals("kg", mass.getUnit());
        assertEquals(MASS_ID, mass.getNodeId());
        assertEquals(List.of("F = m*a"), context.getEquations());
    }

    @Test
    void onlyActiveAssumptions() {
        document.addAssumption("Frictionless surface", null, null);
        Assumption inactive = document.addAssumption("Small angles", null, null);
        inactive.setActive(false);
        assertEquals(List.of("Frictionless surface"), build().getAssumptions());
    }

    @Test
    void refsAreOrderedByImportance() {
        List<NodeType> types = new ArrayList<>();
        for (NodeRef ref : build().getNodeRefs()) {
            types.add(ref.getType());
        }
        assertEquals(List.of(NodeType.GIVEN, NodeType.GIVEN, NodeType.EQUATION, NodeType.SOLVE_GOAL,
            NodeType.ANNOTATION, NodeType.TEXT), types);
    }

    @Test
    void refsCarryHandlesAndLabels() {
        List<NodeRef> refs = build().getNodeRefs();

        NodeRef mass = refs.get(0);
        assertEquals("m", mass.getRef());
        assertEquals(List.of("given_1", "m"), mass.getAliases());
        assertEquals(3, mass.getIndex());
        assertEquals("m := 10 kg", mass.getLabel());

        NodeRef goal = refs.get(3);
        assertEquals("solve_f", goal.getRef());
        assertEquals(List.of("solve_goal_1", "solve_f"), goal.getAliases());
        assertEquals("solve for: F", goal.getLabel());

        NodeRef diagram = refs.get(4);
        assertEquals("annotation_1", diagram.getRef());
        assertEquals(List.of("annotation_1", "free_body_diagram"), diagram.getAliases());

        NodeRef text = refs.get(5);
        assertEquals("text_1", text.getRef());
        assertTrue(text.getLabel().startsWith("text: \"A 10 kg block"));
    }

    @Test
    void everyAliasResolvesToItsNode() {
        NodeReferenceResolver resolver = new NodeReferenceResolver(document);
        for (NodeRef ref : build().getNodeRefs()) {
            assertEquals(ref.getId(), resolver.resolve(ref.getRef()), ref.getRef());
            for (String alias : ref.getAliases()) {
                assertEquals(ref.getId(), resolver.resolve(alias), alias);
            }
        }
    }

    @Test
    void refsAreCapped() {
        ChatContext context = builder.build(document.getNodes(), document.getAssumptions(), MASS_ID, "why?", 2);
        assertEquals(2, context.getNodeRefs().size());
        assertEquals(MASS_ID, context.getFocusNodeId());
        assertEquals("why?", context.getQuery());
    }

    @Test
    void longLabelsAreTruncated() {
        document.updateNode(EQUATION_ID, Map.of("rhs", "m*a + " + "k*x + ".repeat(20) + "c"));
        NodeRef eq = build().getNodeRefs().get(2);
        assertEquals(ChatContextBuilder.MAX_LABEL_LENGTH, eq.getLabel().length());
        assertTrue(eq.getLabel().endsWith("..."));
    }

    @Test
    void aliasSanitizing() {
        assertEquals("free_body_diagram", ChatContextBuilder.sanitizeAlias("  Free-body diagram! "));
        assertEquals("", ChatContextBuilder.sanitizeAlias(null));
    }

    @Test
    void serializesWithSnakeCaseKeys() throws Exception {
        String json = new ObjectMapper().writeValueAsString(
            builder.build(document.getNodes(), document.getAssumptions(), MASS_ID, null));
        assertTrue(json.contains("\"node_refs\""), json);
        assertTrue(json.contains("\"focus_node_id\""), json);
        assertTrue(json.contains("\"node_id\":\"" + MASS_ID + "\""), json);
        assertFalse(json.contains("\"query\""), json);
    }
}
