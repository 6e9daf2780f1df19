package com.calcsheet.proposals;

import com.calcsheet.commands.BatchResult;
import com.calcsheet.commands.execute.CommandExecutor;
import com.calcsheet.commands.parse.CommandParser;
import com.calcsheet.commands.validate.CommandValidator;
import com.calcsheet.commands.validate.ValidationStatus;
import com.calcsheet.compute.RecordingUnitChecker;
import com.calcsheet.document.InMemoryDocumentModel;
import com.calcsheet.document.SampleWorksheet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProposalServiceTest {

    private static final String GIVEN_REPLY = "Adding gravity.\n```json\n"
        + "{\"action\":\"add_given\",\"symbol\":\"g\",\"value\":9.81,\"unit\":\"m/s^2\"}\n```";
    private static final String BARE_EQUATION_REPLY = "```json\n"
        + "{\"action\":\"add_equation\",\"latex\":\"W = m g\",\"lhs\":\"W\",\"rhs\":\"m*g\"}\n```";

    private InMemoryDocumentModel document;
    private ProposalService service;

    private ProposalService serviceFor(InMemoryDocumentModel model, RecordingUnitChecker checker) {
        return new ProposalService(new CommandParser(new ObjectMapper()),
            new CommandValidator(model, checker), new CommandExecutor(model));
    }

    @BeforeEach
    void setUp() {
        RecordingUnitChecker checker = new RecordingUnitChecker();
        document = SampleWorksheet.create(checker);
        service = serviceFor(document, checker);
    }

    @Test
    void proposeValidatesWithoutTouchingTheDocument() {
        Proposal proposal = service.propose(GIVEN_REPLY);

        assertEquals("Adding gravity.", proposal.getProse());
        assertEquals(1, proposal.getCommands().size());
        assertEquals(ValidationStatus.VALID, proposal.getValidation().get(0).getStatus());
        assertFalse(proposal.isBlocked());
        assertEquals(6, document.getNodes().size());
        assertSame(proposal, service.get(proposal.getId()));
    }

    @Test
    void acceptExecutesOnce() {
        Proposal proposal = service.propose(GIVEN_REPLY);

        BatchResult result = service.accept(proposal.getId());

        assertEquals(1, result.getSucceeded());
        assertEquals(7, document.getNodes().size());
        assertThrows(ProposalNotFoundException.class, () -> service.accept(proposal.getId()));
        assertTrue(service.list().isEmpty());
    }

    @Test
    void blockedProposalCannotBeAcceptedButCanBeRejected() {
        RecordingUnitChecker checker = new RecordingUnitChecker();
        InMemoryDocumentModel empty = new InMemoryDocumentModel(checker);
        ProposalService emptyService = serviceFor(empty, checker);

        Proposal proposal = emptyService.propose(BARE_EQUATION_REPLY);
        assertTrue(proposal.isBlocked());

        assertThrows(ProposalBlockedException.class, () -> emptyService.accept(proposal.getId()));
        assertTrue(empty.getNodes().isEmpty());
        assertEquals(1, emptyService.list().size());

        assertSame(proposal, emptyService.reject(proposal.getId()));
        assertThrows(ProposalNotFoundException.class, () -> emptyService.reject(proposal.getId()));
    }

    @Test
    void proseOnlyReplyYieldsAnEmptyProposal() {
        Proposal proposal = service.propose("No changes needed.");
        assertTrue(proposal.getCommands().isEmpty());
        assertFalse(proposal.isBlocked());
        assertEquals(0, service.accept(proposal.getId()).getTotal());
    }

    @Test
    void unknownProposal() {
        assertThrows(ProposalNotFoundException.class, () -> service.get("missing"));
        assertThrows(ProposalNotFoundException.class, () -> service.get(null));
    }

    @Test
    void resolvedTargetsAreWhatGetsExecuted() {
        Proposal proposal = service.propose("```json\n{\"action\":\"delete_node\",\"node_id\":\"given_2\"}\n```");
        service.accept(proposal.getId());
        assertNull(document.getNode(SampleWorksheet.ACCEL_ID));
    }

    @Test
    void oldestUndecidedProposalIsDroppedAtTheLimit() {
        RecordingUnitChecker checker = new RecordingUnitChecker();
        ProposalService bounded = new ProposalService(new CommandParser(new ObjectMapper()),
            new CommandValidator(document, checker), new CommandExecutor(document), 2);

        Proposal first = bounded.propose(GIVEN_REPLY);
        Proposal second = bounded.propose(GIVEN_REPLY);
        Proposal third = bounded.propose(BARE_EQUATION_REPLY);

        assertEquals(2, bounded.list().size());
        assertThrows(ProposalNotFoundException.class, () -> bounded.get(first.getId()));
        assertSame(second, bounded.get(second.getId()));
        assertSame(third, bounded.get(third.getId()));
    }
}
