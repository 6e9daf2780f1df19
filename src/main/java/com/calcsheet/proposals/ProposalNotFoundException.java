package com.calcsheet.proposals;

public class ProposalNotFoundException extends RuntimeException {
    public ProposalNotFoundException(String id) {
        super("Proposal not found: " + id);
    }
}
