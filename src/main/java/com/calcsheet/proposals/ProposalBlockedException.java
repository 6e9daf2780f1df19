package com.calcsheet.proposals;

public class ProposalBlockedException extends RuntimeException {
    public ProposalBlockedException(String id) {
        super("Proposal " + id + " has invalid commands and cannot be accepted");
    }
}
