package com.calcsheet.commands;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BatchResult {
    private final List<CommandResult> results;
    private final int succeeded;
    private final int failed;

    public BatchResult(List<CommandResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        int ok = 0;
        for (CommandResult result : results) {
            if (result.isSuccess()) {
                ok++;
            }
        }
        this.succeeded = ok;
        this.failed = results.size() - ok;
    }

    public List<CommandResult> getResults() {
        return results;
    }

    public int getTotal() {
        return results.size();
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }
}
