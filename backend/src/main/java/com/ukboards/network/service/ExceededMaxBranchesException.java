package com.ukboards.network.service;

public class ExceededMaxBranchesException extends RuntimeException {
    private final int branches;
    private final int maxBranches;

    public ExceededMaxBranchesException(int branches, int maxBranches) {
        super("Current branches " + branches + " >= maximum " + maxBranches + " branches allowed.");
        this.branches = branches;
        this.maxBranches = maxBranches;
    }

    public int getBranches() {
        return branches;
    }

    public int getMaxBranches() {
        return maxBranches;
    }
}
