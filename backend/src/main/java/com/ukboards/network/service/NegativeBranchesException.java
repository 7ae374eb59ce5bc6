package com.ukboards.network.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class NegativeBranchesException extends RuntimeException {
    private final int branches;

    public NegativeBranchesException(int branches) {
        super(branches + " is an invalid number of network branches. It must be an int and >= 0.");
        this.branches = branches;
    }

    public int getBranches() {
        return branches;
    }
}
