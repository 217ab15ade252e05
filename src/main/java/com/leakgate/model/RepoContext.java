package com.leakgate.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RepoContext {
    private boolean publicRepo;
    private boolean externalContributors;

    public static RepoContext privateRepo() {
        return new RepoContext(false, false);
    }
}
