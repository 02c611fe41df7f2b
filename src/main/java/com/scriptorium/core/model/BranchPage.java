package com.scriptorium.core.model;

import java.util.List;

public record BranchPage(
    List<BranchSummary> branches,
    int totalCount,
    int page,
    int size,
    boolean hasNext,
    boolean hasPrevious
) {
    public static BranchPage of(List<BranchSummary> branches, int totalCount, int page, int size) {
        return new BranchPage(List.copyOf(branches), totalCount, page, size,
                (long) page * size < totalCount, page > 1);
    }
}
