package com.cred.freestyle.warranty.domain.model;

import java.util.List;

/**
 * Outcome of a bulk import.
 *
 * Every non-blank input entry ends up in exactly one place: counted in
 * {@code addedCount}, listed in {@code duplicatesFound}, or described in
 * {@code errors}. In-batch repeats collapse onto their first occurrence.
 *
 * @author Warranty Platform Team
 */
public class BulkImportResult {

    private final Long productId;
    private final int addedCount;
    private final List<String> duplicatesFound;
    private final List<String> errors;

    public BulkImportResult(Long productId, int addedCount, List<String> duplicatesFound, List<String> errors) {
        this.productId = productId;
        this.addedCount = addedCount;
        this.duplicatesFound = List.copyOf(duplicatesFound);
        this.errors = List.copyOf(errors);
    }

    public Long getProductId() {
        return productId;
    }

    public int getAddedCount() {
        return addedCount;
    }

    public List<String> getDuplicatesFound() {
        return duplicatesFound;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean isEmpty() {
        return addedCount == 0 && duplicatesFound.isEmpty() && errors.isEmpty();
    }

    public boolean hasProblems() {
        return !duplicatesFound.isEmpty() || !errors.isEmpty();
    }
}
