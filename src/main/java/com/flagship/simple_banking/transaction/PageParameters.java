package com.flagship.simple_banking.transaction;

import com.flagship.simple_banking.exception.ErrorCode;
import com.flagship.simple_banking.exception.ValidationException;
import lombok.Value;

/**
 * Validated limit/offset pair for listing transactions.
 */
@Value
public class PageParameters {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;
    public static final long DEFAULT_OFFSET = 0;

    int limit;
    long offset;

    /**
     * Applies defaults for missing values and rejects anything out of range.
     *
     * @param limit requested page size, null for {@value #DEFAULT_LIMIT}
     * @param offset rows to skip, null for 0
     * @throws ValidationException with {@link ErrorCode#INVALID_PAGINATION}
     */
    public static PageParameters of(Integer limit, Long offset) {
        int resolvedLimit = limit != null ? limit : DEFAULT_LIMIT;
        long resolvedOffset = offset != null ? offset : DEFAULT_OFFSET;

        if (resolvedLimit < 1 || resolvedLimit > MAX_LIMIT) {
            throw new ValidationException(ErrorCode.INVALID_PAGINATION,
                "limit must be between 1 and " + MAX_LIMIT);
        }
        if (resolvedOffset < 0) {
            throw new ValidationException(ErrorCode.INVALID_PAGINATION, "offset must not be negative");
        }
        return new PageParameters(resolvedLimit, resolvedOffset);
    }
}
