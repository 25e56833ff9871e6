package com.rambopet.clinic_backend.util;

import com.rambopet.clinic_backend.exception.ValidationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

public class PaginationUtil {

    private PaginationUtil() {
        // Utility class, no instantiation
    }

    /**
     * Builds a request for a 1-based {@code page}. Both values are checked here so a bad query
     * parameter comes back as a field error instead of failing inside Spring Data.
     */
    public static Pageable pageOf(int page, int limit, Sort sort) {
        if (page < 1) {
            throw ValidationException.of("pagination", "page", "Page must be at least 1");
        }
        return PageRequest.of(page - 1, checkLimit(limit), sort);
    }

    public static Pageable firstPage(int limit) {
        return PageRequest.of(0, checkLimit(limit));
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > Constants.MAX_PAGE_SIZE) {
            throw ValidationException.of("pagination", "limit",
                    "Limit must be between 1 and " + Constants.MAX_PAGE_SIZE);
        }
        return limit;
    }
}
