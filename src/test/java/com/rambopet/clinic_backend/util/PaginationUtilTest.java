package com.rambopet.clinic_backend.util;

import com.rambopet.clinic_backend.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import static org.junit.jupiter.api.Assertions.*;

class PaginationUtilTest {

    @Test
    void pageIsOneBased() {
        Pageable pageable = PaginationUtil.pageOf(3, 20, Sort.by("name"));

        assertEquals(2, pageable.getPageNumber());
        assertEquals(20, pageable.getPageSize());
        assertEquals(Sort.by("name"), pageable.getSort());
    }

    @Test
    void pageZero_isAFieldErrorOnPage() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> PaginationUtil.pageOf(0, 20, Sort.unsorted()));

        assertEquals("page", ex.getFieldErrors().get(0).getField());
    }

    @Test
    void limitOutOfRange_isAFieldErrorOnLimit() {
        ValidationException zero = assertThrows(ValidationException.class,
                () -> PaginationUtil.pageOf(1, 0, Sort.unsorted()));
        ValidationException tooBig = assertThrows(ValidationException.class,
                () -> PaginationUtil.firstPage(Constants.MAX_PAGE_SIZE + 1));

        assertEquals("limit", zero.getFieldErrors().get(0).getField());
        assertEquals("limit", tooBig.getFieldErrors().get(0).getField());
        assertEquals(Constants.MAX_PAGE_SIZE, PaginationUtil.firstPage(Constants.MAX_PAGE_SIZE).getPageSize());
    }
}
