package com.queryhub.domain.service;

import com.queryhub.domain.error.InvalidQueryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryValidatorTest {

    private final QueryValidator validator = new QueryValidator(200);

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT count() FROM events",
            "  select event, count() from events group by event;  ",
            "SELECT * FROM events WHERE event = 'delete account'",
            "-- weekly signups\nSELECT count() FROM events WHERE event = 'signup'",
            "SELECT properties['drop_off'] FROM events",
            "SELECT replaceAll(event, '_', ' ') FROM events WHERE event = 'replace'"
    })
    void testValidate_AcceptsReadOnlyQueries(String query) {
        assertDoesNotThrow(() -> validator.validate(query));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "DELETE FROM events",
            "DROP TABLE persons",
            "SELECT 1; DROP TABLE persons",
            "SELECT 1; SELECT 2",
            "SELECT * FROM events UNION SELECT * FROM persons",
            "SELECT * FROM events WHERE id = '' OR '1'='1'",
            "-- only a comment",
            "/* nothing */",
            "WITH x AS (SELECT 1) INSERT INTO t SELECT * FROM x",
            "SELECT * FROM events INTO OUTFILE '/tmp/x'",
            "SELECT 1 -- DROP TABLE persons",
            "SELECT 1 /* DELETE FROM events */",
            "SELECT replace(event, 'a', 'b') FROM events"
    })
    void testValidate_RejectsUnsafeQueries(String query) {
        assertThrows(InvalidQueryException.class, () -> validator.validate(query));
    }

    @Test
    void testValidate_RejectsNullAndOverlongText() {
        assertThrows(InvalidQueryException.class, () -> validator.validate(null));
        assertThrows(InvalidQueryException.class,
                () -> validator.validate("SELECT " + "x".repeat(200) + " FROM events"));
    }

    @Test
    void testValidate_NamesTheForbiddenKeyword() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> validator.validate("SELECT * FROM events WHERE 1 = 1 AND truncate(x) > 0"));

        assertTrue(e.getMessage().contains("TRUNCATE"));
    }

    @Test
    void testValidate_RejectsKeywordHiddenInComment() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> validator.validate("SELECT count() FROM events -- then REPLACE INTO persons"));

        assertTrue(e.getMessage().contains("REPLACE"));
    }
}
