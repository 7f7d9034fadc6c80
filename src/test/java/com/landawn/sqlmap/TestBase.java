package com.landawn.sqlmap;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public abstract class TestBase {

    private static final AtomicInteger dbCounter = new AtomicInteger();

    /**
     * Keyword arguments from alternating names and values.
     */
    protected static Map<String, Object> kw(final Object... namesAndValues) {
        final Map<String, Object> result = new LinkedHashMap<>();

        for (int i = 0; i < namesAndValues.length; i += 2) {
            result.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }

        return result;
    }

    /**
     * A private in-memory H2 database. Unquoted identifiers are folded to lower case so column labels read like the
     * DDL.
     */
    protected static Connection openH2() throws SQLException {
        return DriverManager.getConnection(newH2Url());
    }

    /**
     * The URL of a new private in-memory H2 database, for tests that open several connections to it. The database
     * lives as long as one connection to it is open.
     */
    protected static String newH2Url() {
        return "jdbc:h2:mem:sqlmap" + dbCounter.incrementAndGet() + ";DATABASE_TO_LOWER=TRUE";
    }
}
