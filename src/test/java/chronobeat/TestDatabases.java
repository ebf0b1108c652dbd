package chronobeat;

import chronobeat.store.Database;

/**
 * Fresh in-memory H2 databases for tests.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;NON_KEYWORDS=MINUTE,HOUR";
    }

    public static Database fresh(String name) {
        return new Database(url(name), 4);
    }
}
