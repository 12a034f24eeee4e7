package com.datagate.sql;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executes read queries.
 */
public interface SqlBackend {

    /**
     * Execute a query.
     *
     * @param query sql text
     * @return rows, each a column-name to value map in select order
     * @throws SchemaException when the query does not fit the schema
     * @throws SQLException on any other database error
     */
    List<Map<String, Object>> execute(String query) throws SchemaException, SQLException;
}
