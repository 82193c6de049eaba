package com.schemascope.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A mocked JDBC connection answering catalog queries. Each route matches on a fragment of the SQL
 * text; the first matching route answers with the bound parameters in hand.
 */
public class FakeCatalog {

    @FunctionalInterface
    public interface Responder {
        ResultSet respond(String sql, List<Object> parameters) throws SQLException;
    }

    public record Execution(String sql, List<Object> parameters) {}

    private record Route(String fragment, Responder responder) {}

    private final List<Route> routes = new ArrayList<>();
    private final List<Execution> executions = new ArrayList<>();

    public FakeCatalog on(String sqlFragment, Responder responder) {
        routes.add(new Route(sqlFragment, responder));
        return this;
    }

    public FakeCatalog failOn(String sqlFragment, String message) {
        return on(sqlFragment, (sql, params) -> {
            throw new SQLException(message);
        });
    }

    public List<Execution> executions() {
        return executions;
    }

    public long executionsMatching(String fragment) {
        return executions.stream().filter(e -> e.sql().contains(fragment)).count();
    }

    public Connection connection() throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenAnswer(inv -> statement(inv.getArgument(0)));
        return conn;
    }

    private PreparedStatement statement(String sql) throws SQLException {
        PreparedStatement stmt = mock(PreparedStatement.class);
        List<Object> parameters = new ArrayList<>();
        doAnswer(inv -> {
            int index = inv.getArgument(0);
            while (parameters.size() < index) {
                parameters.add(null);
            }
            parameters.set(index - 1, inv.getArgument(1));
            return null;
        }).when(stmt).setObject(anyInt(), any());
        when(stmt.executeQuery()).thenAnswer(inv -> {
            executions.add(new Execution(sql, new ArrayList<>(parameters)));
            for (Route route : routes) {
                if (sql.contains(route.fragment())) {
                    return route.responder().respond(sql, parameters);
                }
            }
            throw new SQLException("No catalog route for query: " + sql);
        });
        return stmt;
    }
}
