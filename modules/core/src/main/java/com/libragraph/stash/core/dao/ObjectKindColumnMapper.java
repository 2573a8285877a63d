package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.ObjectKind;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ObjectKindColumnMapper implements ColumnMapper<ObjectKind> {

    @Override
    public ObjectKind map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        short id = r.getShort(columnNumber);
        return r.wasNull() ? null : ObjectKind.fromId(id);
    }
}
