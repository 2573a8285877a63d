package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.ObjectKind;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ObjectKindArgumentFactory extends AbstractArgumentFactory<ObjectKind> {

    public ObjectKindArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(ObjectKind value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
