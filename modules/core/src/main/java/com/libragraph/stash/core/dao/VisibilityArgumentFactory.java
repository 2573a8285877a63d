package com.libragraph.stash.core.dao;

import com.libragraph.stash.types.Visibility;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class VisibilityArgumentFactory extends AbstractArgumentFactory<Visibility> {

    public VisibilityArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(Visibility value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
