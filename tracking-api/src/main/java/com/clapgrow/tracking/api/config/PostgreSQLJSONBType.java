package com.clapgrow.tracking.api.config;

import org.hibernate.HibernateException;
import org.hibernate.engine.spi.SharedSessionContractImplementor;
import org.hibernate.usertype.UserType;
import org.postgresql.util.PGobject;

import java.io.Serializable;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Objects;

/**
 * Maps a JSON document held as a String onto a PostgreSQL {@code jsonb} column.
 * Used for the sanitized client header subset stored with each tracking event; the
 * retention pass sets the column to null when an event is anonymized.
 */
public class PostgreSQLJSONBType implements UserType<String> {
    
    @Override
    public int getSqlType() {
        return Types.OTHER;
    }

    @Override
    public Class<String> returnedClass() {
        return String.class;
    }

    @Override
    public boolean equals(String x, String y) throws HibernateException {
        return Objects.equals(x, y);
    }

    @Override
    public int hashCode(String x) throws HibernateException {
        return Objects.hashCode(x);
    }

    @Override
    public String nullSafeGet(ResultSet rs, int position, SharedSessionContractImplementor session, Object owner)
            throws SQLException {
        Object column = rs.getObject(position);
        if (column == null) {
            return null;
        }
        if (column instanceof PGobject jsonb) {
            return jsonb.getValue();
        }
        return column.toString();
    }

    @Override
    public void nullSafeSet(PreparedStatement st, String value, int index, SharedSessionContractImplementor session)
            throws HibernateException, SQLException {
        if (value == null || value.isBlank()) {
            st.setNull(index, Types.OTHER);
            return;
        }
        PGobject jsonb = new PGobject();
        jsonb.setType("jsonb");
        jsonb.setValue(value);
        st.setObject(index, jsonb, Types.OTHER);
    }

    @Override
    public String deepCopy(String value) throws HibernateException {
        return value;
    }

    @Override
    public boolean isMutable() {
        return false;
    }

    @Override
    public Serializable disassemble(String value) throws HibernateException {
        return value;
    }

    @Override
    public String assemble(Serializable cached, Object owner) throws HibernateException {
        return (String) cached;
    }

    @Override
    public String replace(String original, String target, Object owner) throws HibernateException {
        return original;
    }
}

