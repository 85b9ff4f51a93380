package io.github.yok.csvimporter.db.postgresql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.schema.ColumnType;
import java.sql.Types;
import org.junit.jupiter.api.Test;

class PostgresqlDialectHandlerTest {

    private final PostgresqlDialectHandler handler = new PostgresqlDialectHandler();

    @Test
    void toSqlType_正常ケース_各列型_PostgreSQLの型名になること() {
        assertEquals("TEXT", handler.toSqlType(ColumnType.varcharMax()));
        assertEquals("TIMESTAMP(6)", handler.toSqlType(ColumnType.dateTimeWithFraction()));
        assertEquals("NUMERIC(38, 0)", handler.toSqlType(ColumnType.decimal(38, 0)));
        assertEquals("VARCHAR(255)", handler.toSqlType(ColumnType.varchar(255)));
    }

    @Test
    void fromJdbcType_正常ケース_text型と未対応型_長文とnullになること() {
        assertEquals(ColumnType.varcharMax(),
                handler.fromJdbcType(Types.VARCHAR, "text", Integer.MAX_VALUE, 0));
        assertEquals(ColumnType.booleanType(), handler.fromJdbcType(Types.BIT, "bool", 1, 0));
        assertNull(handler.fromJdbcType(Types.OTHER, "jsonb", 0, 0));
    }

    @Test
    void resolveSchema_正常ケース_任意の接続_publicが返ること() {
        assertEquals("public", handler.resolveSchema(new ConnectionConfig.Entry()));
        assertTrue(handler.getIdentifierRules().isReserved("offset"));
        assertEquals(63, handler.getIdentifierRules().getMaxLength());
    }
}
