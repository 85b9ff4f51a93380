package io.github.yok.csvimporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.ColumnType;
import io.github.yok.csvimporter.schema.TableSchema;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SchemaReconcilerTest {

    private final SchemaReconciler reconciler = new SchemaReconciler();

    private final TableSchema desired = new TableSchema("PUBLIC", "orders",
            List.of(ColumnDefinition.inferred("id", "id", ColumnType.smallInt()),
                    ColumnDefinition.inferred("name", "Name ", ColumnType.varchar(16))));

    @Test
    void reconcile_正常ケース_テーブルなし_新規作成計画になること() {
        for (ConflictPolicy policy : ConflictPolicy.values()) {
            ReconciledPlan plan = reconciler.reconcile(desired, Optional.empty(), policy);
            assertEquals(ReconciledPlan.Action.CREATE_NEW, plan.getAction());
            assertSame(desired, plan.getTarget());
            assertTrue(plan.requiresCreate());
            assertFalse(plan.isDestructive());
        }
    }

    @Test
    void reconcile_異常ケース_FAILで既存テーブルあり_TableExistsExceptionが送出されること() {
        TableExistsException ex = assertThrows(TableExistsException.class,
                () -> reconciler.reconcile(desired, Optional.of(existing()), ConflictPolicy.FAIL));
        assertEquals("PUBLIC.orders", ex.getTable());
        assertTrue(ex.getMessage().contains("PUBLIC.orders"));
    }

    @Test
    void reconcile_正常ケース_REPLACEで既存テーブルあり_破壊的な再作成計画になること() {
        ReconciledPlan plan =
                reconciler.reconcile(desired, Optional.of(existing()), ConflictPolicy.REPLACE);
        assertEquals(ReconciledPlan.Action.DROP_AND_RECREATE, plan.getAction());
        assertTrue(plan.isDestructive());
        assertTrue(plan.requiresCreate());
        assertEquals(desired.getColumns(), plan.getInsertColumns());
    }

    @Test
    void reconcile_正常ケース_APPENDで互換あり_既存列順と既存型で挿入列が決まること() {
        ReconciledPlan plan =
                reconciler.reconcile(desired, Optional.of(existing()), ConflictPolicy.APPEND);

        assertEquals(ReconciledPlan.Action.APPEND_INTO, plan.getAction());
        assertFalse(plan.requiresCreate());
        List<ColumnDefinition> columns = plan.getInsertColumns();
        assertEquals(2, columns.size());
        assertEquals("NAME", columns.get(0).getName());
        assertEquals("Name ", columns.get(0).getSourceName());
        assertEquals(ColumnType.varchar(100), columns.get(0).getType());
        assertEquals("ID", columns.get(1).getName());
        assertEquals("id", columns.get(1).getSourceName());
        assertEquals(ColumnType.integer(), columns.get(1).getType());
    }

    @Test
    void reconcile_異常ケース_APPENDで列が存在しない_欠落列名を含むSchemaMismatchExceptionが送出されること() {
        TableSchema withEmail = new TableSchema("PUBLIC", "orders",
                List.of(ColumnDefinition.inferred("id", "id", ColumnType.smallInt()),
                        ColumnDefinition.inferred("email", "email", ColumnType.varchar(64))));
        SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
                () -> reconciler.reconcile(withEmail, Optional.of(existing()),
                        ConflictPolicy.APPEND));
        assertEquals("email", ex.getColumn());
        assertEquals("VARCHAR(64)", ex.getDesiredType());
        assertNull(ex.getExistingType());
        assertTrue(ex.getMessage().contains("email"));
    }

    @Test
    void reconcile_異常ケース_APPENDで型が狭い_既存型を含むSchemaMismatchExceptionが送出されること() {
        TableSchema textId = new TableSchema("PUBLIC", "orders",
                List.of(ColumnDefinition.inferred("id", "id", ColumnType.varchar(32))));
        SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
                () -> reconciler.reconcile(textId, Optional.of(existing()),
                        ConflictPolicy.APPEND));
        assertEquals("id", ex.getColumn());
        assertEquals("INT", ex.getExistingType());
    }

    @Test
    void reconcile_異常ケース_APPENDで既存列の型が未対応_宣言型名を含むSchemaMismatchExceptionが送出されること() {
        TableSchema geo = new TableSchema("PUBLIC", "places",
                List.of(ColumnDefinition.inferred("shape", "shape", ColumnType.varchar(64))));
        TableSchema existing = new TableSchema("PUBLIC", "places",
                List.of(ColumnDefinition.existing("SHAPE", null, "GEOMETRY")));
        SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
                () -> reconciler.reconcile(geo, Optional.of(existing), ConflictPolicy.APPEND));
        assertEquals("GEOMETRY", ex.getExistingType());
    }

    @Test
    void reconcile_正常ケース_APPENDでサンプルが全て空値の列_数値型の既存列に挿入されること() {
        TableSchema emptyQty = new TableSchema("PUBLIC", "stock",
                List.of(ColumnDefinition.inferred("id", "id", ColumnType.smallInt()),
                        ColumnDefinition.untyped("qty", "qty", ColumnType.varchar(255))));
        TableSchema existing = new TableSchema("PUBLIC", "stock",
                List.of(ColumnDefinition.existing("ID", ColumnType.integer(), "INTEGER"),
                        ColumnDefinition.existing("QTY", ColumnType.integer(), "INTEGER")));

        ReconciledPlan plan =
                reconciler.reconcile(emptyQty, Optional.of(existing), ConflictPolicy.APPEND);

        assertEquals(ColumnType.integer(), plan.getInsertColumns().get(1).getType());
        assertEquals("qty", plan.getInsertColumns().get(1).getSourceName());
    }

    @Test
    void reconcile_正常ケース_APPENDで推論無効の列_既存の数値型と文字列型にそのまま挿入されること() {
        TableSchema untyped = new TableSchema("PUBLIC", "orders",
                List.of(ColumnDefinition.untyped("id", "id", ColumnType.varcharMax()),
                        ColumnDefinition.untyped("name", "Name ", ColumnType.varcharMax())));

        ReconciledPlan plan =
                reconciler.reconcile(untyped, Optional.of(existing()), ConflictPolicy.APPEND);

        List<ColumnDefinition> columns = plan.getInsertColumns();
        assertEquals(ColumnType.varchar(100), columns.get(0).getType());
        assertEquals(ColumnType.integer(), columns.get(1).getType());
    }

    @Test
    void reconcile_異常ケース_APPENDで未対応型の既存列に推論無効の列_SchemaMismatchExceptionが送出されること() {
        TableSchema untyped = new TableSchema("PUBLIC", "gauges",
                List.of(ColumnDefinition.untyped("v", "v", ColumnType.varcharMax())));
        TableSchema existing = new TableSchema("PUBLIC", "gauges",
                List.of(ColumnDefinition.existing("V", null, "TINYINT")));

        SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
                () -> reconciler.reconcile(untyped, Optional.of(existing), ConflictPolicy.APPEND));
        assertEquals("TINYINT", ex.getExistingType());
    }

    private static TableSchema existing() {
        return new TableSchema("PUBLIC", "orders",
                List.of(ColumnDefinition.existing("NAME", ColumnType.varchar(100), "VARCHAR"),
                        ColumnDefinition.existing("CREATED", ColumnType.date(), "DATE"),
                        ColumnDefinition.existing("ID", ColumnType.integer(), "INTEGER")));
    }
}
