/**
 * SQLite access for the lifecycle components.
 *
 * <h2>Layers</h2>
 *
 * <pre>
 *   SchemaMigrationEngine / archival / restore
 *        │
 *        ▼
 *   Transactor          ← transaction boundaries, SQLException translation
 *        │
 *        ▼
 *   ConnectionFactory   ← one connection per unit of work, read-only for backups
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * Static statements are externalized to {@code sql/*.sql} and loaded via
 * {@link de.bsommerfeld.canary.db.SqlLoader}:
 * <ul>
 * <li>{@code create-schema-migrations.sql}, {@code add-migration-checksum.sql}
 * - tracking table DDL</li>
 * <li>{@code select-applied-migrations.sql}, {@code insert-migration.sql},
 * {@code delete-migration.sql} - tracking rows</li>
 * <li>{@code create-restore-history.sql}, {@code create-archive-history.sql}
 * - audit tables, also created by migration 1.2.0</li>
 * <li>{@code select-user-tables.sql}, {@code select-table-exists.sql} -
 * schema inspection</li>
 * </ul>
 * Statements over tables only known at runtime are assembled in code with
 * {@link de.bsommerfeld.canary.db.SchemaInspector#quote(String)}.
 */
package de.bsommerfeld.canary.db;
